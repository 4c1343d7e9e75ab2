package com.intellivuln.ml;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intellivuln.errors.ModelDataException;
import com.intellivuln.models.Vulnerability;
import com.intellivuln.normalization.FindingNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Обучающая выборка из исторических уязвимостей.
 *
 * <p>JSON-формат: массив (или {"records": [...]}) объектов с полями канонической находки
 * и меткой priority_score (0..1, значения больше 1 считаются шкалой 0..10) и/или urgent.</p>
 */
@Slf4j
public class TrainingDataset {

    private final List<TrainingRecord> records;

    public TrainingDataset(List<TrainingRecord> records) {
        this.records = records != null ? List.copyOf(records) : List.of();
    }

    public List<TrainingRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    /**
     * Выборка из сохраненных уязвимостей с оценкой приоритета; записи без оценки пропускаются
     */
    public static TrainingDataset fromVulnerabilities(List<Vulnerability> vulnerabilities) {
        List<TrainingRecord> records = new ArrayList<>();
        if (vulnerabilities == null) {
            return new TrainingDataset(records);
        }
        for (Vulnerability vulnerability : vulnerabilities) {
            if (vulnerability == null || vulnerability.getPriorityScore() == null) {
                continue;
            }
            records.add(TrainingRecord.builder()
                .vulnerability(vulnerability)
                .priorityScore(vulnerability.getPriorityScore())
                .build());
        }
        return new TrainingDataset(records);
    }

    public static TrainingDataset load(Path path, FindingNormalizer normalizer) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ModelDataException("Файл обучающей выборки не найден: " + path);
        }
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonNode root = mapper.readTree(path.toFile());
            JsonNode items = root.isArray() ? root : root.path("records");
            if (!items.isArray()) {
                throw new ModelDataException("Ожидался JSON-массив записей: " + path);
            }
            List<TrainingRecord> records = new ArrayList<>();
            int index = 0;
            for (JsonNode item : items) {
                index++;
                if (!item.isObject()) {
                    log.warn("Запись {} в {} не является объектом, пропускаем", index, path);
                    continue;
                }
                Map<String, Object> raw = mapper.convertValue(item, new TypeReference<Map<String, Object>>() { });
                records.add(TrainingRecord.builder()
                    .vulnerability(normalizer.normalizeOne(raw, null, null))
                    .priorityScore(priorityScore(item.get("priority_score")))
                    .urgent(item.hasNonNull("urgent") ? item.get("urgent").asBoolean() : null)
                    .build());
            }
            log.info("Загружено {} записей обучающей выборки из {}", records.size(), path);
            return new TrainingDataset(records);
        } catch (IOException e) {
            throw new ModelDataException("Ошибка чтения обучающей выборки " + path + ": " + e.getMessage(), e);
        }
    }

    private static Double priorityScore(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double score = node.isNumber() ? node.asDouble() : FindingNormalizer.parseCvss(node.asText());
        return score > 1.0 ? Math.min(score, 10.0) / 10.0 : Math.max(score, 0.0);
    }
}
