package com.intellivuln.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intellivuln.models.ScanResults;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Objects;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void generate(ScanResults results, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);

        // КРИТИЧНО: Защита от NPE
        if (results == null) {
            throw new IllegalArgumentException("ScanResults не может быть null");
        }

        String json = render(results);
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
        Files.writeString(outputPath, json);

        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    /**
     * JSON-представление результатов
     */
    public String render(ScanResults results) throws IOException {
        return objectMapper.writeValueAsString(sanitize(results));
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    private ScanResults sanitize(ScanResults results) {
        if (results.getVulnerabilities() == null) {
            results.setVulnerabilities(new ArrayList<>());
        }
        results.getVulnerabilities().removeIf(Objects::isNull);
        results.getVulnerabilities().forEach(summary -> {
            Double score = summary.getPriorityScore();
            if (score != null && (Double.isNaN(score) || Double.isInfinite(score))) {
                summary.setPriorityScore(null);
            }
        });
        return results;
    }
}
