package com.intellivuln.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intellivuln.models.TrainedModel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Артефакты моделей в каталоге: model-&lt;id&gt;.bin и model-&lt;id&gt;_metadata.json.
 * Запись идет во временный файл с последующим атомарным переносом.
 */
@Slf4j
public class FileSystemModelArtifactStore implements ModelArtifactStore {

    private static final String PREFIX = "model-";
    private static final String PAYLOAD_SUFFIX = ".bin";
    private static final String METADATA_SUFFIX = "_metadata.json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSystemModelArtifactStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void store(TrainedModel model) throws IOException {
        if (model == null || model.getId() == null) {
            throw new IllegalArgumentException("Модель и ее идентификатор обязательны");
        }
        if (!model.hasPayload()) {
            throw new IllegalArgumentException("У модели " + model.getId() + " нет payload");
        }
        Files.createDirectories(directory);
        writeAtomically(payloadPath(model.getId()), model.getPayload());
        writeAtomically(metadataPath(model.getId()), objectMapper.writeValueAsBytes(model));
        log.info("Артефакт модели {} сохранен в {}", model.getId(), directory);
    }

    @Override
    public Optional<byte[]> loadPayload(String modelId) throws IOException {
        Path path = payloadPath(modelId);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(Files.readAllBytes(path));
    }

    @Override
    public Optional<TrainedModel> loadMetadata(String modelId) throws IOException {
        Path path = metadataPath(modelId);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(path.toFile(), TrainedModel.class));
    }

    @Override
    public List<TrainedModel> loadAll() throws IOException {
        List<TrainedModel> models = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return models;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, PREFIX + "*" + METADATA_SUFFIX)) {
            for (Path metadataFile : stream) {
                String fileName = metadataFile.getFileName().toString();
                String id = fileName.substring(PREFIX.length(), fileName.length() - METADATA_SUFFIX.length());
                try {
                    Optional<TrainedModel> metadata = loadMetadata(id);
                    Optional<byte[]> payload = loadPayload(id);
                    if (metadata.isEmpty() || payload.isEmpty()) {
                        log.warn("Неполный артефакт модели {}, пропускаем", id);
                        continue;
                    }
                    TrainedModel model = metadata.get();
                    model.setPayload(payload.get());
                    models.add(model);
                } catch (IOException e) {
                    log.warn("Не удалось прочитать артефакт модели {}: {}", id, e.getMessage());
                }
            }
        }
        return models;
    }

    @Override
    public boolean delete(String modelId) throws IOException {
        boolean payload = Files.deleteIfExists(payloadPath(modelId));
        boolean metadata = Files.deleteIfExists(metadataPath(modelId));
        return payload || metadata;
    }

    Path payloadPath(String modelId) {
        return directory.resolve(PREFIX + modelId + PAYLOAD_SUFFIX);
    }

    Path metadataPath(String modelId) {
        return directory.resolve(PREFIX + modelId + METADATA_SUFFIX);
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
