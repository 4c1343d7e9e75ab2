package com.intellivuln.persistence;

import com.intellivuln.models.TrainedModel;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Хранилище артефактов модели: бинарный payload и JSON-метаданные рядом с ним
 */
public interface ModelArtifactStore {

    /**
     * Сохранить payload и метаданные модели. Частично записанный артефакт не остается.
     */
    void store(TrainedModel model) throws IOException;

    Optional<byte[]> loadPayload(String modelId) throws IOException;

    /**
     * Метаданные модели без payload
     */
    Optional<TrainedModel> loadMetadata(String modelId) throws IOException;

    /**
     * Все сохраненные модели вместе с payload
     */
    List<TrainedModel> loadAll() throws IOException;

    boolean delete(String modelId) throws IOException;
}
