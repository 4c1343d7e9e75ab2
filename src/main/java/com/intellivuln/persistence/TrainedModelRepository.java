package com.intellivuln.persistence;

import com.intellivuln.models.TrainedModel;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Хранилище моделей приоритизации
 */
public interface TrainedModelRepository {

    TrainedModel save(TrainedModel model);

    Optional<TrainedModel> findById(String id);

    List<TrainedModel> findAll();

    TrainedModel update(String id, UnaryOperator<TrainedModel> mutation);

    boolean delete(String id);

    /**
     * Последняя по времени обновления модель в статусе trained с payload
     */
    Optional<TrainedModel> findLatestTrained();
}
