package com.intellivuln.persistence;

import com.intellivuln.models.TrainedModel;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public class InMemoryTrainedModelRepository implements TrainedModelRepository {

    private final InMemoryStore<TrainedModel> store =
        new InMemoryStore<>("Модель", TrainedModel::getId, TrainedModel::copy);

    @Override
    public TrainedModel save(TrainedModel model) {
        return store.save(model);
    }

    @Override
    public Optional<TrainedModel> findById(String id) {
        return store.findById(id);
    }

    @Override
    public List<TrainedModel> findAll() {
        List<TrainedModel> models = store.find(model -> true);
        models.sort(Comparator.comparing(TrainedModel::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return models;
    }

    @Override
    public TrainedModel update(String id, UnaryOperator<TrainedModel> mutation) {
        return store.update(id, mutation);
    }

    @Override
    public boolean delete(String id) {
        return store.delete(id);
    }

    @Override
    public Optional<TrainedModel> findLatestTrained() {
        return store.find(TrainedModel::isUsable).stream()
            .max(Comparator.comparing(InMemoryTrainedModelRepository::lastChange, Comparator.nullsFirst(Comparator.naturalOrder())));
    }

    private static LocalDateTime lastChange(TrainedModel model) {
        return model.getUpdatedAt() != null ? model.getUpdatedAt() : model.getTrainingDate();
    }
}
