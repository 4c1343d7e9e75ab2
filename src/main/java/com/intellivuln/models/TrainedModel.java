package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Обученная (или обучаемая) модель приоритизации.
 * Список признаков неизменяем после появления payload.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrainedModel {
    private String id;
    private String name;
    private String description;

    @Builder.Default
    private String modelType = "gradient_boosting";

    @Builder.Default
    private String version = "1.0.0";

    @Builder.Default
    private List<String> featureNames = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> hyperparameters = new LinkedHashMap<>();

    private ModelMetrics metrics;

    @Builder.Default
    private List<FeatureImportance> featureImportance = new ArrayList<>();

    /**
     * Сериализованная модель. Хранится отдельно от метаданных.
     */
    @JsonIgnore
    @ToString.Exclude
    private byte[] payload;

    @Builder.Default
    private ModelStatus status = ModelStatus.CREATED;
    private String statusMessage;

    private LocalDateTime trainingDate;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @JsonIgnore
    public boolean hasPayload() {
        return payload != null && payload.length > 0;
    }

    @JsonIgnore
    public boolean isUsable() {
        return status == ModelStatus.TRAINED && hasPayload();
    }

    /**
     * Важность признака по имени, 0 если неизвестен
     */
    public double importanceOf(String feature) {
        if (featureImportance == null) {
            return 0.0;
        }
        for (FeatureImportance item : featureImportance) {
            if (item.getFeature().equals(feature)) {
                return item.getImportance();
            }
        }
        return 0.0;
    }

    public TrainedModel copy() {
        List<FeatureImportance> importances = new ArrayList<>();
        if (featureImportance != null) {
            for (FeatureImportance item : featureImportance) {
                importances.add(new FeatureImportance(item.getFeature(), item.getImportance(), item.getDescription()));
            }
        }
        return toBuilder()
            .featureNames(featureNames != null ? new ArrayList<>(featureNames) : new ArrayList<>())
            .hyperparameters(hyperparameters != null ? new LinkedHashMap<>(hyperparameters) : new LinkedHashMap<>())
            .featureImportance(importances)
            .payload(payload != null ? payload.clone() : null)
            .build();
    }
}
