package com.intellivuln.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Результат приоритизации одной уязвимости
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriorityPrediction {
    private String vulnerabilityId;
    private String modelId;
    private double priorityScore;
    private PriorityClass priorityClass;
    private double confidence;

    /**
     * Вклад признаков: важность, умноженная на фактическое значение
     */
    @Builder.Default
    private Map<String, Double> featureContributions = new LinkedHashMap<>();
    private String explanation;
    private String recommendedAction;
}
