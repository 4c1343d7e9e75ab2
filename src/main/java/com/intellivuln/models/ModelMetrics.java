package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Метрики качества модели на отложенной выборке
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelMetrics {
    private double accuracy;
    private double precision;
    private double recall;
    private double f1Score;

    /**
     * Матрица ошибок 2x2: строки - истинный класс, столбцы - предсказанный
     */
    private int[][] confusionMatrix;

    /**
     * ROC-AUC, null если в тестовой выборке только один класс
     */
    private Double rocAuc;

    private int datasetSize;
    private int trainingSize;
    private int testSize;
}
