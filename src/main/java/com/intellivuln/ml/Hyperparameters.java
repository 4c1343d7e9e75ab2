package com.intellivuln.ml;

import com.intellivuln.errors.ConfigurationException;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Гиперпараметры градиентного бустинга. Ключи карты: n_estimators, max_depth, max_nodes,
 * node_size, learning_rate, subsample.
 */
@Data
@Builder
public class Hyperparameters {

    public static final String N_ESTIMATORS = "n_estimators";
    public static final String MAX_DEPTH = "max_depth";
    public static final String MAX_NODES = "max_nodes";
    public static final String NODE_SIZE = "node_size";
    public static final String LEARNING_RATE = "learning_rate";
    public static final String SUBSAMPLE = "subsample";

    @Builder.Default
    private int nEstimators = 100;
    @Builder.Default
    private int maxDepth = 3;
    @Builder.Default
    private int maxNodes = 8;
    @Builder.Default
    private int nodeSize = 5;
    @Builder.Default
    private double learningRate = 0.1;
    @Builder.Default
    private double subsample = 1.0;

    public static Hyperparameters defaults() {
        return Hyperparameters.builder().build();
    }

    /**
     * Наложить значения из карт по порядку (поздние перекрывают ранние) на значения по умолчанию
     *
     * @throws ConfigurationException при неверном значении
     */
    @SafeVarargs
    public static Hyperparameters resolve(Map<String, Object>... layers) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Map<String, Object> layer : layers) {
            if (layer != null) {
                merged.putAll(layer);
            }
        }
        Hyperparameters defaults = defaults();
        Hyperparameters result = Hyperparameters.builder()
            .nEstimators(intValue(merged, N_ESTIMATORS, defaults.nEstimators))
            .maxDepth(intValue(merged, MAX_DEPTH, defaults.maxDepth))
            .maxNodes(intValue(merged, MAX_NODES, defaults.maxNodes))
            .nodeSize(intValue(merged, NODE_SIZE, defaults.nodeSize))
            .learningRate(doubleValue(merged, LEARNING_RATE, defaults.learningRate))
            .subsample(doubleValue(merged, SUBSAMPLE, defaults.subsample))
            .build();
        result.validate();
        return result;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(N_ESTIMATORS, nEstimators);
        map.put(MAX_DEPTH, maxDepth);
        map.put(MAX_NODES, maxNodes);
        map.put(NODE_SIZE, nodeSize);
        map.put(LEARNING_RATE, learningRate);
        map.put(SUBSAMPLE, subsample);
        return map;
    }

    private void validate() {
        if (nEstimators < 1) {
            throw new ConfigurationException(N_ESTIMATORS + " должен быть >= 1: " + nEstimators);
        }
        if (maxDepth < 1) {
            throw new ConfigurationException(MAX_DEPTH + " должен быть >= 1: " + maxDepth);
        }
        if (maxNodes < 2) {
            throw new ConfigurationException(MAX_NODES + " должен быть >= 2: " + maxNodes);
        }
        if (nodeSize < 1) {
            throw new ConfigurationException(NODE_SIZE + " должен быть >= 1: " + nodeSize);
        }
        if (learningRate <= 0.0 || learningRate > 1.0) {
            throw new ConfigurationException(LEARNING_RATE + " должен быть в (0, 1]: " + learningRate);
        }
        if (subsample <= 0.0 || subsample > 1.0) {
            throw new ConfigurationException(SUBSAMPLE + " должен быть в (0, 1]: " + subsample);
        }
    }

    private static int intValue(Map<String, Object> values, String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            if (number.doubleValue() != Math.rint(number.doubleValue())) {
                throw new ConfigurationException(key + " должен быть целым: " + value);
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Некорректное значение " + key + ": " + value, e);
        }
    }

    private static double doubleValue(Map<String, Object> values, String key, double defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Некорректное значение " + key + ": " + value, e);
        }
    }
}
