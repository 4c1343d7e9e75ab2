package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Класс приоритета, выводимый из оценки модели
 */
public enum PriorityClass {
    CRITICAL("critical", 0.8,
        "Требуется немедленное устранение. Создайте задачу высокого приоритета и установите исправление в течение 24 часов."),
    HIGH("high", 0.6,
        "Устранить в течение 7 дней. Создайте задачу и запланируйте установку исправления."),
    MEDIUM("medium", 0.4,
        "Устранить в течение 30 дней. Включите в следующий цикл обновлений."),
    LOW("low", 0.0,
        "Устранить в рамках планового обслуживания. Немедленных действий не требуется.");

    private final String value;
    private final double threshold;
    private final String recommendedAction;

    PriorityClass(String value, double threshold, String recommendedAction) {
        this.value = value;
        this.threshold = threshold;
        this.recommendedAction = recommendedAction;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public double getThreshold() {
        return threshold;
    }

    public String getRecommendedAction() {
        return recommendedAction;
    }

    /**
     * score >= 0.8 critical, >= 0.6 high, >= 0.4 medium, иначе low
     */
    public static PriorityClass fromScore(double score) {
        if (score >= CRITICAL.threshold) {
            return CRITICAL;
        }
        if (score >= HIGH.threshold) {
            return HIGH;
        }
        if (score >= MEDIUM.threshold) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonCreator
    public static PriorityClass fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (PriorityClass priorityClass : values()) {
            if (priorityClass.value.equals(normalized)) {
                return priorityClass;
            }
        }
        return null;
    }
}
