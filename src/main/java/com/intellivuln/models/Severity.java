package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Уровни критичности уязвимостей
 */
public enum Severity {
    CRITICAL("critical", "Критический", 4),
    HIGH("high", "Высокий", 3),
    MEDIUM("medium", "Средний", 2),
    LOW("low", "Низкий", 1);

    private final String value;
    private final String russianName;
    private final int priority;

    Severity(String value, String russianName, int priority) {
        this.value = value;
        this.russianName = russianName;
        this.priority = priority;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String getRussianName() {
        return russianName;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Строгий разбор: только значения домена, иначе null
     */
    @JsonCreator
    public static Severity fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.value.equals(normalized)) {
                return severity;
            }
        }
        return null;
    }

    /**
     * Приведение значения сканера к ближайшему уровню.
     * Возвращает null, если значение не распознано.
     */
    public static Severity coerce(String raw) {
        Severity exact = fromValue(raw);
        if (exact != null) {
            return exact;
        }
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "crit", "severe", "urgent" -> CRITICAL;
            case "important", "error", "serious" -> HIGH;
            case "moderate", "med", "warning", "warn" -> MEDIUM;
            case "info", "informational", "negligible", "log", "minor", "note", "none" -> LOW;
            default -> null;
        };
    }

    /**
     * Уровень по CVSS v3 (NVD qualitative rating)
     */
    public static Severity fromCvss(double score) {
        if (score >= 9.0) {
            return CRITICAL;
        }
        if (score >= 7.0) {
            return HIGH;
        }
        if (score >= 4.0) {
            return MEDIUM;
        }
        return LOW;
    }
}
