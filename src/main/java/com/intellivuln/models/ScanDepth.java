package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Глубина сканирования
 */
public enum ScanDepth {
    QUICK("quick"),
    NORMAL("normal"),
    DEEP("deep");

    private final String value;

    ScanDepth(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ScanDepth fromValue(String raw) {
        ScanDepth depth = parse(raw);
        return depth != null ? depth : NORMAL;
    }

    /**
     * Строгий разбор: null для пустого или нераспознанного значения
     */
    public static ScanDepth parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "quick", "fast" -> QUICK;
            case "normal", "standard" -> NORMAL;
            case "deep", "full" -> DEEP;
            default -> null;
        };
    }
}
