package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Периодичность сканирования. Хранится, планировщик не реализован.
 */
public enum ScanFrequency {
    ONCE("once"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String value;

    ScanFrequency(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ScanFrequency fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return ONCE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ScanFrequency frequency : values()) {
            if (frequency.value.equals(normalized)) {
                return frequency;
            }
        }
        return ONCE;
    }
}
