package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Влияние на бизнес
 */
public enum BusinessImpact implements CategoricalAttribute {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    UNKNOWN("");

    private final String value;

    BusinessImpact(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static BusinessImpact fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "critical", "crit", "severe" -> CRITICAL;
            case "high", "important" -> HIGH;
            case "medium", "moderate", "med" -> MEDIUM;
            case "low", "minor", "negligible" -> LOW;
            default -> UNKNOWN;
        };
    }
}
