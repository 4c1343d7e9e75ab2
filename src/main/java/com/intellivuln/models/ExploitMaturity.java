package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Зрелость эксплойта
 */
public enum ExploitMaturity implements CategoricalAttribute {
    UNPROVEN("unproven"),
    POC("poc"),
    FUNCTIONAL("functional"),
    HIGH("high"),
    UNKNOWN("");

    private final String value;

    ExploitMaturity(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ExploitMaturity fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "unproven", "unreported", "theoretical" -> UNPROVEN;
            case "poc", "proof-of-concept", "proof_of_concept", "proof of concept" -> POC;
            case "functional", "working" -> FUNCTIONAL;
            case "high", "weaponized", "attacked", "active" -> HIGH;
            default -> UNKNOWN;
        };
    }
}
