package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Классификация данных затронутой системы
 */
public enum DataClassification implements CategoricalAttribute {
    RESTRICTED("restricted"),
    CONFIDENTIAL("confidential"),
    INTERNAL("internal"),
    PUBLIC("public"),
    UNKNOWN("");

    private final String value;

    DataClassification(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DataClassification fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "restricted", "secret", "top-secret" -> RESTRICTED;
            case "confidential", "sensitive", "private" -> CONFIDENTIAL;
            case "internal", "internal-use" -> INTERNAL;
            case "public", "open" -> PUBLIC;
            default -> UNKNOWN;
        };
    }
}
