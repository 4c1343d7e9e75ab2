package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Сетевая доступность затронутой системы
 */
public enum SystemExposure implements CategoricalAttribute {
    INTERNET("internet"),
    INTRANET("intranet"),
    INTERNAL("internal"),
    ISOLATED("isolated"),
    UNKNOWN("");

    private final String value;

    SystemExposure(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SystemExposure fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "internet", "internet-facing", "external", "public" -> INTERNET;
            case "intranet", "corporate" -> INTRANET;
            case "internal", "private" -> INTERNAL;
            case "isolated", "air-gapped", "airgapped", "offline" -> ISOLATED;
            default -> UNKNOWN;
        };
    }
}
