package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Тип цели сканирования
 */
public enum TargetType {
    CONTAINER("container"),
    HOST("host"),
    APPLICATION("application"),
    REPOSITORY("repository");

    private final String value;

    TargetType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @return тип цели или null, если значение не распознано
     */
    @JsonCreator
    public static TargetType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TargetType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
