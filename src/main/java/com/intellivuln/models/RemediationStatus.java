package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Статус устранения уязвимости
 */
public enum RemediationStatus {
    OPEN("open"),
    IN_PROGRESS("in_progress"),
    RESOLVED("resolved"),
    CLOSED("closed"),
    FALSE_POSITIVE("false_positive"),
    ACCEPTED_RISK("accepted_risk");

    private final String value;

    RemediationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RemediationStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return OPEN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (RemediationStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return OPEN;
    }
}
