package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Статус обучаемой модели
 */
public enum ModelStatus {
    CREATED("created"),
    TRAINING("training"),
    TRAINED("trained"),
    ERROR("error");

    private final String value;

    ModelStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
