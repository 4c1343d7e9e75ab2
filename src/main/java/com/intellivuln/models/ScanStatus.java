package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Статус жизненного цикла сканирования
 */
public enum ScanStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    STOPPED("stopped");

    private final String value;

    ScanStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Из терминальных состояний переходов нет
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }
}
