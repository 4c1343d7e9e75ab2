package com.intellivuln.errors;

/**
 * Нет обученной модели для приоритизации
 */
public class NoTrainedModelException extends VulnScanException {

    public NoTrainedModelException(String message) {
        super(message);
    }
}
