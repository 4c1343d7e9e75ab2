package com.intellivuln.errors;

/**
 * Ошибка данных модели: пустой или вырожденный датасет, нет метаданных признаков, нечитаемый payload
 */
public class ModelDataException extends VulnScanException {

    public ModelDataException(String message) {
        super(message);
    }

    public ModelDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
