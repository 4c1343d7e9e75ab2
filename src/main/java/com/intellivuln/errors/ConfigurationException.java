package com.intellivuln.errors;

/**
 * Неверная конфигурация: неизвестный сканер, отсутствующие поля цели, некорректные гиперпараметры
 */
public class ConfigurationException extends VulnScanException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
