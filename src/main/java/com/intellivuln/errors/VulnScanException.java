package com.intellivuln.errors;

/**
 * Базовое исключение движка
 */
public class VulnScanException extends RuntimeException {

    public VulnScanException(String message) {
        super(message);
    }

    public VulnScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
