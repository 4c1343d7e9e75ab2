package com.intellivuln.errors;

/**
 * Операция недопустима в текущем состоянии сущности
 */
public class InvalidOperationException extends VulnScanException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
