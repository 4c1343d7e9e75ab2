package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Поддерживаемые виды сканеров
 */
public enum ScannerKind {
    TRIVY("trivy"),
    OPENVAS("openvas"),
    DEPENDENCY_CHECK("dependency-check"),
    CUSTOM("custom");

    private final String value;

    ScannerKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Разрешить объявленное имя сканера. Пустой Optional означает неподдерживаемый сканер.
     */
    public static Optional<ScannerKind> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if ("dependencycheck".equals(normalized) || "owasp-dependency-check".equals(normalized)) {
            return Optional.of(DEPENDENCY_CHECK);
        }
        for (ScannerKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
