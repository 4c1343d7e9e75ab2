package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Сканирование актива одним сканером.
 * Счетчики уязвимостей пересчитываются из сохраненных находок при каждом переходе в терминальное состояние.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Scan {
    private String id;
    private String name;
    private String description;

    /**
     * Объявленное имя сканера в исходном виде (может быть неподдерживаемым)
     */
    private String scannerType;
    private String assetId;
    private ScanTarget target;

    @Builder.Default
    private ScanDepth depth = ScanDepth.NORMAL;

    @Builder.Default
    private ScanFrequency frequency = ScanFrequency.ONCE;

    @Builder.Default
    private Map<String, Object> scannerConfig = new LinkedHashMap<>();

    @Builder.Default
    private ScanStatus status = ScanStatus.PENDING;
    private String statusMessage;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    private int totalVulnerabilities;
    private int criticalCount;
    private int highCount;
    private int mediumCount;
    private int lowCount;

    public Optional<ScannerKind> resolveScannerKind() {
        return ScannerKind.fromValue(scannerType);
    }

    /**
     * Строковое значение из конфигурации сканера
     */
    public String configValue(String key) {
        if (scannerConfig == null) {
            return null;
        }
        Object value = scannerConfig.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Независимая копия (коллекции и цель копируются)
     */
    public Scan copy() {
        return toBuilder()
            .target(target != null ? ScanTarget.of(target.getType(), target.getIdentifier()) : null)
            .scannerConfig(scannerConfig != null ? new LinkedHashMap<>(scannerConfig) : new LinkedHashMap<>())
            .build();
    }
}
