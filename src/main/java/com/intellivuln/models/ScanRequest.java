package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Запрос на создание или изменение сканирования
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanRequest {
    private String name;
    private String description;
    private String scannerType;
    private String assetId;
    private ScanTarget target;
    private ScanDepth depth;
    private ScanFrequency frequency;

    @Builder.Default
    private Map<String, Object> scannerConfig = new LinkedHashMap<>();
}
