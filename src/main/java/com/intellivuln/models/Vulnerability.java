package com.intellivuln.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Нормализованная находка сканера.
 * Перечислимые поля всегда содержат значения своих доменов.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Vulnerability {
    private String id;
    private String scanId;
    private String assetId;

    @Builder.Default
    private String title = "Unknown";

    @Builder.Default
    private String description = "";
    private String cveId;

    @Builder.Default
    private Severity severity = Severity.LOW;
    private double cvssScore;
    private String cvssVector;

    private String affectedComponent;
    private String affectedVersion;

    private boolean exploitAvailable;

    @Builder.Default
    private ExploitMaturity exploitMaturity = ExploitMaturity.UNKNOWN;
    private boolean patchAvailable;

    @Builder.Default
    private BusinessImpact businessImpact = BusinessImpact.UNKNOWN;

    @Builder.Default
    private DataClassification dataClassification = DataClassification.UNKNOWN;

    @Builder.Default
    private SystemExposure systemExposure = SystemExposure.UNKNOWN;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Builder.Default
    private RemediationStatus remediationStatus = RemediationStatus.OPEN;

    // Заполняются после приоритизации
    private Double priorityScore;
    private PriorityClass priorityClass;
    private String priorityExplanation;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @JsonIgnore
    public boolean isDuplicate() {
        return metadata != null && Boolean.TRUE.equals(metadata.get("duplicate"));
    }

    public Vulnerability copy() {
        return toBuilder()
            .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
            .build();
    }
}
