package com.intellivuln.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Сводка результатов сканирования для отчетов и CI
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResults {
    private String scanId;
    private String scanName;
    private String scannerType;
    private String assetId;
    private String target;
    private ScanStatus status;
    private String statusMessage;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    private int totalVulnerabilities;
    private int criticalCount;
    private int highCount;
    private int mediumCount;
    private int lowCount;

    @Builder.Default
    private List<VulnerabilitySummary> vulnerabilities = new ArrayList<>();

    public boolean hasCriticalVulnerabilities() {
        return criticalCount > 0;
    }

    public int getVulnerabilityCountBySeverity(Severity severity) {
        if (severity == null) {
            return 0;
        }
        return switch (severity) {
            case CRITICAL -> criticalCount;
            case HIGH -> highCount;
            case MEDIUM -> mediumCount;
            case LOW -> lowCount;
        };
    }

    /**
     * Краткое представление находки
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VulnerabilitySummary {
        private String id;
        private String title;
        private String cveId;
        private Severity severity;
        private double cvssScore;
        private String affectedComponent;
        private String affectedVersion;
        private boolean exploitAvailable;
        private boolean patchAvailable;
        private RemediationStatus remediationStatus;
        private Double priorityScore;
        private PriorityClass priorityClass;

        public static VulnerabilitySummary from(Vulnerability vulnerability) {
            return VulnerabilitySummary.builder()
                .id(vulnerability.getId())
                .title(vulnerability.getTitle())
                .cveId(vulnerability.getCveId())
                .severity(vulnerability.getSeverity())
                .cvssScore(vulnerability.getCvssScore())
                .affectedComponent(vulnerability.getAffectedComponent())
                .affectedVersion(vulnerability.getAffectedVersion())
                .exploitAvailable(vulnerability.isExploitAvailable())
                .patchAvailable(vulnerability.isPatchAvailable())
                .remediationStatus(vulnerability.getRemediationStatus())
                .priorityScore(vulnerability.getPriorityScore())
                .priorityClass(vulnerability.getPriorityClass())
                .build();
        }
    }
}
