package com.intellivuln.integration;

import com.intellivuln.models.ScanResults;
import com.intellivuln.models.ScanStatus;
import com.intellivuln.models.Severity;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;

/**
 * Интеграция с CI/CD системами
 * GitHub Actions, GitLab CI и т.д.
 */
@Slf4j
public class CICDIntegration {

    private CICDIntegration() {
    }

    /**
     * Определить exit code на основе результатов сканирования
     *
     * @param results результаты сканирования
     * @param failOnHigh прерывать ли сборку при HIGH уязвимостях
     * @return exit code (0 = успех, 1 = провал)
     */
    public static int getExitCode(ScanResults results, boolean failOnHigh) {
        // КРИТИЧНО: Защита от NPE
        if (results == null) {
            log.warn("Результаты сканирования null, возвращаем код успеха");
            return 0;
        }

        if (results.getStatus() == ScanStatus.FAILED) {
            log.error("Сканирование завершилось ошибкой: {}", results.getStatusMessage());
            return 2;
        }

        if (results.hasCriticalVulnerabilities()) {
            log.error("Обнаружены CRITICAL уязвимости. Сборка провалена.");
            return 1;
        }

        if (failOnHigh && results.getVulnerabilityCountBySeverity(Severity.HIGH) > 0) {
            log.error("Обнаружены HIGH уязвимости. Сборка провалена.");
            return 1;
        }

        log.info("Критичных уязвимостей не обнаружено");
        return 0;
    }

    /**
     * Вывести краткую сводку для CI/CD
     */
    public static void printCISummary(ScanResults results, PrintStream out) {
        // КРИТИЧНО: Защита от NPE
        if (results == null) {
            log.warn("Результаты сканирования null, пропускаем вывод");
            return;
        }

        out.println("\n=== Vulnerability Scan Summary ===");
        out.println("Scan: " + (results.getScanName() != null ? results.getScanName() : "Unknown")
            + " [" + (results.getScannerType() != null ? results.getScannerType() : "unknown") + "]");
        out.println("Target: " + (results.getTarget() != null ? results.getTarget() : "N/A"));
        out.println("Status: " + (results.getStatus() != null ? results.getStatus().value() : "N/A")
            + (results.getStatusMessage() != null ? " (" + results.getStatusMessage() + ")" : ""));
        out.println("\nVulnerabilities:");
        out.println("  CRITICAL: " + results.getCriticalCount());
        out.println("  HIGH:     " + results.getHighCount());
        out.println("  MEDIUM:   " + results.getMediumCount());
        out.println("  LOW:      " + results.getLowCount());
        out.println("\nTotal: " + results.getTotalVulnerabilities() + " vulnerabilities");
        out.println("==================================\n");
    }

    /**
     * Создать аннотации для GitHub Actions
     */
    public static void printGitHubAnnotations(ScanResults results, PrintStream out) {
        // КРИТИЧНО: Защита от NPE
        if (results == null || results.getVulnerabilities() == null) {
            return;
        }

        for (var vuln : results.getVulnerabilities()) {
            if (vuln == null) continue;

            String level = switch (vuln.getSeverity() != null ? vuln.getSeverity() : Severity.LOW) {
                case CRITICAL, HIGH -> "error";
                case MEDIUM -> "warning";
                default -> "notice";
            };

            String component = vuln.getAffectedComponent() != null ? vuln.getAffectedComponent() : "N/A";
            String version = vuln.getAffectedVersion() != null ? vuln.getAffectedVersion() : "N/A";
            String id = vuln.getCveId() != null ? vuln.getCveId() : "NO-CVE";
            String title = vuln.getTitle() != null ? vuln.getTitle() : "Vulnerability";

            out.printf("::%s title=%s::%s [%s] - %s%n", level, id, component, version, title);
        }
    }
}
