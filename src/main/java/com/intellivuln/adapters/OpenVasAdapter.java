package com.intellivuln.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.errors.ConfigurationException;
import com.intellivuln.models.Scan;
import com.intellivuln.models.ScanDepth;
import com.intellivuln.models.ScannerKind;
import com.intellivuln.models.Severity;
import com.intellivuln.models.TargetType;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Адаптер OpenVAS через GMP-обертку, печатающую результаты задачи в JSON.
 * Учетные данные передаются через окружение, а не в аргументах команды.
 */
@Slf4j
public class OpenVasAdapter extends AbstractProcessAdapter {

    private final VulnScanConfig.OpenVas settings;

    public OpenVasAdapter(VulnScanConfig config, ProcessRunner processRunner) {
        super(processRunner);
        this.settings = config.ensureDefaults().getScanners().getOpenvas();
    }

    @Override
    public ScannerKind kind() {
        return ScannerKind.OPENVAS;
    }

    @Override
    protected String toolName() {
        return "OpenVAS";
    }

    @Override
    protected Duration defaultTimeout() {
        return Duration.ofSeconds(settings.getTimeoutSec());
    }

    @Override
    protected void validate(Scan scan) {
        super.validate(scan);
        TargetType type = scan.getTarget().getType();
        if (type != TargetType.HOST && type != TargetType.APPLICATION) {
            throw new ConfigurationException("OpenVAS не поддерживает тип цели: " + type.value());
        }
    }

    @Override
    protected List<String> buildCommand(Scan scan, Path workDir) {
        return new ArrayList<>(List.of(
            settings.getCommand(),
            "--target", scan.getTarget().getIdentifier(),
            "--scan-config", scanConfig(depthOf(scan)),
            "--format", "json"
        ));
    }

    static String scanConfig(ScanDepth depth) {
        return switch (depth) {
            case QUICK -> "Discovery";
            case NORMAL -> "Full and fast";
            case DEEP -> "Full and very deep";
        };
    }

    @Override
    protected Map<String, String> environment(Scan scan) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("GVM_USERNAME", settings.getUsername());
        env.put("GVM_PASSWORD", settings.getPassword());
        return env;
    }

    @Override
    protected List<Map<String, Object>> extractFindings(JsonNode output, Scan scan) {
        List<Map<String, Object>> findings = new ArrayList<>();
        for (JsonNode result : JsonFields.array(output, "results")) {
            findings.add(mapResult(result));
        }
        return findings;
    }

    private Map<String, Object> mapResult(JsonNode result) {
        JsonNode nvt = result.path("nvt");
        Double cvss = JsonFields.number(result, "severity");
        double score = cvss != null ? cvss : 0.0;

        String qodType = JsonFields.text(result, "qod_type", JsonFields.text(result.path("qod"), "type", ""));
        String solutionType = JsonFields.text(result, "solution_type",
            JsonFields.text(nvt.path("solution"), "type", ""));

        Map<String, Object> finding = new LinkedHashMap<>();
        finding.put("title", JsonFields.text(result, "name", JsonFields.text(nvt, "name", "Unknown")));
        finding.put("description", JsonFields.text(result, "description", ""));
        finding.put("cve_id", cveId(result));
        finding.put("severity", severity(JsonFields.text(result, "threat", ""), score));
        finding.put("cvss_score", score);
        finding.put("cvss_vector", JsonFields.text(nvt, "cvss_base_vector", ""));
        finding.put("affected_component", JsonFields.text(result, "port", JsonFields.text(result, "host", "")));
        finding.put("affected_version", JsonFields.text(result, "detected_version", ""));
        finding.put("exploit_available", "exploit".equalsIgnoreCase(qodType));
        finding.put("patch_available", "VendorFix".equalsIgnoreCase(solutionType));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("scanner", "openvas");
        metadata.put("host", JsonFields.text(result, "host", ""));
        metadata.put("port", JsonFields.text(result, "port", ""));
        metadata.put("nvt_oid", JsonFields.text(nvt, "oid", ""));
        metadata.put("solution", JsonFields.text(result, "solution", JsonFields.text(nvt, "solution", "")));
        metadata.put("qod_type", qodType);
        finding.put("metadata", metadata);
        return finding;
    }

    /**
     * Уровень по полю threat (Log - low); неизвестное значение - по CVSS
     */
    static String severity(String threat, double cvss) {
        String normalized = threat.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "critical", "high", "medium", "low" -> normalized;
            case "log", "debug", "false positive" -> "low";
            default -> Severity.fromCvss(cvss).value();
        };
    }

    private static String cveId(JsonNode result) {
        String direct = JsonFields.text(result, "cve", null);
        if (direct != null) {
            return direct;
        }
        for (String ref : JsonFields.textList(result.path("nvt"), "cves")) {
            if (ref.toUpperCase(Locale.ROOT).startsWith("CVE-")) {
                return ref;
            }
        }
        return "";
    }
}
