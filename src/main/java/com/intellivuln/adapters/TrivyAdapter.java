package com.intellivuln.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.models.Scan;
import com.intellivuln.models.ScannerKind;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Адаптер Trivy: образы контейнеров, файловые системы и репозитории.
 * Вывод: Results[].Vulnerabilities[].
 */
@Slf4j
public class TrivyAdapter extends AbstractProcessAdapter {

    private static final String SEVERITIES = "CRITICAL,HIGH,MEDIUM,LOW";

    private final VulnScanConfig.Trivy settings;

    public TrivyAdapter(VulnScanConfig config, ProcessRunner processRunner) {
        super(processRunner);
        this.settings = config.ensureDefaults().getScanners().getTrivy();
    }

    @Override
    public ScannerKind kind() {
        return ScannerKind.TRIVY;
    }

    @Override
    protected String toolName() {
        return "Trivy";
    }

    @Override
    protected Duration defaultTimeout() {
        return Duration.ofSeconds(settings.getTimeoutSec());
    }

    @Override
    protected List<String> buildCommand(Scan scan, Path workDir) {
        String identifier = scan.getTarget().getIdentifier();
        List<String> command = new ArrayList<>();
        command.add(settings.getPath());
        command.add(subcommand(scan));
        command.add("--format");
        command.add("json");
        command.add("--severity");
        command.add(SEVERITIES);
        switch (depthOf(scan)) {
            case QUICK -> {
                command.add("--scanners");
                command.add("vuln");
            }
            case DEEP -> command.add("--list-all-pkgs");
            default -> {
                // normal: настройки Trivy по умолчанию
            }
        }
        command.add(identifier);
        return command;
    }

    /**
     * Режим запуска по типу цели: container - image, repository - fs (удаленный URL - repo),
     * host - rootfs, application - fs
     */
    static String subcommand(Scan scan) {
        String identifier = scan.getTarget().getIdentifier();
        return switch (scan.getTarget().getType()) {
            case CONTAINER -> "image";
            case REPOSITORY -> isRemote(identifier) ? "repo" : "fs";
            case HOST -> "rootfs";
            case APPLICATION -> "fs";
        };
    }

    private static boolean isRemote(String identifier) {
        String lower = identifier.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://") || lower.startsWith("git@");
    }

    @Override
    protected List<Map<String, Object>> extractFindings(JsonNode output, Scan scan) {
        List<Map<String, Object>> findings = new ArrayList<>();
        for (JsonNode result : JsonFields.array(output, "Results")) {
            String target = JsonFields.text(result, "Target", "");
            for (JsonNode vuln : JsonFields.array(result, "Vulnerabilities")) {
                findings.add(mapVulnerability(vuln, target));
            }
        }
        return findings;
    }

    private Map<String, Object> mapVulnerability(JsonNode vuln, String target) {
        String vulnerabilityId = JsonFields.text(vuln, "VulnerabilityID", "");
        String fixedVersion = JsonFields.text(vuln, "FixedVersion", "");
        String pkgName = JsonFields.text(vuln, "PkgName", "");

        Map<String, Object> finding = new LinkedHashMap<>();
        finding.put("title", JsonFields.text(vuln, "Title", vulnerabilityId.isEmpty() ? "Unknown" : vulnerabilityId));
        finding.put("description", JsonFields.text(vuln, "Description", ""));
        finding.put("cve_id", vulnerabilityId);
        finding.put("severity", JsonFields.text(vuln, "Severity", "").toLowerCase(Locale.ROOT));
        finding.put("cvss_score", cvssScore(vuln.path("CVSS")));
        finding.put("cvss_vector", cvssVector(vuln.path("CVSS")));
        finding.put("affected_component", pkgName.isEmpty() ? target : pkgName);
        finding.put("affected_version", JsonFields.text(vuln, "InstalledVersion", ""));
        finding.put("exploit_available", JsonFields.bool(vuln, "ExploitAvailable"));
        finding.put("patch_available", !fixedVersion.isEmpty());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("scanner", "trivy");
        metadata.put("target", target);
        metadata.put("package_name", pkgName);
        metadata.put("fixed_version", fixedVersion);
        metadata.put("references", JsonFields.textList(vuln, "References"));
        String dataSource = JsonFields.text(vuln.path("DataSource"), "Name", null);
        if (dataSource != null) {
            metadata.put("data_source", dataSource);
        }
        finding.put("metadata", metadata);
        return finding;
    }

    /**
     * CVSS.nvd.V3Score, затем V3Score любого вендора, затем V2Score (nvd первым)
     */
    static double cvssScore(JsonNode cvss) {
        Double nvdV3 = JsonFields.number(cvss.path("nvd"), "V3Score");
        if (nvdV3 != null) {
            return nvdV3;
        }
        Double v2 = JsonFields.number(cvss.path("nvd"), "V2Score");
        Iterator<String> vendors = JsonFields.fieldNames(cvss);
        while (vendors.hasNext()) {
            JsonNode vendor = cvss.path(vendors.next());
            Double v3 = JsonFields.number(vendor, "V3Score");
            if (v3 != null) {
                return v3;
            }
            if (v2 == null) {
                v2 = JsonFields.number(vendor, "V2Score");
            }
        }
        return v2 != null ? v2 : 0.0;
    }

    static String cvssVector(JsonNode cvss) {
        String nvd = JsonFields.text(cvss.path("nvd"), "V3Vector", null);
        if (nvd != null) {
            return nvd;
        }
        Iterator<String> vendors = JsonFields.fieldNames(cvss);
        while (vendors.hasNext()) {
            String vector = JsonFields.text(cvss.path(vendors.next()), "V3Vector", null);
            if (vector != null) {
                return vector;
            }
        }
        return "";
    }
}
