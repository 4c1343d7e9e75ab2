package com.intellivuln.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.errors.ConfigurationException;
import com.intellivuln.models.Scan;
import com.intellivuln.models.ScannerKind;
import com.intellivuln.models.TargetType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Адаптер OWASP Dependency-Check. Отчет пишется во временный каталог и удаляется после разбора.
 */
@Slf4j
public class DependencyCheckAdapter extends AbstractProcessAdapter {

    static final String REPORT_FILE = "dependency-check-report.json";

    private final VulnScanConfig.DependencyCheck settings;

    public DependencyCheckAdapter(VulnScanConfig config, ProcessRunner processRunner) {
        super(processRunner);
        this.settings = config.ensureDefaults().getScanners().getDependencyCheck();
    }

    @Override
    public ScannerKind kind() {
        return ScannerKind.DEPENDENCY_CHECK;
    }

    @Override
    protected String toolName() {
        return "Dependency-Check";
    }

    @Override
    protected Duration defaultTimeout() {
        return Duration.ofSeconds(settings.getTimeoutSec());
    }

    @Override
    protected boolean needsWorkDir() {
        return true;
    }

    @Override
    protected void validate(Scan scan) {
        super.validate(scan);
        TargetType type = scan.getTarget().getType();
        if (type != TargetType.APPLICATION && type != TargetType.REPOSITORY) {
            throw new ConfigurationException("Dependency-Check не поддерживает тип цели: " + type.value());
        }
    }

    @Override
    protected List<String> buildCommand(Scan scan, Path workDir) {
        List<String> command = new ArrayList<>(List.of(
            settings.getPath(),
            "--scan", scan.getTarget().getIdentifier(),
            "--format", "JSON",
            "--out", outputDir(workDir).toString(),
            "--project", "scan-" + scan.getId()
        ));
        switch (depthOf(scan)) {
            case QUICK -> command.add("--disableRetireJS");
            case DEEP -> command.add("--enableExperimental");
            default -> {
                // normal: анализаторы по умолчанию
            }
        }
        return command;
    }

    private Path outputDir(Path workDir) {
        if (settings.getReportDir() != null && !settings.getReportDir().isBlank()) {
            return Path.of(settings.getReportDir()).resolve(workDir.getFileName());
        }
        return workDir;
    }

    @Override
    protected JsonNode readOutput(ProcessResult result, Path workDir) throws IOException {
        Path report = outputDir(workDir).resolve(REPORT_FILE);
        if (!Files.isRegularFile(report)) {
            throw new IOException("отчет не найден: " + report);
        }
        try {
            return JsonFields.mapper().readTree(report.toFile());
        } finally {
            Files.deleteIfExists(report);
        }
    }

    @Override
    protected List<Map<String, Object>> extractFindings(JsonNode output, Scan scan) {
        List<Map<String, Object>> findings = new ArrayList<>();
        for (JsonNode dependency : JsonFields.array(output, "dependencies")) {
            for (JsonNode vuln : JsonFields.array(dependency, "vulnerabilities")) {
                findings.add(mapVulnerability(dependency, vuln));
            }
        }
        return findings;
    }

    private Map<String, Object> mapVulnerability(JsonNode dependency, JsonNode vuln) {
        String name = JsonFields.text(vuln, "name", "");
        String fileName = JsonFields.text(dependency, "fileName", "");

        Map<String, Object> finding = new LinkedHashMap<>();
        finding.put("title", name.isEmpty() ? "Unknown" : name);
        finding.put("description", JsonFields.text(vuln, "description", ""));
        finding.put("cve_id", name.toUpperCase(Locale.ROOT).startsWith("CVE-") ? name : "");
        finding.put("severity", JsonFields.text(vuln, "severity", "").toLowerCase(Locale.ROOT));
        finding.put("cvss_score", cvssScore(vuln));
        finding.put("cvss_vector", JsonFields.text(vuln.path("cvssv3"), "vectorString",
            JsonFields.text(vuln.path("cvssv3"), "attackVector", "")));
        finding.put("affected_component", fileName);
        finding.put("affected_version", version(dependency));
        // известная эксплуатация (CISA KEV) - единственный сигнал эксплойта в отчете
        boolean knownExploited = vuln.has("knownExploitedVulnerability")
            && !vuln.path("knownExploitedVulnerability").isNull();
        finding.put("exploit_available", knownExploited);
        finding.put("patch_available", true);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("scanner", "dependency-check");
        metadata.put("package_name", fileName);
        metadata.put("file_path", JsonFields.text(dependency, "filePath", ""));
        metadata.put("references", JsonFields.textList(vuln, "references"));
        finding.put("metadata", metadata);
        return finding;
    }

    static double cvssScore(JsonNode vuln) {
        Double v3 = JsonFields.number(vuln.path("cvssv3"), "baseScore");
        if (v3 != null) {
            return v3;
        }
        Double v2 = JsonFields.number(vuln.path("cvssv2"), "score");
        return v2 != null ? v2 : 0.0;
    }

    /**
     * Версия зависимости: поле version или суффикс после '@' в идентификаторе пакета
     */
    static String version(JsonNode dependency) {
        String version = JsonFields.text(dependency, "version", null);
        if (version != null) {
            return version;
        }
        for (JsonNode pkg : JsonFields.array(dependency, "packages")) {
            String id = JsonFields.text(pkg, "id", "");
            int at = id.lastIndexOf('@');
            if (at >= 0 && at < id.length() - 1) {
                return id.substring(at + 1);
            }
        }
        return "";
    }
}
