package com.intellivuln.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.errors.ConfigurationException;
import com.intellivuln.models.Scan;
import com.intellivuln.models.ScannerKind;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Адаптер пользовательского сканера. Команда берется из scanner_config.command
 * (список или строка) с подстановками {target}, {depth}, {target_type}.
 * Сканер обязан печатать канонические находки: JSON-массив или {"findings": [...]}.
 */
@Slf4j
public class CustomAdapter extends AbstractProcessAdapter {

    private final VulnScanConfig.Custom settings;

    public CustomAdapter(VulnScanConfig config, ProcessRunner processRunner) {
        super(processRunner);
        this.settings = config.ensureDefaults().getScanners().getCustom();
    }

    @Override
    public ScannerKind kind() {
        return ScannerKind.CUSTOM;
    }

    @Override
    protected String toolName() {
        return "Custom scanner";
    }

    @Override
    protected Duration defaultTimeout() {
        return Duration.ofSeconds(settings.getTimeoutSec());
    }

    @Override
    protected List<String> buildCommand(Scan scan, Path workDir) {
        Object raw = scan.getScannerConfig() != null ? scan.getScannerConfig().get("command") : null;
        List<String> template = new ArrayList<>();
        if (raw instanceof Collection<?> parts) {
            for (Object part : parts) {
                if (part != null) {
                    template.add(part.toString());
                }
            }
        } else if (raw != null && !raw.toString().isBlank()) {
            template.addAll(Arrays.asList(raw.toString().trim().split("\\s+")));
        }
        if (template.isEmpty()) {
            throw new ConfigurationException("Для custom сканера не задана команда (scanner_config.command)");
        }

        List<String> command = new ArrayList<>(template.size());
        for (String part : template) {
            command.add(part
                .replace("{target}", scan.getTarget().getIdentifier())
                .replace("{depth}", depthOf(scan).value())
                .replace("{target_type}", scan.getTarget().getType().value()));
        }
        return command;
    }

    @Override
    protected List<Map<String, Object>> extractFindings(JsonNode output, Scan scan) {
        JsonNode items = output.isArray() ? output : output.path("findings");
        List<Map<String, Object>> findings = new ArrayList<>();
        if (!items.isArray()) {
            log.warn("Custom scanner: в выводе нет массива находок");
            return findings;
        }
        for (JsonNode item : items) {
            if (item.isObject()) {
                findings.add(toMap(item));
            }
        }
        return findings;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toMap(JsonNode item) {
        return JsonFields.mapper().convertValue(item, Map.class);
    }

    @Override
    protected JsonNode readOutput(ProcessResult result, Path workDir) throws IOException {
        JsonNode output = super.readOutput(result, workDir);
        if (!output.isArray() && !output.isObject()) {
            throw new IOException("ожидался JSON-массив или объект с полем findings");
        }
        return output;
    }
}
