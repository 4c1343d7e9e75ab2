package com.intellivuln.normalization;

import com.intellivuln.models.BusinessImpact;
import com.intellivuln.models.DataClassification;
import com.intellivuln.models.ExploitMaturity;
import com.intellivuln.models.RemediationStatus;
import com.intellivuln.models.Severity;
import com.intellivuln.models.SystemExposure;
import com.intellivuln.models.Vulnerability;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Приведение сырых находок адаптера к каноническим уязвимостям.
 *
 * <p>Значения по умолчанию: title "Unknown", description "", severity low, CVSS 0.0,
 * exploit/patch false, прочие категории "". Повторы внутри одного результата помечаются
 * в metadata (duplicate, duplicate_of), но не удаляются. Между сканированиями дедупликации нет.</p>
 */
@Slf4j
public class FindingNormalizer {

    public List<Vulnerability> normalize(List<Map<String, Object>> rawFindings, String scanId, String assetId) {
        List<Vulnerability> result = new ArrayList<>();
        if (rawFindings == null) {
            return result;
        }
        Map<String, Integer> firstSeen = new HashMap<>();
        int duplicates = 0;
        for (Map<String, Object> raw : rawFindings) {
            if (raw == null) {
                continue;
            }
            Vulnerability vulnerability = normalizeOne(raw, scanId, assetId);
            String key = identityKey(vulnerability);
            Integer original = firstSeen.putIfAbsent(key, result.size());
            if (original != null) {
                vulnerability.getMetadata().put("duplicate", Boolean.TRUE);
                vulnerability.getMetadata().put("duplicate_of", original);
                duplicates++;
            }
            result.add(vulnerability);
        }
        if (duplicates > 0) {
            log.info("Скан {}: помечено повторов {} из {}", scanId, duplicates, result.size());
        }
        return result;
    }

    public Vulnerability normalizeOne(Map<String, Object> raw, String scanId, String assetId) {
        Map<String, Object> source = raw != null ? raw : Map.of();
        double cvss = parseCvss(source.get("cvss_score"));

        return Vulnerability.builder()
            .scanId(scanId)
            .assetId(assetId)
            .title(textOr(source.get("title"), "Unknown"))
            .description(textOr(source.get("description"), ""))
            .cveId(emptyToNull(textOr(source.get("cve_id"), "")))
            .severity(severity(source.get("severity"), cvss))
            .cvssScore(cvss)
            .cvssVector(textOr(source.get("cvss_vector"), ""))
            .affectedComponent(textOr(source.get("affected_component"), ""))
            .affectedVersion(textOr(source.get("affected_version"), ""))
            .exploitAvailable(parseBoolean(source.get("exploit_available")))
            .exploitMaturity(ExploitMaturity.fromValue(text(source.get("exploit_maturity"))))
            .patchAvailable(parseBoolean(source.get("patch_available")))
            .businessImpact(BusinessImpact.fromValue(text(source.get("business_impact"))))
            .dataClassification(DataClassification.fromValue(text(source.get("data_classification"))))
            .systemExposure(SystemExposure.fromValue(text(source.get("system_exposure"))))
            .metadata(metadata(source.get("metadata")))
            .remediationStatus(RemediationStatus.fromValue(text(source.get("status"))))
            .build();
    }

    /**
     * CVSS из числа или строки; NaN, бесконечность и мусор дают 0, результат зажат в [0, 10]
     */
    public static double parseCvss(Object value) {
        double score;
        if (value instanceof Number number) {
            score = number.doubleValue();
        } else if (value != null) {
            try {
                score = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        } else {
            return 0.0;
        }
        if (Double.isNaN(score) || Double.isInfinite(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(10.0, score));
    }

    /**
     * Уровень из значения сканера; нераспознанное значение - по CVSS (если > 0), иначе low
     */
    public static Severity severity(Object value, double cvss) {
        String raw = text(value);
        if (raw == null || raw.isBlank()) {
            return Severity.LOW;
        }
        Severity coerced = Severity.coerce(raw);
        if (coerced != null) {
            return coerced;
        }
        return cvss > 0.0 ? Severity.fromCvss(cvss) : Severity.LOW;
    }

    static boolean parseBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        if (value != null) {
            String text = value.toString().trim().toLowerCase(Locale.ROOT);
            return text.equals("true") || text.equals("yes") || text.equals("1");
        }
        return false;
    }

    private static String identityKey(Vulnerability vulnerability) {
        String identity = vulnerability.getCveId() != null ? vulnerability.getCveId() : vulnerability.getTitle();
        return String.join("|",
            Objects.toString(identity, "").toLowerCase(Locale.ROOT),
            Objects.toString(vulnerability.getAffectedComponent(), "").toLowerCase(Locale.ROOT),
            Objects.toString(vulnerability.getAffectedVersion(), ""));
    }

    private static Map<String, Object> metadata(Object value) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, item) -> metadata.put(String.valueOf(key), item));
        }
        return metadata;
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }

    private static String textOr(Object value, String defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? defaultValue : text;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
