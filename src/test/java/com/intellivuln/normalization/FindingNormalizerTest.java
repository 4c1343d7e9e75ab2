package com.intellivuln.normalization;

import com.intellivuln.models.BusinessImpact;
import com.intellivuln.models.DataClassification;
import com.intellivuln.models.ExploitMaturity;
import com.intellivuln.models.RemediationStatus;
import com.intellivuln.models.Severity;
import com.intellivuln.models.SystemExposure;
import com.intellivuln.models.Vulnerability;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FindingNormalizerTest {

    private final FindingNormalizer normalizer = new FindingNormalizer();

    @Test
    void emptyFindingGetsDefaults() {
        Vulnerability vulnerability = normalizer.normalizeOne(new HashMap<>(), "scan-1", "asset-1");

        assertEquals("scan-1", vulnerability.getScanId());
        assertEquals("asset-1", vulnerability.getAssetId());
        assertEquals("Unknown", vulnerability.getTitle());
        assertEquals("", vulnerability.getDescription());
        assertNull(vulnerability.getCveId());
        assertEquals(Severity.LOW, vulnerability.getSeverity());
        assertEquals(0.0, vulnerability.getCvssScore());
        assertFalse(vulnerability.isExploitAvailable());
        assertFalse(vulnerability.isPatchAvailable());
        assertEquals(ExploitMaturity.UNKNOWN, vulnerability.getExploitMaturity());
        assertEquals(BusinessImpact.UNKNOWN, vulnerability.getBusinessImpact());
        assertEquals(DataClassification.UNKNOWN, vulnerability.getDataClassification());
        assertEquals(SystemExposure.UNKNOWN, vulnerability.getSystemExposure());
        assertEquals(RemediationStatus.OPEN, vulnerability.getRemediationStatus());
        assertNotNull(vulnerability.getMetadata());
    }

    @Test
    void coercesLooseScannerValues() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("title", "  Hardcoded credentials  ");
        raw.put("severity", "Moderate");
        raw.put("cvss_score", "7.5");
        raw.put("exploit_available", "yes");
        raw.put("patch_available", 1);
        raw.put("business_impact", "critical");
        raw.put("system_exposure", "internet-facing");
        raw.put("data_classification", "top-secret");

        Vulnerability vulnerability = normalizer.normalizeOne(raw, null, null);

        assertEquals("Hardcoded credentials", vulnerability.getTitle());
        assertEquals(Severity.MEDIUM, vulnerability.getSeverity(), "Значение сканера важнее CVSS");
        assertEquals(7.5, vulnerability.getCvssScore(), 1e-9);
        assertTrue(vulnerability.isExploitAvailable());
        assertTrue(vulnerability.isPatchAvailable());
        assertEquals(BusinessImpact.CRITICAL, vulnerability.getBusinessImpact());
        assertEquals(SystemExposure.INTERNET, vulnerability.getSystemExposure());
        assertEquals(DataClassification.UNKNOWN, vulnerability.getDataClassification());
    }

    @Test
    void unrecognizedSeverityDerivedFromCvss() {
        assertEquals(Severity.CRITICAL, FindingNormalizer.severity("P0", 9.1));
        assertEquals(Severity.LOW, FindingNormalizer.severity("P0", 0.0));
        assertEquals(Severity.LOW, FindingNormalizer.severity(null, 9.8), "Пустое значение дает low");
    }

    @Test
    void cvssIsClampedAndSanitized() {
        assertEquals(10.0, FindingNormalizer.parseCvss(12.3));
        assertEquals(0.0, FindingNormalizer.parseCvss(-1));
        assertEquals(0.0, FindingNormalizer.parseCvss(Double.NaN));
        assertEquals(0.0, FindingNormalizer.parseCvss("n/a"));
        assertEquals(0.0, FindingNormalizer.parseCvss(null));
        assertEquals(4.3, FindingNormalizer.parseCvss(" 4.3 "), 1e-9);
    }

    @Test
    void duplicatesAreMarkedButKept() {
        Map<String, Object> first = Map.of("cve_id", "CVE-2023-1", "affected_component", "openssl",
            "affected_version", "1.1.1");
        Map<String, Object> repeat = Map.of("cve_id", "CVE-2023-1", "affected_component", "OpenSSL",
            "affected_version", "1.1.1", "title", "another title");
        Map<String, Object> otherVersion = Map.of("cve_id", "CVE-2023-1", "affected_component", "openssl",
            "affected_version", "3.0.0");

        List<Vulnerability> result = normalizer.normalize(List.of(first, repeat, otherVersion), "scan-1", null);

        assertEquals(3, result.size());
        assertFalse(result.get(0).isDuplicate());
        assertTrue(result.get(1).isDuplicate());
        assertEquals(0, result.get(1).getMetadata().get("duplicate_of"));
        assertFalse(result.get(2).isDuplicate(), "Другая версия - отдельная находка");
    }

    @Test
    void nullInputGivesEmptyList() {
        assertTrue(normalizer.normalize(null, "scan-1", null).isEmpty());
    }
}
