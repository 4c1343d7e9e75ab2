package com.intellivuln.ml;

import com.intellivuln.models.BusinessImpact;
import com.intellivuln.models.Severity;
import com.intellivuln.models.SystemExposure;
import com.intellivuln.models.Vulnerability;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor();

    private final Vulnerability vulnerability = Vulnerability.builder()
        .cvssScore(9.8)
        .severity(Severity.CRITICAL)
        .exploitAvailable(true)
        .patchAvailable(false)
        .businessImpact(BusinessImpact.HIGH)
        .systemExposure(SystemExposure.INTERNET)
        .build();

    @Test
    void extractFollowsCanonicalOrder() {
        Map<String, Double> features = extractor.extract(vulnerability);

        assertEquals(extractor.featureNames(), new ArrayList<>(features.keySet()));
        assertEquals(9.8, features.get(FeatureExtractor.CVSS_SCORE), 1e-9);
        assertEquals(1.0, features.get(FeatureExtractor.EXPLOIT_AVAILABLE));
        assertEquals(0.0, features.get(FeatureExtractor.PATCH_AVAILABLE));
        assertEquals(1.0, features.get("severity_critical"));
        assertEquals(0.0, features.get("severity_low"));
        assertEquals(1.0, features.get("business_impact_high"));
        assertEquals(1.0, features.get("system_exposure_internet"));
        assertEquals(1.0, features.get("exploit_maturity_unknown"), "Пустая категория кодируется явным индикатором");
        assertEquals(1.0, features.get("data_classification_unknown"));
    }

    @Test
    void eachCategoryHasExactlyOneActiveIndicator() {
        Map<String, Double> features = extractor.extract(vulnerability);

        for (String prefix : List.of("severity_", "exploit_maturity_", "business_impact_",
                "data_classification_", "system_exposure_")) {
            double active = features.entrySet().stream()
                .filter(entry -> entry.getKey().startsWith(prefix))
                .mapToDouble(Map.Entry::getValue)
                .sum();
            assertEquals(1.0, active, prefix);
        }
    }

    @Test
    void vectorizationIsDeterministic() {
        assertArrayEquals(extractor.vectorize(vulnerability), extractor.vectorize(vulnerability.copy()));
    }

    @Test
    void unknownFeatureNamesYieldZero() {
        double[] vector = extractor.vectorize(vulnerability,
            List.of("system_exposure_internet", "asset_age_days", FeatureExtractor.CVSS_SCORE));

        assertArrayEquals(new double[]{1.0, 0.0, 9.8}, vector, 1e-9);
    }

    @Test
    void featuresHaveDescriptions() {
        for (String feature : extractor.featureNames()) {
            assertFalse(FeatureExtractor.describe(feature).isBlank(), feature);
        }
        assertEquals("", FeatureExtractor.describe("no_such_feature"));
    }
}
