package com.intellivuln.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.models.ScanDepth;
import com.intellivuln.models.ScannerKind;
import com.intellivuln.models.TargetType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TrivyAdapterTest {

    private final VulnScanConfig config = VulnScanConfig.defaults();

    @Test
    void mapsContainerReportToCanonicalFindings() throws Exception {
        FakeProcessRunner runner = FakeProcessRunner.returningFixture("trivy-report.json");
        TrivyAdapter adapter = new TrivyAdapter(config, runner);

        AdapterResult result = adapter.run(AdapterTestSupport.scan("trivy", TargetType.CONTAINER, "nginx:1.21"));

        assertTrue(result.isSuccess(), "Ожидался успешный результат: " + result.getMessage());
        assertEquals(ScannerKind.TRIVY, adapter.kind());
        assertEquals(List.of("trivy", "image", "--format", "json", "--severity", "CRITICAL,HIGH,MEDIUM,LOW", "nginx:1.21"),
            runner.lastCommand());
        assertEquals(2, result.getFindings().size());

        Map<String, Object> critical = result.getFindings().get(0);
        assertEquals("CVE-2022-37434", critical.get("cve_id"));
        assertEquals("critical", critical.get("severity"));
        assertEquals(9.8, (Double) critical.get("cvss_score"), 1e-9);
        assertEquals("zlib1g", critical.get("affected_component"));
        assertEquals(Boolean.TRUE, critical.get("exploit_available"));
        assertEquals(Boolean.FALSE, critical.get("patch_available"), "Нет FixedVersion - нет исправления");

        Map<String, Object> low = result.getFindings().get(1);
        assertEquals("low", low.get("severity"));
        assertEquals(2.1, (Double) low.get("cvss_score"), 1e-9, "V2Score вендора используется при отсутствии V3");
        assertEquals(Boolean.TRUE, low.get("patch_available"));
        assertNotNull(result.getRawOutput());
    }

    @Test
    void depthAndTargetTypeSelectTrivyMode() {
        FakeProcessRunner runner = FakeProcessRunner.returningStdout("{\"Results\": []}");
        TrivyAdapter adapter = new TrivyAdapter(config, runner);

        adapter.run(AdapterTestSupport.scan("trivy", TargetType.REPOSITORY, "https://github.com/org/repo",
            ScanDepth.QUICK, new java.util.LinkedHashMap<>()));
        assertEquals("repo", runner.lastCommand().get(1));
        assertTrue(runner.lastCommand().contains("--scanners"));

        adapter.run(AdapterTestSupport.scan("trivy", TargetType.HOST, "/",
            ScanDepth.DEEP, new java.util.LinkedHashMap<>()));
        assertEquals("rootfs", runner.lastCommand().get(1));
        assertTrue(runner.lastCommand().contains("--list-all-pkgs"));

        adapter.run(AdapterTestSupport.scan("trivy", TargetType.REPOSITORY, "/src/app"));
        assertEquals("fs", runner.lastCommand().get(1));
    }

    @Test
    void scannerConfigTimeoutOverridesDefault() {
        FakeProcessRunner runner = FakeProcessRunner.returningStdout("{}");
        TrivyAdapter adapter = new TrivyAdapter(config, runner);

        AdapterResult result = adapter.run(AdapterTestSupport.scan("trivy", TargetType.CONTAINER, "alpine:3.18",
            ScanDepth.NORMAL, new java.util.LinkedHashMap<>(Map.of("timeout_sec", 42))));

        assertTrue(result.isSuccess());
        assertTrue(result.getFindings().isEmpty());
        assertEquals(Duration.ofSeconds(42), runner.lastTimeout());
    }

    @Test
    void nonZeroExitCodeFailsWithStderr() {
        FakeProcessRunner runner = FakeProcessRunner.returning(ProcessResult.builder()
            .exitCode(1).stdout("").stderr("FATAL image not found").build());

        AdapterResult result = new TrivyAdapter(config, runner)
            .run(AdapterTestSupport.scan("trivy", TargetType.CONTAINER, "missing:latest"));

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("image not found"), result.getMessage());
        assertTrue(result.getFindings().isEmpty());
    }

    @Test
    void malformedJsonFails() {
        FakeProcessRunner runner = FakeProcessRunner.returningStdout("{not json");

        AdapterResult result = new TrivyAdapter(config, runner)
            .run(AdapterTestSupport.scan("trivy", TargetType.CONTAINER, "alpine"));

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("JSON"), result.getMessage());
    }

    @Test
    void timeoutFails() {
        FakeProcessRunner runner = FakeProcessRunner.returning(ProcessResult.builder()
            .exitCode(-1).timedOut(true).stdout("").stderr("").build());

        AdapterResult result = new TrivyAdapter(config, runner)
            .run(AdapterTestSupport.scan("trivy", TargetType.CONTAINER, "alpine"));

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("таймаут"), result.getMessage());
    }

    @Test
    void missingBinaryFails() {
        FakeProcessRunner runner = new FakeProcessRunner()
            .failingWith(new java.io.IOException("Cannot run program \"trivy\""));

        AdapterResult result = new TrivyAdapter(config, runner)
            .run(AdapterTestSupport.scan("trivy", TargetType.CONTAINER, "alpine"));

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("Cannot run program"));
    }

    @Test
    void cvssPrefersNvdV3() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals(7.5, TrivyAdapter.cvssScore(mapper.readTree(
            "{\"redhat\": {\"V3Score\": 6.1}, \"nvd\": {\"V2Score\": 5.0, \"V3Score\": 7.5}}")), 1e-9);
        assertEquals(6.1, TrivyAdapter.cvssScore(mapper.readTree(
            "{\"nvd\": {\"V2Score\": 5.0}, \"redhat\": {\"V3Score\": 6.1}}")), 1e-9);
        assertEquals(5.0, TrivyAdapter.cvssScore(mapper.readTree("{\"nvd\": {\"V2Score\": 5.0}}")), 1e-9);
        assertEquals(0.0, TrivyAdapter.cvssScore(mapper.missingNode()), 1e-9);
    }
}
