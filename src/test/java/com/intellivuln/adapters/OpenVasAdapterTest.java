package com.intellivuln.adapters;

import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.models.ScanDepth;
import com.intellivuln.models.TargetType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OpenVasAdapterTest {

    @Test
    void mapsResultsAndPassesCredentialsThroughEnvironment() throws Exception {
        VulnScanConfig config = VulnScanConfig.defaults();
        config.getScanners().getOpenvas().setPassword("s3cret");
        FakeProcessRunner runner = FakeProcessRunner.returningFixture("openvas-report.json");

        AdapterResult result = new OpenVasAdapter(config, runner).run(AdapterTestSupport.scan("openvas",
            TargetType.HOST, "10.0.0.5", ScanDepth.DEEP, new LinkedHashMap<>()));

        assertTrue(result.isSuccess(), result.getMessage());
        assertEquals(List.of("gvm-scan", "--target", "10.0.0.5", "--scan-config", "Full and very deep", "--format", "json"),
            runner.lastCommand());
        assertFalse(runner.lastCommand().contains("s3cret"), "Пароль не должен попадать в аргументы");
        assertEquals("s3cret", runner.lastEnvironment().get("GVM_PASSWORD"));
        assertEquals("admin", runner.lastEnvironment().get("GVM_USERNAME"));

        Map<String, Object> ssh = result.getFindings().get(0);
        assertEquals("high", ssh.get("severity"));
        assertEquals("CVE-2017-15906", ssh.get("cve_id"));
        assertEquals("22/tcp", ssh.get("affected_component"));
        assertEquals(Boolean.TRUE, ssh.get("exploit_available"));
        assertEquals(Boolean.TRUE, ssh.get("patch_available"));

        Map<String, Object> timestamps = result.getFindings().get(1);
        assertEquals("low", timestamps.get("severity"), "Log соответствует low");
        assertEquals(Boolean.FALSE, timestamps.get("patch_available"));
    }

    @Test
    void severityFallsBackToCvssForUnknownThreat() {
        assertEquals("critical", OpenVasAdapter.severity("Alarm", 9.3));
        assertEquals("medium", OpenVasAdapter.severity("", 5.0));
        assertEquals("low", OpenVasAdapter.severity("False Positive", 9.0));
    }

    @Test
    void repositoryTargetIsNotSupported() {
        FakeProcessRunner runner = new FakeProcessRunner();

        AdapterResult result = new OpenVasAdapter(VulnScanConfig.defaults(), runner)
            .run(AdapterTestSupport.scan("openvas", TargetType.REPOSITORY, "/src"));

        assertFalse(result.isSuccess());
        assertEquals(0, runner.invocations());
    }
}
