package com.intellivuln.adapters;

import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.models.ScanDepth;
import com.intellivuln.models.TargetType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CustomAdapterTest {

    private final VulnScanConfig config = VulnScanConfig.defaults();

    @Test
    void substitutesPlaceholdersInStringCommand() throws Exception {
        FakeProcessRunner runner = FakeProcessRunner.returningFixture("custom-findings.json");
        Map<String, Object> scannerConfig = new LinkedHashMap<>();
        scannerConfig.put("command", "my-scanner --target {target} --mode {depth} --kind {target_type}");

        AdapterResult result = new CustomAdapter(config, runner).run(AdapterTestSupport.scan("custom",
            TargetType.APPLICATION, "https://app.local", ScanDepth.QUICK, scannerConfig));

        assertTrue(result.isSuccess(), result.getMessage());
        assertEquals(List.of("my-scanner", "--target", "https://app.local", "--mode", "quick", "--kind", "application"),
            runner.lastCommand());
        assertEquals(2, result.getFindings().size());
        assertEquals("Hardcoded credentials in config", result.getFindings().get(0).get("title"));
    }

    @Test
    void acceptsCommandAsListAndBareArrayOutput() {
        FakeProcessRunner runner = FakeProcessRunner.returningStdout("[{\"title\": \"A\"}, 5, {\"title\": \"B\"}]");
        Map<String, Object> scannerConfig = new LinkedHashMap<>();
        scannerConfig.put("command", List.of("scan.sh", "{target}"));

        AdapterResult result = new CustomAdapter(config, runner).run(AdapterTestSupport.scan("custom",
            TargetType.HOST, "db01", ScanDepth.NORMAL, scannerConfig));

        assertTrue(result.isSuccess());
        assertEquals(List.of("scan.sh", "db01"), runner.lastCommand());
        assertEquals(2, result.getFindings().size(), "Не-объекты пропускаются");
    }

    @Test
    void missingCommandFailsWithoutRunningProcess() {
        FakeProcessRunner runner = new FakeProcessRunner();

        AdapterResult result = new CustomAdapter(config, runner)
            .run(AdapterTestSupport.scan("custom", TargetType.HOST, "db01"));

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("command"), result.getMessage());
        assertEquals(0, runner.invocations());
    }

    @Test
    void scalarOutputFails() {
        FakeProcessRunner runner = FakeProcessRunner.returningStdout("42");
        Map<String, Object> scannerConfig = new LinkedHashMap<>();
        scannerConfig.put("command", "scan.sh");

        AdapterResult result = new CustomAdapter(config, runner).run(AdapterTestSupport.scan("custom",
            TargetType.HOST, "db01", ScanDepth.NORMAL, scannerConfig));

        assertFalse(result.isSuccess());
    }
}
