package com.intellivuln.cli;

import com.intellivuln.adapters.FakeProcessRunner;
import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.core.IntelliVulnEngine;
import com.intellivuln.models.Scan;
import com.intellivuln.models.ScanRequest;
import com.intellivuln.models.ScanStatus;
import com.intellivuln.models.ScanTarget;
import com.intellivuln.models.TargetType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ScanCommandTest {

    @TempDir
    Path modelDir;

    @Test
    void stopAfterTimeoutReturnsFinalStateOfScanThatAlreadyFinished() throws Exception {
        VulnScanConfig config = VulnScanConfig.defaults();
        config.getMl().setModelDir(modelDir.toString());

        try (IntelliVulnEngine engine = IntelliVulnEngine.create(config,
                FakeProcessRunner.returningFixture("trivy-report.json"))) {
            Scan scan = engine.getScanController().createScan(ScanRequest.builder()
                .scannerType("trivy")
                .target(ScanTarget.of(TargetType.CONTAINER, "nginx:1.21"))
                .build());
            engine.getScanController().start(scan.getId()).await(Duration.ofSeconds(10));

            Scan result = ScanCommand.stopAfterTimeout(engine, scan.getId());

            assertEquals(ScanStatus.COMPLETED, result.getStatus());
            assertEquals(2, result.getTotalVulnerabilities());
        }
    }
}
