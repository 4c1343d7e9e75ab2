package com.intellivuln.adapters;

import com.intellivuln.models.Scan;
import com.intellivuln.models.ScanDepth;
import com.intellivuln.models.ScanStatus;
import com.intellivuln.models.ScanTarget;
import com.intellivuln.models.TargetType;

import java.util.LinkedHashMap;
import java.util.Map;

final class AdapterTestSupport {

    private AdapterTestSupport() {
    }

    static Scan scan(String scanner, TargetType type, String identifier) {
        return scan(scanner, type, identifier, ScanDepth.NORMAL, new LinkedHashMap<>());
    }

    static Scan scan(String scanner, TargetType type, String identifier, ScanDepth depth, Map<String, Object> config) {
        return Scan.builder()
            .id("scan-1")
            .name("test")
            .scannerType(scanner)
            .target(ScanTarget.of(type, identifier))
            .depth(depth)
            .scannerConfig(config)
            .status(ScanStatus.RUNNING)
            .build();
    }
}
