package com.intellivuln.core;

import com.intellivuln.models.Scan;
import com.intellivuln.models.ScanStatus;
import com.intellivuln.models.ScannerKind;
import lombok.Builder;
import lombok.Data;

import java.util.Objects;

/**
 * Фильтр списка сканирований. Пустые поля не ограничивают выборку.
 */
@Data
@Builder
public class ScanFilter {
    private ScanStatus status;
    private ScannerKind scannerKind;
    private String assetId;

    public static ScanFilter any() {
        return ScanFilter.builder().build();
    }

    public boolean matches(Scan scan) {
        if (status != null && scan.getStatus() != status) {
            return false;
        }
        if (scannerKind != null && scan.resolveScannerKind().orElse(null) != scannerKind) {
            return false;
        }
        return assetId == null || Objects.equals(assetId, scan.getAssetId());
    }
}
