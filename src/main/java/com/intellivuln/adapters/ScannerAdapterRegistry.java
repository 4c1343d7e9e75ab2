package com.intellivuln.adapters;

import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.models.ScannerKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Реестр адаптеров по виду сканера
 */
public class ScannerAdapterRegistry {

    private final Map<ScannerKind, ScannerAdapter> adapters = new EnumMap<>(ScannerKind.class);

    public ScannerAdapterRegistry register(ScannerAdapter adapter) {
        adapters.put(adapter.kind(), adapter);
        return this;
    }

    public Optional<ScannerAdapter> find(ScannerKind kind) {
        return Optional.ofNullable(kind != null ? adapters.get(kind) : null);
    }

    /**
     * Поиск по объявленному имени сканера
     */
    public Optional<ScannerAdapter> find(String rawKind) {
        return ScannerKind.fromValue(rawKind).flatMap(this::find);
    }

    public Collection<ScannerAdapter> all() {
        return Collections.unmodifiableCollection(adapters.values());
    }

    /**
     * Реестр со всеми встроенными адаптерами
     */
    public static ScannerAdapterRegistry withDefaults(VulnScanConfig config, ProcessRunner processRunner) {
        return new ScannerAdapterRegistry()
            .register(new TrivyAdapter(config, processRunner))
            .register(new DependencyCheckAdapter(config, processRunner))
            .register(new OpenVasAdapter(config, processRunner))
            .register(new CustomAdapter(config, processRunner));
    }
}
