package com.intellivuln.persistence;

import com.intellivuln.models.Vulnerability;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

public class InMemoryVulnerabilityRepository implements VulnerabilityRepository {

    private static final Comparator<Vulnerability> BY_CREATION =
        Comparator.comparing(Vulnerability::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final InMemoryStore<Vulnerability> store =
        new InMemoryStore<>("Уязвимость", Vulnerability::getId, Vulnerability::copy);

    @Override
    public Vulnerability save(Vulnerability vulnerability) {
        return store.save(vulnerability);
    }

    @Override
    public Optional<Vulnerability> findById(String id) {
        return store.findById(id);
    }

    @Override
    public List<Vulnerability> findByScanId(String scanId) {
        List<Vulnerability> result = store.find(v -> Objects.equals(v.getScanId(), scanId));
        result.sort(BY_CREATION);
        return result;
    }

    @Override
    public List<Vulnerability> findByAssetId(String assetId) {
        List<Vulnerability> result = store.find(v -> Objects.equals(v.getAssetId(), assetId));
        result.sort(BY_CREATION);
        return result;
    }

    @Override
    public List<Vulnerability> findAll() {
        List<Vulnerability> result = store.find(v -> true);
        result.sort(BY_CREATION);
        return result;
    }

    @Override
    public Vulnerability update(String id, UnaryOperator<Vulnerability> mutation) {
        return store.update(id, mutation);
    }

    @Override
    public boolean delete(String id) {
        return store.delete(id);
    }

    @Override
    public int deleteByScanId(String scanId) {
        return store.deleteIf(v -> Objects.equals(v.getScanId(), scanId));
    }
}
