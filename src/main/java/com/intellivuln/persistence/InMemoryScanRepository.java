package com.intellivuln.persistence;

import com.intellivuln.models.Scan;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public class InMemoryScanRepository implements ScanRepository {

    private final InMemoryStore<Scan> store = new InMemoryStore<>("Сканирование", Scan::getId, Scan::copy);

    @Override
    public Scan save(Scan scan) {
        return store.save(scan);
    }

    @Override
    public Optional<Scan> findById(String id) {
        return store.findById(id);
    }

    @Override
    public List<Scan> findAll() {
        List<Scan> scans = store.find(scan -> true);
        scans.sort(Comparator.comparing(Scan::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return scans;
    }

    @Override
    public Scan update(String id, UnaryOperator<Scan> mutation) {
        return store.update(id, mutation);
    }

    @Override
    public boolean delete(String id) {
        return store.delete(id);
    }
}
