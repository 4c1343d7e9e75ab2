package com.intellivuln.persistence;

import com.intellivuln.errors.EntityNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Потокобезопасное хранилище в памяти. Наружу выдаются только копии,
 * изменения применяются атомарно через ConcurrentHashMap.compute.
 */
class InMemoryStore<T> {

    private final ConcurrentHashMap<String, T> items = new ConcurrentHashMap<>();
    private final String entityType;
    private final Function<T, String> idOf;
    private final UnaryOperator<T> copier;

    InMemoryStore(String entityType, Function<T, String> idOf, UnaryOperator<T> copier) {
        this.entityType = entityType;
        this.idOf = idOf;
        this.copier = copier;
    }

    T save(T item) {
        String id = idOf.apply(item);
        if (id == null) {
            throw new IllegalArgumentException(entityType + ": идентификатор не задан");
        }
        items.put(id, copier.apply(item));
        return copier.apply(item);
    }

    Optional<T> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(items.get(id)).map(copier);
    }

    List<T> find(Predicate<T> filter) {
        List<T> result = new ArrayList<>();
        for (T item : items.values()) {
            if (filter.test(item)) {
                result.add(copier.apply(item));
            }
        }
        return result;
    }

    T update(String id, UnaryOperator<T> mutation) {
        if (id == null) {
            throw new EntityNotFoundException(entityType, "null");
        }
        T updated = items.computeIfPresent(id, (key, current) -> {
            T next = mutation.apply(copier.apply(current));
            return next != null ? copier.apply(next) : current;
        });
        if (updated == null) {
            throw new EntityNotFoundException(entityType, id);
        }
        return copier.apply(updated);
    }

    boolean delete(String id) {
        return id != null && items.remove(id) != null;
    }

    int deleteIf(Predicate<T> filter) {
        int removed = 0;
        for (var entry : items.entrySet()) {
            if (filter.test(entry.getValue()) && items.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }
}
