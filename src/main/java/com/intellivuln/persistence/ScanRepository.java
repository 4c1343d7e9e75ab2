package com.intellivuln.persistence;

import com.intellivuln.models.Scan;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Хранилище сканирований. Операции согласованы в пределах одной сущности.
 */
public interface ScanRepository {

    Scan save(Scan scan);

    Optional<Scan> findById(String id);

    List<Scan> findAll();

    /**
     * Атомарно применить изменение к сохраненному сканированию
     *
     * @throws com.intellivuln.errors.EntityNotFoundException если сканирование не найдено
     */
    Scan update(String id, UnaryOperator<Scan> mutation);

    boolean delete(String id);
}
