package com.intellivuln.persistence;

import com.intellivuln.models.Vulnerability;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Хранилище уязвимостей с выборкой по сканированию и по активу
 */
public interface VulnerabilityRepository {

    Vulnerability save(Vulnerability vulnerability);

    Optional<Vulnerability> findById(String id);

    List<Vulnerability> findByScanId(String scanId);

    List<Vulnerability> findByAssetId(String assetId);

    List<Vulnerability> findAll();

    Vulnerability update(String id, UnaryOperator<Vulnerability> mutation);

    boolean delete(String id);

    /**
     * @return число удаленных записей
     */
    int deleteByScanId(String scanId);
}
