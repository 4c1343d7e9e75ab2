package com.intellivuln.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Цель сканирования: тип и идентификатор (образ, хост, путь, URL репозитория)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanTarget {
    private TargetType type;
    private String identifier;

    public static ScanTarget of(TargetType type, String identifier) {
        return new ScanTarget(type, identifier);
    }
}
