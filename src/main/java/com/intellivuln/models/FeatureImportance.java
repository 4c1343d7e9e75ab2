package com.intellivuln.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Нормализованная важность признака
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureImportance {
    private String feature;
    private double importance;
    private String description;
}
