package com.intellivuln.ml;

import com.intellivuln.models.Vulnerability;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Историческая уязвимость с известным исходом.
 * Явная метка urgent важнее аналитической оценки priorityScore.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingRecord {
    private Vulnerability vulnerability;

    /**
     * Оценка приоритета аналитиком в диапазоне [0, 1]
     */
    private Double priorityScore;
    private Boolean urgent;

    public boolean isLabeled() {
        return urgent != null || priorityScore != null;
    }

    /**
     * 1 если запись срочная: явная метка или оценка не ниже порога
     */
    public int label(double threshold) {
        if (urgent != null) {
            return urgent ? 1 : 0;
        }
        return priorityScore != null && priorityScore >= threshold ? 1 : 0;
    }
}
