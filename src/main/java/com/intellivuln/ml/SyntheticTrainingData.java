package com.intellivuln.ml;

import com.intellivuln.models.BusinessImpact;
import com.intellivuln.models.DataClassification;
import com.intellivuln.models.ExploitMaturity;
import com.intellivuln.models.Severity;
import com.intellivuln.models.SystemExposure;
import com.intellivuln.models.Vulnerability;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Воспроизводимая стартовая выборка, пока нет исторических оценок аналитиков.
 *
 * <p>Вес: CVSS·0.4, эксплойт +2, нет исправления +1.5, critical +2.5, high +1.5,
 * критическое влияние на бизнес +2, высокое +1. Итог зажат в [0, 10];
 * запись срочная при итоге не ниже 5.</p>
 */
public final class SyntheticTrainingData {

    public static final double URGENT_SCORE = 5.0;

    private SyntheticTrainingData() {
    }

    public static TrainingDataset generate(int size, long seed) {
        Random random = new Random(seed);
        List<TrainingRecord> records = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            double cvss = Math.round(random.nextDouble() * 100.0) / 10.0;
            boolean exploit = random.nextDouble() > 0.7;
            boolean patch = random.nextDouble() > 0.5;
            Severity severity = bucket(random.nextDouble(), Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW);
            BusinessImpact impact = bucket(random.nextDouble(),
                BusinessImpact.CRITICAL, BusinessImpact.HIGH, BusinessImpact.MEDIUM, BusinessImpact.LOW);

            Vulnerability vulnerability = Vulnerability.builder()
                .id("synthetic-" + i)
                .title("Synthetic vulnerability " + i)
                .cvssScore(cvss)
                .severity(severity)
                .exploitAvailable(exploit)
                .exploitMaturity(pick(random, ExploitMaturity.values()))
                .patchAvailable(patch)
                .businessImpact(impact)
                .dataClassification(pick(random, DataClassification.values()))
                .systemExposure(pick(random, SystemExposure.values()))
                .build();

            double score = score(cvss, exploit, patch, severity, impact);
            records.add(TrainingRecord.builder()
                .vulnerability(vulnerability)
                .priorityScore(score / 10.0)
                .urgent(score >= URGENT_SCORE)
                .build());
        }
        return new TrainingDataset(records);
    }

    static double score(double cvss, boolean exploit, boolean patch, Severity severity, BusinessImpact impact) {
        double score = cvss * 0.4
            + (exploit ? 2.0 : 0.0)
            + (patch ? 0.0 : 1.5)
            + (severity == Severity.CRITICAL ? 2.5 : 0.0)
            + (severity == Severity.HIGH ? 1.5 : 0.0)
            + (impact == BusinessImpact.CRITICAL ? 2.0 : 0.0)
            + (impact == BusinessImpact.HIGH ? 1.0 : 0.0);
        return Math.max(0.0, Math.min(10.0, score));
    }

    /**
     * &gt; 0.8 первый, (0.6, 0.8] второй, (0.3, 0.6] третий, иначе четвертый
     */
    private static <T> T bucket(double value, T top, T second, T third, T rest) {
        if (value > 0.8) {
            return top;
        }
        if (value > 0.6) {
            return second;
        }
        if (value > 0.3) {
            return third;
        }
        return rest;
    }

    private static <T> T pick(Random random, T[] values) {
        return values[random.nextInt(values.length)];
    }
}
