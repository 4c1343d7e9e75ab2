package com.intellivuln.ml;

import smile.classification.GradientTreeBoost;
import smile.data.DataFrame;
import smile.data.Tuple;
import smile.data.formula.Formula;
import smile.data.vector.IntVector;

import java.util.List;

/**
 * Построение DataFrame для Smile. Столбец метки присутствует и при предсказании,
 * чтобы схема совпадала со схемой обучения.
 */
final class SmileFrames {

    static final String LABEL = "urgent";
    static final Formula FORMULA = Formula.lhs(LABEL);

    private SmileFrames() {
    }

    static DataFrame frame(double[][] x, int[] y, List<String> featureNames) {
        return DataFrame.of(x, featureNames.toArray(new String[0])).merge(IntVector.of(LABEL, y));
    }

    static Tuple row(double[] x, List<String> featureNames) {
        return frame(new double[][] {x}, new int[] {0}, featureNames).get(0);
    }

    /**
     * Апостериорная вероятность срочного класса
     */
    static double urgentProbability(GradientTreeBoost model, double[] x, List<String> featureNames) {
        double[] posteriori = new double[2];
        model.predict(row(x, featureNames), posteriori);
        double probability = posteriori[1];
        if (Double.isNaN(probability)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, probability));
    }
}
