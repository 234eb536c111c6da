package de.medicore.triage.classifier;

import de.medicore.triage.features.SparseVector;
import de.medicore.triage.model.Severity;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fitted parameters of {@link MultinomialNaiveBayes}. Immutable.
 */
public final class NaiveBayesModel {

    private final int dimension;
    private final double[] logPrior;
    private final double[][] logLikelihood;

    NaiveBayesModel(int dimension, double[] logPrior, double[][] logLikelihood) {
        this.dimension = dimension;
        this.logPrior = logPrior;
        this.logLikelihood = logLikelihood;
    }

    public ClassificationResult predict(SparseVector x) {
        if (x.dimension() != dimension) {
            throw new IllegalArgumentException(
                    "expected dimension " + dimension + " but got " + x.dimension());
        }

        double[] joint = jointLogLikelihood(x);
        int best = 0;
        for (int c = 1; c < joint.length; c++) {
            if (joint[c] > joint[best]) {
                best = c;
            }
        }

        // log-sum-exp around the best score; exp(-inf) is 0 so empty classes stay at 0
        double max = joint[best];
        double sum = 0.0;
        double[] p = new double[joint.length];
        for (int c = 0; c < joint.length; c++) {
            p[c] = Math.exp(joint[c] - max);
            sum += p[c];
        }

        Map<Severity, Double> probabilities = new EnumMap<>(Severity.class);
        for (int c = 0; c < p.length; c++) {
            probabilities.put(Severity.CLASSES.get(c), p[c] / sum);
        }
        return new ClassificationResult(Severity.CLASSES.get(best), p[best] / sum, probabilities);
    }

    double[] jointLogLikelihood(SparseVector x) {
        double[] joint = logPrior.clone();
        for (int c = 0; c < joint.length; c++) {
            if (joint[c] == Double.NEGATIVE_INFINITY) {
                continue;
            }
            for (int i = 0; i < x.size(); i++) {
                joint[c] += x.valueAt(i) * logLikelihood[c][x.indexAt(i)];
            }
        }
        return joint;
    }

    public int dimension() {
        return dimension;
    }
}
