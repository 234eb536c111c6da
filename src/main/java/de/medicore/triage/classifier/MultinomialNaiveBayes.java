package de.medicore.triage.classifier;

import de.medicore.triage.features.SparseVector;
import de.medicore.triage.model.Severity;

import java.util.List;

public class MultinomialNaiveBayes {

    private final double alpha;

    public MultinomialNaiveBayes(double alpha) {
        if (!(alpha > 0.0) || Double.isInfinite(alpha)) {
            throw new IllegalArgumentException("alpha must be a positive finite number: " + alpha);
        }
        this.alpha = alpha;
    }

    public NaiveBayesModel fit(List<SparseVector> features, List<Severity> labels) {
        if (features.size() != labels.size()) {
            throw new IllegalArgumentException(
                    "features and labels differ in size: " + features.size() + " vs " + labels.size());
        }
        if (features.isEmpty()) {
            throw new IllegalArgumentException("no training examples");
        }

        int dim = features.get(0).dimension();
        int k = Severity.CLASSES.size();
        int[] classCount = new int[k];
        double[][] weightSum = new double[k][dim];
        double[] classTotal = new double[k];

        for (int n = 0; n < features.size(); n++) {
            SparseVector x = features.get(n);
            if (x.dimension() != dim) {
                throw new IllegalArgumentException("inconsistent feature dimension at example " + n);
            }
            int c = classIndex(labels.get(n));
            classCount[c]++;
            for (int i = 0; i < x.size(); i++) {
                double w = x.valueAt(i);
                if (w < 0.0 || Double.isNaN(w)) {
                    throw new IllegalArgumentException("feature weights must be non-negative");
                }
                weightSum[c][x.indexAt(i)] += w;
                classTotal[c] += w;
            }
        }

        double[] logPrior = new double[k];
        double[][] logLikelihood = new double[k][dim];
        for (int c = 0; c < k; c++) {
            // a class without examples can never win; it keeps probability zero
            logPrior[c] = classCount[c] == 0
                    ? Double.NEGATIVE_INFINITY
                    : Math.log((double) classCount[c] / features.size());
            // (w_cf + alpha) / (w_c + alpha * |V|)
            double denominator = classTotal[c] + alpha * dim;
            for (int f = 0; f < dim; f++) {
                logLikelihood[c][f] = Math.log((weightSum[c][f] + alpha) / denominator);
            }
        }
        return new NaiveBayesModel(dim, logPrior, logLikelihood);
    }

    private static int classIndex(Severity label) {
        int c = Severity.CLASSES.indexOf(label);
        if (c < 0) {
            throw new IllegalArgumentException("not a trainable label: " + label);
        }
        return c;
    }
}
