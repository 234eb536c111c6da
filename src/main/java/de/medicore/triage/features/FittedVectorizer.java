package de.medicore.triage.features;

import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only result of {@link TfidfVectorizer#fit}. Safe to share between threads.
 */
public final class FittedVectorizer {

    private final Vocabulary vocabulary;
    private final double[] idf;

    FittedVectorizer(Vocabulary vocabulary, double[] idf) {
        this.vocabulary = vocabulary;
        this.idf = idf;
    }

    /**
     * Raw term counts times IDF, L2-normalized. Out-of-vocabulary terms are ignored
     * and a document without known terms maps to the zero vector.
     */
    public SparseVector transform(String normalizedText) {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (String token : TfidfVectorizer.tokenize(normalizedText)) {
            int idx = vocabulary.indexOf(token);
            if (idx != Vocabulary.ABSENT) {
                counts.merge(idx, 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            return SparseVector.zero(vocabulary.size());
        }

        int[] indices = new int[counts.size()];
        double[] values = new double[counts.size()];
        double sumSq = 0.0;
        int i = 0;
        for (Map.Entry<Integer, Integer> e : counts.entrySet()) {
            indices[i] = e.getKey();
            values[i] = e.getValue() * idf[e.getKey()];
            sumSq += values[i] * values[i];
            i++;
        }
        double norm = Math.sqrt(sumSq);
        for (int j = 0; j < values.length; j++) {
            values[j] /= norm;
        }
        return new SparseVector(vocabulary.size(), indices, values);
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    public double idf(String term) {
        int idx = vocabulary.indexOf(term);
        if (idx == Vocabulary.ABSENT) {
            throw new IllegalArgumentException("term not in vocabulary: " + term);
        }
        return idf[idx];
    }

    public int dimension() {
        return vocabulary.size();
    }
}
