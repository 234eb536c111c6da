package de.medicore.triage.engine;

import de.medicore.triage.classifier.ClassificationResult;
import de.medicore.triage.classifier.NaiveBayesModel;
import de.medicore.triage.features.FittedVectorizer;

/**
 * Vocabulary, IDF weights and classifier parameters fitted together. Never mutated after training.
 */
public final class TrainedModel {

    private final FittedVectorizer vectorizer;
    private final NaiveBayesModel classifier;
    private final String version;

    public TrainedModel(FittedVectorizer vectorizer, NaiveBayesModel classifier, String version) {
        if (vectorizer.dimension() != classifier.dimension()) {
            throw new IllegalArgumentException("vectorizer and classifier dimensions differ");
        }
        this.vectorizer = vectorizer;
        this.classifier = classifier;
        this.version = version;
    }

    public ClassificationResult classify(String normalizedText) {
        return classifier.predict(vectorizer.transform(normalizedText));
    }

    public FittedVectorizer getVectorizer() {
        return vectorizer;
    }

    public String getVersion() {
        return version;
    }

    public int getVocabularySize() {
        return vectorizer.dimension();
    }
}
