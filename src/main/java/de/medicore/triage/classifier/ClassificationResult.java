package de.medicore.triage.classifier;

import de.medicore.triage.model.Severity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public class ClassificationResult {

    private final Severity label;
    private final double confidence;                 // max class probability
    private final Map<Severity, Double> probabilities;

    public ClassificationResult(Severity label, double confidence, Map<Severity, Double> probabilities) {
        this.label = label;
        this.confidence = confidence;
        this.probabilities = Collections.unmodifiableMap(new EnumMap<>(probabilities));
    }

    public Severity getLabel() {
        return label;
    }

    public double getConfidence() {
        return confidence;
    }

    public Map<Severity, Double> getProbabilities() {
        return probabilities;
    }
}
