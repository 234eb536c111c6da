package de.medicore.triage.corpus;

import de.medicore.triage.model.Severity;

import java.util.Objects;

public record TrainingExample(String text, Severity label) {

    public TrainingExample {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(label, "label");
        if (!label.isClassifiable()) {
            throw new IllegalArgumentException("training label must be one of " + Severity.CLASSES);
        }
    }
}
