package de.medicore.triage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public enum Severity {

    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical"),
    UNKNOWN("Unknown");

    /** The four labels the classifier is trained on, in ascending order. */
    public static final List<Severity> CLASSES = List.of(LOW, MEDIUM, HIGH, CRITICAL);

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isClassifiable() {
        return this != UNKNOWN;
    }
}
