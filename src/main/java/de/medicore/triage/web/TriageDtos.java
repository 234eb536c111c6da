package de.medicore.triage.web;

public class TriageDtos {

    public record AssessmentRequest(String symptoms) {}

    public record ModelStatus(String state, String modelVersion, int vocabularySize, double confidenceThreshold) {}
}
