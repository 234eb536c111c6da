package de.medicore.triage.model;

public class AssessmentResult {

    private final Severity severity;
    private final String recommendation;
    private final double confidence;     // 0..1

    public AssessmentResult(Severity severity, String recommendation, double confidence) {
        this.severity = severity;
        this.recommendation = recommendation;
        this.confidence = confidence;
    }

    public static AssessmentResult unknown(String recommendation) {
        return new AssessmentResult(Severity.UNKNOWN, recommendation, 0.0);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return "AssessmentResult{severity=" + severity.getLabel() + ", confidence=" + confidence + "}";
    }
}
