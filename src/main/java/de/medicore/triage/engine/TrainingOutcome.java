package de.medicore.triage.engine;

import java.util.Objects;

/**
 * Result of a training run: either a ready model or the kind of failure that prevented it.
 */
public final class TrainingOutcome {

    public enum FailureKind {
        /** The statistical engine is switched off or missing. */
        DEPENDENCY_UNAVAILABLE,
        /** Fitting threw or produced an unusable model. */
        TRAINING_FAILED
    }

    private final TrainedModel model;
    private final FailureKind failureKind;
    private final String message;

    private TrainingOutcome(TrainedModel model, FailureKind failureKind, String message) {
        this.model = model;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static TrainingOutcome ready(TrainedModel model) {
        return new TrainingOutcome(Objects.requireNonNull(model, "model"), null, null);
    }

    public static TrainingOutcome failed(FailureKind kind, String message) {
        return new TrainingOutcome(null, Objects.requireNonNull(kind, "kind"), message);
    }

    public boolean isReady() {
        return model != null;
    }

    public TrainedModel getModel() {
        if (model == null) {
            throw new IllegalStateException("training failed: " + failureKind);
        }
        return model;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getMessage() {
        return message;
    }
}
