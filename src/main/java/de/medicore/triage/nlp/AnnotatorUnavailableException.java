package de.medicore.triage.nlp;

public class AnnotatorUnavailableException extends Exception {

    public AnnotatorUnavailableException(String message) {
        super(message);
    }

    public AnnotatorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
