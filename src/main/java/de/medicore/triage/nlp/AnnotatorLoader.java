package de.medicore.triage.nlp;

@FunctionalInterface
public interface AnnotatorLoader {

    LinguisticAnnotator load() throws AnnotatorUnavailableException;
}
