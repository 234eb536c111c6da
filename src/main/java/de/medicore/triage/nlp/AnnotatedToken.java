package de.medicore.triage.nlp;

public record AnnotatedToken(String text, String lemma, boolean stopword, boolean punctuation) {
}
