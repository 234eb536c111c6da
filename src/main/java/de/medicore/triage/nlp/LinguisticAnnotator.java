package de.medicore.triage.nlp;

import java.util.List;

/**
 * Tokenizes text and tags each token with its lemma and stopword/punctuation flags.
 * Implementations must be safe for concurrent use.
 */
public interface LinguisticAnnotator {

    List<AnnotatedToken> annotate(String text);
}
