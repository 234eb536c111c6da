package de.medicore.triage.nlp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns raw symptom text into space-separated tokens.
 * <p>
 * Uses the linguistic annotator (stopword and punctuation removal, lemmatization)
 * when one can be loaded, otherwise lower-cases and strips punctuation. Both paths
 * return the same shape, callers cannot tell which one ran.
 */
@Component
public class TextNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TextNormalizer.class);

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    // resolved-but-absent marker, distinct from "not loaded yet" (null)
    private static final LinguisticAnnotator NOT_AVAILABLE = text -> List.of();

    private final AnnotatorLoader loader;
    private final Object loadLock = new Object();
    private volatile LinguisticAnnotator annotator;

    public TextNormalizer(AnnotatorLoader loader) {
        this.loader = loader;
    }

    public String normalize(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);

        LinguisticAnnotator a = annotator();
        if (a != NOT_AVAILABLE) {
            try {
                return a.annotate(lower).stream()
                        .filter(t -> !t.stopword() && !t.punctuation())
                        .map(AnnotatedToken::lemma)
                        .collect(Collectors.joining(" "));
            } catch (RuntimeException | LinkageError e) {
                log.debug("Annotator failed, using regex normalization", e);
            }
        }
        return NON_WORD.matcher(lower).replaceAll("");
    }

    public boolean isAnnotatorAvailable() {
        return annotator() != NOT_AVAILABLE;
    }

    private LinguisticAnnotator annotator() {
        LinguisticAnnotator a = annotator;
        if (a == null) {
            synchronized (loadLock) {
                a = annotator;
                if (a == null) {
                    a = loadOnce();
                    annotator = a;
                }
            }
        }
        return a;
    }

    private LinguisticAnnotator loadOnce() {
        try {
            LinguisticAnnotator loaded = loader.load();
            log.info("Linguistic annotator loaded");
            return loaded;
        } catch (AnnotatorUnavailableException e) {
            log.warn("Linguistic annotator unavailable, using simple tokenization: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to load linguistic annotator, using simple tokenization", e);
        } catch (LinkageError e) {
            // OpenNLP classes missing or incompatible at runtime
            log.warn("Linguistic annotator classes not loadable, using simple tokenization: {}", e.toString());
        }
        return NOT_AVAILABLE;
    }
}
