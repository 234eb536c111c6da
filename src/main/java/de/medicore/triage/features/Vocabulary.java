package de.medicore.triage.features;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Frozen term to feature-index mapping. Indices follow the term order given at construction.
 */
public final class Vocabulary {

    public static final int ABSENT = -1;

    private final List<String> terms;
    private final Map<String, Integer> index;

    public Vocabulary(List<String> terms) {
        Map<String, Integer> m = new HashMap<>();
        for (int i = 0; i < terms.size(); i++) {
            if (m.put(terms.get(i), i) != null) {
                throw new IllegalArgumentException("duplicate term: " + terms.get(i));
            }
        }
        this.terms = List.copyOf(terms);
        this.index = Collections.unmodifiableMap(m);
    }

    public int indexOf(String term) {
        return index.getOrDefault(term, ABSENT);
    }

    public boolean contains(String term) {
        return index.containsKey(term);
    }

    public String termAt(int i) {
        return terms.get(i);
    }

    public List<String> terms() {
        return terms;
    }

    public int size() {
        return terms.size();
    }
}
