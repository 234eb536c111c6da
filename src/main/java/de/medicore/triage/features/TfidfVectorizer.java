package de.medicore.triage.features;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class TfidfVectorizer {

    // two or more word characters, single letters like "a" or "i" are not features
    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final int maxFeatures;

    public TfidfVectorizer(int maxFeatures) {
        if (maxFeatures < 1) {
            throw new IllegalArgumentException("maxFeatures must be positive: " + maxFeatures);
        }
        this.maxFeatures = maxFeatures;
    }

    public FittedVectorizer fit(List<String> documents) {
        Map<String, Integer> documentFrequency = new TreeMap<>();
        for (String doc : documents) {
            for (String term : new HashSet<>(tokenize(doc))) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }
        if (documentFrequency.isEmpty()) {
            throw new IllegalStateException("empty vocabulary; documents contain no terms");
        }

        // highest document frequency first, ties alphabetical
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(documentFrequency.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue().reversed()
                .thenComparing(Map.Entry.<String, Integer>comparingByKey()));

        List<String> kept = new ArrayList<>();
        for (int i = 0; i < ranked.size() && i < maxFeatures; i++) {
            kept.add(ranked.get(i).getKey());
        }
        kept.sort(Comparator.naturalOrder());

        Vocabulary vocabulary = new Vocabulary(kept);
        int n = documents.size();
        double[] idf = new double[vocabulary.size()];
        for (int i = 0; i < idf.length; i++) {
            int df = documentFrequency.get(vocabulary.termAt(i));
            idf[i] = Math.log((1.0 + n) / (1.0 + df)) + 1.0;
        }
        return new FittedVectorizer(vocabulary, idf);
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }
}
