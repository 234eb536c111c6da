package de.medicore.triage.nlp;

import de.medicore.triage.config.TriageProperties;
import opennlp.tools.lemmatizer.DictionaryLemmatizer;
import opennlp.tools.lemmatizer.Lemmatizer;
import opennlp.tools.postag.POSModel;
import opennlp.tools.postag.POSTaggerME;
import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.tokenize.Tokenizer;
import opennlp.tools.tokenize.TokenizerME;
import opennlp.tools.tokenize.TokenizerModel;
import opennlp.tools.util.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * OpenNLP-backed annotator: tokenizer, maxent POS tagger and dictionary lemmatizer.
 * <p>
 * The POS model and the lemma dictionary are required; without them the annotator
 * cannot be built and {@link #fromClasspath} reports it as unavailable. The
 * tokenizer model is optional, the rule-based {@link SimpleTokenizer} is used instead.
 */
public class OpenNlpAnnotator implements LinguisticAnnotator {

    private static final Logger log = LoggerFactory.getLogger(OpenNlpAnnotator.class);

    // lemma returned by DictionaryLemmatizer for words it does not know
    private static final String UNKNOWN_LEMMA = "O";

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w]+", Pattern.UNICODE_CHARACTER_CLASS);

    private final Tokenizer tokenizer;
    private final Function<String[], String[]> tagger;
    private final Lemmatizer lemmatizer;
    private final Set<String> stopwords;

    OpenNlpAnnotator(Tokenizer tokenizer, Function<String[], String[]> tagger,
                     Lemmatizer lemmatizer, Set<String> stopwords) {
        this.tokenizer = tokenizer;
        this.tagger = tagger;
        this.lemmatizer = lemmatizer;
        this.stopwords = Collections.unmodifiableSet(new HashSet<>(stopwords));
    }

    public static OpenNlpAnnotator fromClasspath(TriageProperties.Annotator cfg)
            throws AnnotatorUnavailableException {
        ClassLoader cl = OpenNlpAnnotator.class.getClassLoader();
        try {
            POSModel posModel;
            try (InputStream in = open(cl, cfg.getPosModel())) {
                posModel = new POSModel(in);
            }
            DictionaryLemmatizer lemmatizer;
            try (InputStream in = open(cl, cfg.getLemmaDictionary())) {
                lemmatizer = new DictionaryLemmatizer(in);
            }
            Set<String> stopwords;
            try (InputStream in = open(cl, cfg.getStopwords())) {
                stopwords = readStopwords(in);
            }

            // POSTaggerME and TokenizerME are not thread-safe
            ThreadLocal<POSTaggerME> pos = ThreadLocal.withInitial(() -> new POSTaggerME(posModel));
            return new OpenNlpAnnotator(loadTokenizer(cl, cfg.getTokenizerModel()),
                    tokens -> pos.get().tag(tokens), lemmatizer, stopwords);
        } catch (IOException e) {
            throw new AnnotatorUnavailableException("Failed to read OpenNLP resources", e);
        }
    }

    @Override
    public List<AnnotatedToken> annotate(String text) {
        String[] tokens = tokenizer.tokenize(text);
        if (tokens.length == 0) {
            return List.of();
        }
        String[] tags = tagger.apply(tokens);
        String[] lemmas = lemmatizer.lemmatize(tokens, tags);

        List<AnnotatedToken> out = new ArrayList<>(tokens.length);
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            String lemma = UNKNOWN_LEMMA.equals(lemmas[i]) ? token : lemmas[i];
            out.add(new AnnotatedToken(token, lemma,
                    stopwords.contains(token.toLowerCase(Locale.ROOT)),
                    PUNCTUATION.matcher(token).matches()));
        }
        return out;
    }

    private static Tokenizer loadTokenizer(ClassLoader cl, String location) throws IOException {
        InputStream in = location == null ? null : cl.getResourceAsStream(location);
        if (in == null) {
            log.info("No tokenizer model at {}, using SimpleTokenizer", location);
            return SimpleTokenizer.INSTANCE;
        }
        try (in) {
            TokenizerModel model = new TokenizerModel(in);
            ThreadLocal<TokenizerME> tok = ThreadLocal.withInitial(() -> new TokenizerME(model));
            return new Tokenizer() {
                @Override
                public String[] tokenize(String s) {
                    return tok.get().tokenize(s);
                }

                @Override
                public Span[] tokenizePos(String s) {
                    return tok.get().tokenizePos(s);
                }
            };
        }
    }

    private static InputStream open(ClassLoader cl, String location) throws AnnotatorUnavailableException {
        InputStream in = location == null ? null : cl.getResourceAsStream(location);
        if (in == null) {
            throw new AnnotatorUnavailableException("OpenNLP resource not found on classpath: " + location);
        }
        return in;
    }

    static Set<String> readStopwords(InputStream in) throws IOException {
        Set<String> words = new HashSet<>();
        try (BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                String w = line.trim().toLowerCase(Locale.ROOT);
                if (!w.isEmpty() && !w.startsWith("#")) {
                    words.add(w);
                }
            }
        }
        return words;
    }
}
