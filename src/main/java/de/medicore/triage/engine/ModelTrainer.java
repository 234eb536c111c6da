package de.medicore.triage.engine;

import de.medicore.triage.classifier.MultinomialNaiveBayes;
import de.medicore.triage.classifier.NaiveBayesModel;
import de.medicore.triage.config.TriageProperties;
import de.medicore.triage.corpus.TrainingExample;
import de.medicore.triage.features.FittedVectorizer;
import de.medicore.triage.features.SparseVector;
import de.medicore.triage.features.TfidfVectorizer;
import de.medicore.triage.model.Severity;
import de.medicore.triage.nlp.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs normalize, TF-IDF fit and naive Bayes fit over a labeled corpus.
 */
@Component
public class ModelTrainer {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainer.class);

    public static final String MODEL_VERSION = "tfidf-mnb-v1";

    private final TextNormalizer normalizer;
    private final TriageProperties.Model cfg;

    public ModelTrainer(TextNormalizer normalizer, TriageProperties properties) {
        this.normalizer = normalizer;
        this.cfg = properties.getModel();
    }

    public TrainingOutcome train(List<TrainingExample> corpus) {
        if (!cfg.isEnabled()) {
            return TrainingOutcome.failed(TrainingOutcome.FailureKind.DEPENDENCY_UNAVAILABLE,
                    "statistical engine disabled (triage.model.enabled=false)");
        }

        try {
            List<String> documents = new ArrayList<>(corpus.size());
            List<Severity> labels = new ArrayList<>(corpus.size());
            for (TrainingExample example : corpus) {
                documents.add(normalizer.normalize(example.text()));
                labels.add(example.label());
            }

            FittedVectorizer vectorizer = new TfidfVectorizer(cfg.getMaxFeatures()).fit(documents);
            List<SparseVector> features = new ArrayList<>(documents.size());
            for (String doc : documents) {
                features.add(vectorizer.transform(doc));
            }
            NaiveBayesModel classifier = new MultinomialNaiveBayes(cfg.getSmoothingAlpha()).fit(features, labels);

            return TrainingOutcome.ready(new TrainedModel(vectorizer, classifier, MODEL_VERSION));
        } catch (RuntimeException e) {
            log.error("Error fitting triage model on {} examples", corpus.size(), e);
            return TrainingOutcome.failed(TrainingOutcome.FailureKind.TRAINING_FAILED, String.valueOf(e.getMessage()));
        } catch (LinkageError e) {
            log.error("Triage model classes not loadable", e);
            return TrainingOutcome.failed(TrainingOutcome.FailureKind.DEPENDENCY_UNAVAILABLE, e.toString());
        }
    }
}
