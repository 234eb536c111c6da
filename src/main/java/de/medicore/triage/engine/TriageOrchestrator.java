package de.medicore.triage.engine;

import de.medicore.triage.classifier.ClassificationResult;
import de.medicore.triage.config.TriageProperties;
import de.medicore.triage.corpus.TrainingCorpus;
import de.medicore.triage.corpus.TrainingExample;
import de.medicore.triage.model.AssessmentResult;
import de.medicore.triage.nlp.TextNormalizer;
import de.medicore.triage.recommendation.RecommendationGenerator;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class TriageOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TriageOrchestrator.class);

    public static final String MODEL_UNAVAILABLE_MESSAGE =
            "Error in AI model. Please consult with a healthcare professional directly.";
    public static final String ASSESSMENT_FAILED_MESSAGE =
            "An error occurred during assessment. Please consult with a healthcare professional.";

    private final TextNormalizer normalizer;
    private final ModelTrainer trainer;
    private final RecommendationGenerator recommendations;
    private final TriageProperties properties;
    private final List<TrainingExample> corpus;

    // trained at most once; READY and DEGRADED are final
    private final Object initLock = new Object();
    private volatile ModelState state = ModelState.UNINITIALIZED;
    private volatile TrainedModel model;

    public TriageOrchestrator(TextNormalizer normalizer,
                              ModelTrainer trainer,
                              RecommendationGenerator recommendations,
                              TriageProperties properties) {
        this(normalizer, trainer, recommendations, properties, TrainingCorpus.all());
    }

    TriageOrchestrator(TextNormalizer normalizer,
                       ModelTrainer trainer,
                       RecommendationGenerator recommendations,
                       TriageProperties properties,
                       List<TrainingExample> corpus) {
        this.normalizer = normalizer;
        this.trainer = trainer;
        this.recommendations = recommendations;
        this.properties = properties;
        this.corpus = corpus;
    }

    @PostConstruct
    void warmUp() {
        if (properties.getModel().isEagerInit()) {
            initialize();
        }
    }

    public ModelState initialize() {
        if (state != ModelState.UNINITIALIZED) {
            return state;
        }
        synchronized (initLock) {
            if (state != ModelState.UNINITIALIZED) {
                return state;
            }
            TrainingOutcome outcome = trainSafely();
            if (outcome.isReady()) {
                model = outcome.getModel();
                state = ModelState.READY;
                log.info("Triage model ready version={} vocabularySize={} examples={}",
                        model.getVersion(), model.getVocabularySize(), corpus.size());
            } else {
                state = ModelState.DEGRADED;
                log.warn("Triage model unavailable, running in degraded mode. kind={} reason={}",
                        outcome.getFailureKind(), outcome.getMessage());
            }
            return state;
        }
    }

    private TrainingOutcome trainSafely() {
        try {
            return trainer.train(corpus);
        } catch (RuntimeException e) {
            log.error("Triage model training aborted", e);
            return TrainingOutcome.failed(TrainingOutcome.FailureKind.TRAINING_FAILED, String.valueOf(e.getMessage()));
        } catch (LinkageError e) {
            log.error("Triage model training aborted", e);
            return TrainingOutcome.failed(TrainingOutcome.FailureKind.DEPENDENCY_UNAVAILABLE, e.toString());
        }
    }

    public AssessmentResult assess(String symptomsText) {
        if (initialize() != ModelState.READY) {
            return AssessmentResult.unknown(MODEL_UNAVAILABLE_MESSAGE);
        }

        try {
            String normalized = normalizer.normalize(symptomsText == null ? "" : symptomsText);
            ClassificationResult result = model.classify(normalized);
            double confidence = result.getConfidence();
            String recommendation = recommendations.recommend(result.getLabel(), confidence,
                    properties.getRecommendation().getConfidenceThreshold());
            return new AssessmentResult(result.getLabel(), recommendation, confidence);
        } catch (RuntimeException | LinkageError e) {
            log.error("Error in symptom assessment", e);
            return AssessmentResult.unknown(ASSESSMENT_FAILED_MESSAGE);
        }
    }

    public ModelState getState() {
        return state;
    }

    public Optional<TrainedModel> getModel() {
        return Optional.ofNullable(model);
    }
}
