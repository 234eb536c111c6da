package de.medicore.triage.engine;

import de.medicore.triage.config.TriageProperties;
import de.medicore.triage.corpus.TrainingCorpus;
import de.medicore.triage.corpus.TrainingExample;
import de.medicore.triage.model.AssessmentResult;
import de.medicore.triage.model.Severity;
import de.medicore.triage.nlp.AnnotatorUnavailableException;
import de.medicore.triage.nlp.TextNormalizer;
import de.medicore.triage.recommendation.RecommendationGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TriageOrchestratorTest {

    private static final List<String> AWKWARD_INPUTS = Arrays.asList(
            "",
            "   ",
            null,
            "!!!???...",
            "我头疼",
            "Kopfschmerzen und Übelkeit seit gestern",
            "🤒 fever 🤒",
            "\n\t\r",
            "chest pain ".repeat(10_000));

    private static TextNormalizer regexNormalizer() {
        return new TextNormalizer(() -> {
            throw new AnnotatorUnavailableException("disabled in test");
        });
    }

    private static TriageOrchestrator orchestrator(TriageProperties props) {
        TextNormalizer normalizer = regexNormalizer();
        return new TriageOrchestrator(normalizer, new ModelTrainer(normalizer, props),
                new RecommendationGenerator(), props);
    }

    private static TriageOrchestrator orchestrator() {
        return orchestrator(new TriageProperties());
    }

    @Test
    @DisplayName("training examples are classified into their own class")
    void corpusSeparation() {
        TriageOrchestrator orchestrator = orchestrator();

        assertEquals(Severity.CRITICAL, orchestrator.assess("Severe chest pain radiating to arm or jaw").getSeverity());
        assertEquals(Severity.LOW, orchestrator.assess("I have a mild headache").getSeverity());
        assertEquals(Severity.MEDIUM, orchestrator.assess("Persistent vomiting").getSeverity());
        assertEquals(Severity.HIGH, orchestrator.assess("Difficulty breathing").getSeverity());
    }

    @Test
    void everyTrainingExampleIsRecovered() {
        TriageOrchestrator orchestrator = orchestrator();

        for (TrainingExample example : TrainingCorpus.all()) {
            assertEquals(example.label(), orchestrator.assess(example.text()).getSeverity(), example.text());
        }
    }

    @Test
    @DisplayName("assess is total: valid severity and confidence for any input")
    void totality() {
        TriageOrchestrator orchestrator = orchestrator();

        for (String input : AWKWARD_INPUTS) {
            AssessmentResult r = assertDoesNotThrow(() -> orchestrator.assess(input));
            assertNotNull(r.getSeverity());
            assertNotNull(r.getRecommendation());
            assertTrue(r.getConfidence() >= 0.0 && r.getConfidence() <= 1.0, String.valueOf(input));
            assertTrue(r.getSeverity().isClassifiable());
        }
    }

    @Test
    void confidenceIsAtLeastUniform() {
        TriageOrchestrator orchestrator = orchestrator();

        for (TrainingExample example : TrainingCorpus.all()) {
            assertTrue(orchestrator.assess(example.text()).getConfidence() >= 0.25 - 1e-12);
        }
        for (String input : AWKWARD_INPUTS) {
            assertTrue(orchestrator.assess(input).getConfidence() >= 0.25 - 1e-12);
        }
    }

    @Test
    void sameTextSameResult() {
        TriageOrchestrator orchestrator = orchestrator();

        AssessmentResult a = orchestrator.assess("sudden chest pain and dizziness");
        AssessmentResult b = orchestrator.assess("sudden chest pain and dizziness");

        assertEquals(a.getSeverity(), b.getSeverity());
        assertEquals(a.getConfidence(), b.getConfidence());
        assertEquals(a.getRecommendation(), b.getRecommendation());
    }

    @Test
    void emptyTextFallsBackToPriors() {
        AssessmentResult r = orchestrator().assess("");

        // the four classes are equally frequent in the corpus
        assertEquals(Severity.LOW, r.getSeverity());
        assertEquals(0.25, r.getConfidence(), 1e-9);
        assertTrue(r.getRecommendation().contains(RecommendationGenerator.DISCLAIMER));
    }

    @Test
    void disclaimerFollowsConfidenceThreshold() {
        for (double threshold : new double[]{0.6, 0.45, 0.3}) {
            TriageProperties props = new TriageProperties();
            props.getRecommendation().setConfidenceThreshold(threshold);
            TriageOrchestrator orchestrator = orchestrator(props);

            for (TrainingExample example : TrainingCorpus.all()) {
                AssessmentResult r = orchestrator.assess(example.text());
                assertEquals(r.getConfidence() < threshold,
                        r.getRecommendation().contains(RecommendationGenerator.DISCLAIMER),
                        example.text() + " @ " + threshold);
            }
        }
    }

    @Test
    void lowThresholdDropsDisclaimer() {
        TriageProperties props = new TriageProperties();
        props.getRecommendation().setConfidenceThreshold(0.3);

        AssessmentResult r = orchestrator(props).assess("Mild sore throat");

        assertEquals(Severity.LOW, r.getSeverity());
        assertFalse(r.getRecommendation().contains(RecommendationGenerator.DISCLAIMER));
    }

    @Test
    @DisplayName("disabled statistical engine gives the fixed Unknown result")
    void degradedFallback() {
        TriageProperties props = new TriageProperties();
        props.getModel().setEnabled(false);
        TriageOrchestrator orchestrator = orchestrator(props);

        AssessmentResult r = orchestrator.assess("anything");

        assertEquals(Severity.UNKNOWN, r.getSeverity());
        assertEquals(0.0, r.getConfidence());
        assertEquals(TriageOrchestrator.MODEL_UNAVAILABLE_MESSAGE, r.getRecommendation());
        assertEquals(ModelState.DEGRADED, orchestrator.getState());
        assertTrue(orchestrator.getModel().isEmpty());
    }

    @Test
    void trainingFailureIsPermanentlyDegraded() {
        TextNormalizer normalizer = regexNormalizer();
        TriageProperties props = new TriageProperties();
        TriageOrchestrator orchestrator = new TriageOrchestrator(normalizer, new ModelTrainer(normalizer, props),
                new RecommendationGenerator(), props, List.of(new TrainingExample("...", Severity.HIGH)));

        assertEquals(ModelState.DEGRADED, orchestrator.initialize());
        assertEquals(Severity.UNKNOWN, orchestrator.assess("chest pain").getSeverity());
        assertEquals(ModelState.DEGRADED, orchestrator.initialize());
    }

    @Test
    void inferenceErrorIsContainedPerCall() {
        TriageProperties props = new TriageProperties();
        TextNormalizer failing = mock(TextNormalizer.class);
        when(failing.normalize(anyString())).thenThrow(new IllegalStateException("tokenizer crashed"));
        TriageOrchestrator orchestrator = new TriageOrchestrator(failing,
                new ModelTrainer(regexNormalizer(), props), new RecommendationGenerator(), props);

        AssessmentResult r = orchestrator.assess("chest pain");

        assertEquals(Severity.UNKNOWN, r.getSeverity());
        assertEquals(0.0, r.getConfidence());
        assertEquals(TriageOrchestrator.ASSESSMENT_FAILED_MESSAGE, r.getRecommendation());
        assertEquals(ModelState.READY, orchestrator.getState());
    }

    @Test
    void missingAnnotatorClassesDoNotBreakAssessment() {
        TextNormalizer normalizer = new TextNormalizer(() -> {
            throw new NoClassDefFoundError("opennlp/tools/postag/POSModel");
        });
        TriageProperties props = new TriageProperties();
        TriageOrchestrator orchestrator = new TriageOrchestrator(normalizer, new ModelTrainer(normalizer, props),
                new RecommendationGenerator(), props);

        AssessmentResult r = assertDoesNotThrow(() -> orchestrator.assess("chest pain"));

        assertEquals(ModelState.READY, orchestrator.getState());
        assertTrue(r.getSeverity().isClassifiable());
        assertEquals(Severity.CRITICAL,
                orchestrator.assess("Severe chest pain radiating to arm or jaw").getSeverity());
    }

    @Test
    void trainerThrowingErrorLeavesOrchestratorDegraded() {
        TriageProperties props = new TriageProperties();
        TextNormalizer normalizer = regexNormalizer();
        ModelTrainer broken = new ModelTrainer(normalizer, props) {
            @Override
            public TrainingOutcome train(List<TrainingExample> corpus) {
                throw new NoClassDefFoundError("de/medicore/triage/classifier/NaiveBayesModel");
            }
        };
        TriageOrchestrator orchestrator = new TriageOrchestrator(normalizer, broken,
                new RecommendationGenerator(), props);

        AssessmentResult r = assertDoesNotThrow(() -> orchestrator.assess("chest pain"));

        assertEquals(ModelState.DEGRADED, orchestrator.getState());
        assertEquals(Severity.UNKNOWN, r.getSeverity());
        assertEquals(0.0, r.getConfidence());
        assertEquals(TriageOrchestrator.MODEL_UNAVAILABLE_MESSAGE, r.getRecommendation());
    }

    @Test
    void trainerThrowingRuntimeExceptionLeavesOrchestratorDegraded() {
        TriageProperties props = new TriageProperties();
        TextNormalizer normalizer = regexNormalizer();
        ModelTrainer broken = new ModelTrainer(normalizer, props) {
            @Override
            public TrainingOutcome train(List<TrainingExample> corpus) {
                throw new IllegalStateException("corpus unreadable");
            }
        };
        TriageOrchestrator orchestrator = new TriageOrchestrator(normalizer, broken,
                new RecommendationGenerator(), props);

        assertEquals(ModelState.DEGRADED, assertDoesNotThrow(() -> orchestrator.initialize()));
        assertEquals(Severity.UNKNOWN, orchestrator.assess("seizure").getSeverity());
    }

    @Test
    void initializeIsIdempotent() {
        TriageProperties props = new TriageProperties();
        CountingTrainer trainer = new CountingTrainer(regexNormalizer(), props);
        TriageOrchestrator orchestrator = new TriageOrchestrator(regexNormalizer(), trainer,
                new RecommendationGenerator(), props);

        assertEquals(ModelState.UNINITIALIZED, orchestrator.getState());
        assertEquals(ModelState.READY, orchestrator.initialize());
        assertEquals(ModelState.READY, orchestrator.initialize());
        orchestrator.assess("cough");

        assertEquals(1, trainer.runs.get());
    }

    @Test
    void concurrentFirstUseTrainsOnce() throws Exception {
        TriageProperties props = new TriageProperties();
        CountingTrainer trainer = new CountingTrainer(regexNormalizer(), props);
        TriageOrchestrator orchestrator = new TriageOrchestrator(regexNormalizer(), trainer,
                new RecommendationGenerator(), props);
        CountDownLatch start = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            List<Future<AssessmentResult>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return orchestrator.assess("Severe chest pain radiating to arm or jaw");
                }));
            }
            start.countDown();
            for (Future<AssessmentResult> f : futures) {
                assertEquals(Severity.CRITICAL, f.get(30, TimeUnit.SECONDS).getSeverity());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, trainer.runs.get());
    }

    @Test
    void warmUpHonoursEagerInitFlag() {
        TriageProperties lazy = new TriageProperties();
        lazy.getModel().setEagerInit(false);
        TriageOrchestrator lazyOrchestrator = orchestrator(lazy);
        lazyOrchestrator.warmUp();
        assertEquals(ModelState.UNINITIALIZED, lazyOrchestrator.getState());

        TriageOrchestrator eager = orchestrator();
        eager.warmUp();
        assertEquals(ModelState.READY, eager.getState());
        assertEquals(ModelTrainer.MODEL_VERSION, eager.getModel().orElseThrow().getVersion());
    }

    private static final class CountingTrainer extends ModelTrainer {

        private final AtomicInteger runs = new AtomicInteger();

        CountingTrainer(TextNormalizer normalizer, TriageProperties properties) {
            super(normalizer, properties);
        }

        @Override
        public TrainingOutcome train(List<TrainingExample> corpus) {
            runs.incrementAndGet();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return super.train(corpus);
        }
    }
}
