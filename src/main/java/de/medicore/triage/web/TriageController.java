package de.medicore.triage.web;

import de.medicore.triage.config.TriageProperties;
import de.medicore.triage.model.AssessmentResult;
import de.medicore.triage.engine.TrainedModel;
import de.medicore.triage.engine.TriageOrchestrator;
import de.medicore.triage.web.TriageDtos.AssessmentRequest;
import de.medicore.triage.web.TriageDtos.ModelStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/triage")
public class TriageController {

    private final TriageOrchestrator orchestrator;
    private final TriageProperties properties;

    public TriageController(TriageOrchestrator orchestrator, TriageProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @PostMapping("/assessments")
    public Mono<AssessmentResult> assess(@RequestBody(required = false) Mono<AssessmentRequest> request) {
        return request
                .map(r -> r.symptoms() == null ? "" : r.symptoms())
                .defaultIfEmpty("")
                .flatMap(s -> Mono.fromCallable(() -> orchestrator.assess(s))
                        .subscribeOn(Schedulers.boundedElastic()));
    }

    @GetMapping("/model")
    public ModelStatus model() {
        return new ModelStatus(
                orchestrator.getState().name(),
                orchestrator.getModel().map(TrainedModel::getVersion).orElse(null),
                orchestrator.getModel().map(TrainedModel::getVocabularySize).orElse(0),
                properties.getRecommendation().getConfidenceThreshold());
    }
}
