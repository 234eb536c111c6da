package de.medicore.triage.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.medicore.triage.model.AssessmentResult;
import de.medicore.triage.model.SymptomsSubmittedEvent;
import de.medicore.triage.model.TriageResultEvent;
import de.medicore.triage.publisher.TriageResultPublisher;
import de.medicore.triage.engine.TrainedModel;
import de.medicore.triage.engine.TriageOrchestrator;
import de.medicore.triage.validation.SymptomsSubmittedValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
public class SymptomsSubmittedConsumer {

    private static final Logger log = LoggerFactory.getLogger(SymptomsSubmittedConsumer.class);

    private final ObjectMapper objectMapper;
    private final SymptomsSubmittedValidator validator;
    private final TriageOrchestrator orchestrator;
    private final TriageResultPublisher publisher;
    private final Clock clock;

    public SymptomsSubmittedConsumer(
            ObjectMapper objectMapper,
            SymptomsSubmittedValidator validator,
            TriageOrchestrator orchestrator,
            TriageResultPublisher publisher
    ) {
        this(objectMapper, validator, orchestrator, publisher, Clock.systemUTC());
    }

    SymptomsSubmittedConsumer(
            ObjectMapper objectMapper,
            SymptomsSubmittedValidator validator,
            TriageOrchestrator orchestrator,
            TriageResultPublisher publisher,
            Clock clock
    ) {
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.orchestrator = orchestrator;
        this.publisher = publisher;
        this.clock = clock;
    }

    @KafkaListener(topics = "${triage.kafka.topics.in}", groupId = "${spring.kafka.consumer.group-id}")
    public void consume(String payload) {
        SymptomsSubmittedEvent event;
        try {
            event = objectMapper.readValue(payload, SymptomsSubmittedEvent.class);
            validator.validate(event);
        } catch (Exception ex) {
            log.warn("Rejected symptoms submission. payload={}", payload, ex);
            return;
        }

        AssessmentResult result = orchestrator.assess(event.getSymptoms().trim());

        TriageResultEvent out = new TriageResultEvent();
        out.setSubmissionId(event.getSubmissionId());
        out.setPatientId(event.getPatientId());
        out.setSeverity(result.getSeverity().getLabel());
        out.setRecommendation(result.getRecommendation());
        out.setConfidence(result.getConfidence());
        out.setModelVersion(orchestrator.getModel()
                .map(TrainedModel::getVersion)
                .orElse("none"));
        out.setAssessedAt(Instant.now(clock));
        out.setReviewed(false);

        try {
            publisher.publish(out);
        } catch (RuntimeException ex) {
            log.warn("Failed to publish triage result submissionId={}", event.getSubmissionId(), ex);
        }
    }
}
