package de.medicore.triage.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.medicore.triage.config.KafkaTopicsConfig;
import de.medicore.triage.model.TriageResultEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
public class TriageResultPublisher {

    private static final Logger log = LoggerFactory.getLogger(TriageResultPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final KafkaTopicsConfig topics;

    public TriageResultPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            KafkaTopicsConfig topics
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topics = topics;
    }

    public void publish(TriageResultEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            String key = event.getPatientId().toString();

            kafkaTemplate.send(topics.getOut(), key, payload);
            log.info("Published triage result submissionId={} severity={} confidence={}",
                    event.getSubmissionId(), event.getSeverity(), event.getConfidence());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize TriageResultEvent submissionId={}", event.getSubmissionId(), e);
        }
    }
}
