package de.medicore.triage.validation;

import de.medicore.triage.model.SymptomsSubmittedEvent;
import org.springframework.stereotype.Component;

@Component
public class SymptomsSubmittedValidator {

    public void validate(SymptomsSubmittedEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event is null");
        }
        if (event.getSubmissionId() == null) {
            throw new IllegalArgumentException("submissionId is missing");
        }
        if (event.getPatientId() == null) {
            throw new IllegalArgumentException("patientId is missing");
        }
        // empty text is a valid (low-confidence) assessment, only a missing field is rejected
        if (event.getSymptoms() == null) {
            throw new IllegalArgumentException("symptoms are missing");
        }
    }
}
