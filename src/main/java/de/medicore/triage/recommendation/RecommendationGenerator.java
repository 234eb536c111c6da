package de.medicore.triage.recommendation;

import de.medicore.triage.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@Component
public class RecommendationGenerator {

    public static final String DISCLAIMER = "\n\nNote: This is an initial assessment with limited confidence. "
            + "A healthcare professional should verify this assessment.";

    public static final String GENERIC_ADVICE =
            "Please consult with a healthcare professional for proper evaluation.";

    private static final Map<Severity, String> ADVICE;

    static {
        Map<Severity, String> m = new EnumMap<>(Severity.class);
        m.put(Severity.LOW, "Your symptoms suggest a non-urgent condition. Rest, hydrate, and monitor symptoms. "
                + "If they persist for more than 2-3 days or worsen, schedule a regular appointment.");
        m.put(Severity.MEDIUM, "Your symptoms may require medical attention. "
                + "Schedule an appointment in the next 1-2 days. Monitor for worsening symptoms.");
        m.put(Severity.HIGH, "Your symptoms require prompt medical attention. "
                + "Please schedule an urgent appointment or visit urgent care within 24 hours.");
        m.put(Severity.CRITICAL, "Your symptoms suggest a potentially life-threatening condition. "
                + "Seek immediate emergency medical attention or call emergency services.");
        ADVICE = Collections.unmodifiableMap(m);
    }

    public String recommend(Severity severity, double confidence, double confidenceThreshold) {
        String base = ADVICE.getOrDefault(severity, GENERIC_ADVICE);
        if (confidence < confidenceThreshold) {
            return base + DISCLAIMER;
        }
        return base;
    }
}
