package de.medicore.triage.corpus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static de.medicore.triage.model.Severity.CRITICAL;
import static de.medicore.triage.model.Severity.HIGH;
import static de.medicore.triage.model.Severity.LOW;
import static de.medicore.triage.model.Severity.MEDIUM;

/**
 * Labeled symptom descriptions the triage model is trained on at startup.
 */
public final class TrainingCorpus {

    // patient phrasing
    public static final List<TrainingExample> LAY_EXAMPLES = List.of(
            new TrainingExample("I have a mild headache", LOW),
            new TrainingExample("Slight cough for one day", LOW),
            new TrainingExample("Runny nose and sneezing", LOW),
            new TrainingExample("Minor cuts and scrapes", LOW),
            new TrainingExample("Mild sore throat", LOW),
            new TrainingExample("Slight fever below 38°C", LOW),
            new TrainingExample("Mild joint pain", LOW),
            new TrainingExample("Minor skin rash", LOW),

            new TrainingExample("Persistent headache for several days", MEDIUM),
            new TrainingExample("Fever between 38°C and 39°C", MEDIUM),
            new TrainingExample("Cough with colored phlegm", MEDIUM),
            new TrainingExample("Dehydration with some dizziness", MEDIUM),
            new TrainingExample("Persistent vomiting", MEDIUM),
            new TrainingExample("Flu symptoms with high fever", MEDIUM),
            new TrainingExample("Ear pain with discharge", MEDIUM),
            new TrainingExample("Urinary tract infection symptoms", MEDIUM),

            new TrainingExample("Severe abdominal pain", HIGH),
            new TrainingExample("Difficulty breathing", HIGH),
            new TrainingExample("High fever above 39°C", HIGH),
            new TrainingExample("Chest pain", HIGH),
            new TrainingExample("Severe headache with neck stiffness", HIGH),
            new TrainingExample("Sudden vision changes", HIGH),
            new TrainingExample("Deep cut requiring stitches", HIGH),
            new TrainingExample("Broken bone or suspected fracture", HIGH),

            new TrainingExample("Unconsciousness or fainting", CRITICAL),
            new TrainingExample("Severe chest pain radiating to arm or jaw", CRITICAL),
            new TrainingExample("Inability to breathe", CRITICAL),
            new TrainingExample("Severe bleeding that won't stop", CRITICAL),
            new TrainingExample("Poisoning or overdose", CRITICAL),
            new TrainingExample("Seizure", CRITICAL),
            new TrainingExample("Severe burn", CRITICAL),
            new TrainingExample("Stroke symptoms like facial drooping", CRITICAL)
    );

    // clinical terminology
    public static final List<TrainingExample> CLINICAL_EXAMPLES = List.of(
            new TrainingExample("Mild rhinitis with nasal discharge", LOW),
            new TrainingExample("Slight pharyngitis with minimal discomfort", LOW),
            new TrainingExample("Minor contusions", LOW),
            new TrainingExample("Localized dermatitis", LOW),

            new TrainingExample("Moderate pyrexia with myalgia", MEDIUM),
            new TrainingExample("Persistent emesis", MEDIUM),
            new TrainingExample("Otitis media with effusion", MEDIUM),
            new TrainingExample("Uncomplicated cystitis", MEDIUM),

            new TrainingExample("Acute dyspnea", HIGH),
            new TrainingExample("Severe cephalgia with photophobia", HIGH),
            new TrainingExample("Suspected appendicitis", HIGH),
            new TrainingExample("Open fracture requiring reduction", HIGH),

            new TrainingExample("Syncope with irregular cardiac rhythm", CRITICAL),
            new TrainingExample("Acute myocardial infarction", CRITICAL),
            new TrainingExample("Status epilepticus", CRITICAL),
            new TrainingExample("Cerebrovascular accident with hemiparesis", CRITICAL)
    );

    private static final List<TrainingExample> ALL;

    static {
        List<TrainingExample> all = new ArrayList<>(LAY_EXAMPLES);
        all.addAll(CLINICAL_EXAMPLES);
        ALL = Collections.unmodifiableList(all);
    }

    private TrainingCorpus() {
    }

    public static List<TrainingExample> all() {
        return ALL;
    }
}
