package de.medicore.triage.config;

import de.medicore.triage.nlp.AnnotatorLoader;
import de.medicore.triage.nlp.AnnotatorUnavailableException;
import de.medicore.triage.nlp.OpenNlpAnnotator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({KafkaTopicsConfig.class, TriageProperties.class})
public class AppConfig {

    @Bean
    public AnnotatorLoader annotatorLoader(TriageProperties properties) {
        TriageProperties.Annotator cfg = properties.getAnnotator();
        return () -> {
            if (!cfg.isEnabled()) {
                throw new AnnotatorUnavailableException("annotator disabled (triage.annotator.enabled=false)");
            }
            return OpenNlpAnnotator.fromClasspath(cfg);
        };
    }
}
