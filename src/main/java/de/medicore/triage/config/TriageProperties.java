package de.medicore.triage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "triage")
public class TriageProperties {

    private final Model model = new Model();
    private final Recommendation recommendation = new Recommendation();
    private final Annotator annotator = new Annotator();

    public Model getModel() { return model; }

    public Recommendation getRecommendation() { return recommendation; }

    public Annotator getAnnotator() { return annotator; }

    public static class Model {

        // false forces the degraded mode
        private boolean enabled = true;
        private boolean eagerInit = true;
        private int maxFeatures = 1000;
        private double smoothingAlpha = 1.0;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isEagerInit() { return eagerInit; }
        public void setEagerInit(boolean eagerInit) { this.eagerInit = eagerInit; }

        public int getMaxFeatures() { return maxFeatures; }
        public void setMaxFeatures(int maxFeatures) { this.maxFeatures = maxFeatures; }

        public double getSmoothingAlpha() { return smoothingAlpha; }
        public void setSmoothingAlpha(double smoothingAlpha) { this.smoothingAlpha = smoothingAlpha; }
    }

    public static class Recommendation {

        private double confidenceThreshold = 0.6;

        public double getConfidenceThreshold() { return confidenceThreshold; }
        public void setConfidenceThreshold(double confidenceThreshold) { this.confidenceThreshold = confidenceThreshold; }
    }

    public static class Annotator {

        private boolean enabled = true;
        private String tokenizerModel = "nlp/en-token.bin";
        private String posModel = "nlp/en-pos-maxent.bin";
        private String lemmaDictionary = "nlp/en-lemmatizer.dict";
        private String stopwords = "nlp/stopwords-en.txt";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getTokenizerModel() { return tokenizerModel; }
        public void setTokenizerModel(String tokenizerModel) { this.tokenizerModel = tokenizerModel; }

        public String getPosModel() { return posModel; }
        public void setPosModel(String posModel) { this.posModel = posModel; }

        public String getLemmaDictionary() { return lemmaDictionary; }
        public void setLemmaDictionary(String lemmaDictionary) { this.lemmaDictionary = lemmaDictionary; }

        public String getStopwords() { return stopwords; }
        public void setStopwords(String stopwords) { this.stopwords = stopwords; }
    }
}
