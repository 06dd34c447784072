package guraa.refcompare.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the application
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Matching matching = new Matching();
    private final Export export = new Export();
    private final Analysis analysis = new Analysis();

    public Matching getMatching() {
        return matching;
    }

    public Export getExport() {
        return export;
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    /**
     * Reference matching properties
     */
    public static class Matching {
        private boolean fuzzyEnabled = true;
        private double fuzzyThreshold = 0.90;
        private int maxFuzzyResidual = 0;

        public boolean isFuzzyEnabled() {
            return fuzzyEnabled;
        }

        public void setFuzzyEnabled(boolean fuzzyEnabled) {
            this.fuzzyEnabled = fuzzyEnabled;
        }

        public double getFuzzyThreshold() {
            return fuzzyThreshold;
        }

        public void setFuzzyThreshold(double fuzzyThreshold) {
            this.fuzzyThreshold = fuzzyThreshold;
        }

        /**
         * Largest residual list the fuzzy pass will scan; 0 means no limit.
         */
        public int getMaxFuzzyResidual() {
            return maxFuzzyResidual;
        }

        public void setMaxFuzzyResidual(int maxFuzzyResidual) {
            this.maxFuzzyResidual = maxFuzzyResidual;
        }
    }

    /**
     * RIS export properties
     */
    public static class Export {
        private String defaultReferenceType = "JOUR";

        public String getDefaultReferenceType() {
            return defaultReferenceType;
        }

        public void setDefaultReferenceType(String defaultReferenceType) {
            this.defaultReferenceType = defaultReferenceType;
        }
    }

    /**
     * Single list analysis properties
     */
    public static class Analysis {
        private int topJournals = 10;

        public int getTopJournals() {
            return topJournals;
        }

        public void setTopJournals(int topJournals) {
            this.topJournals = topJournals;
        }
    }
}
