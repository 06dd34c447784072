package guraa.refcompare.config;

import guraa.refcompare.core.ConfidenceScorer;
import guraa.refcompare.core.ExactMatcher;
import guraa.refcompare.core.FuzzyMatcher;
import guraa.refcompare.core.KeyGenerator;
import guraa.refcompare.core.ReferenceAnalyzer;
import guraa.refcompare.core.ReferenceComparisonEngine;
import guraa.refcompare.util.RisExporter;
import guraa.refcompare.util.RisParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the reference matching components
 */
@Slf4j
@Configuration
public class MatchingConfig {

    @Bean
    public KeyGenerator keyGenerator() {
        return new KeyGenerator();
    }

    @Bean
    public ConfidenceScorer confidenceScorer() {
        return new ConfidenceScorer();
    }

    @Bean
    public ExactMatcher exactMatcher(KeyGenerator keyGenerator) {
        return new ExactMatcher(keyGenerator);
    }

    /**
     * Configure the fuzzy matcher from the matching properties
     * @param confidenceScorer Scorer for accepted pairs
     * @param properties Application properties
     * @return FuzzyMatcher
     */
    @Bean
    public FuzzyMatcher fuzzyMatcher(ConfidenceScorer confidenceScorer, AppProperties properties) {
        AppProperties.Matching matching = properties.getMatching();
        FuzzyMatcher fuzzyMatcher = new FuzzyMatcher(
                confidenceScorer, matching.getFuzzyThreshold(), matching.getMaxFuzzyResidual());
        log.info("Fuzzy matching threshold: {}, residual limit: {}",
                fuzzyMatcher.getThreshold(),
                matching.getMaxFuzzyResidual() > 0 ? matching.getMaxFuzzyResidual() : "none");
        return fuzzyMatcher;
    }

    @Bean
    public ReferenceComparisonEngine referenceComparisonEngine(ExactMatcher exactMatcher, FuzzyMatcher fuzzyMatcher) {
        return new ReferenceComparisonEngine(exactMatcher, fuzzyMatcher);
    }

    @Bean
    public ReferenceAnalyzer referenceAnalyzer(KeyGenerator keyGenerator, AppProperties properties) {
        return new ReferenceAnalyzer(keyGenerator, properties.getAnalysis().getTopJournals());
    }

    @Bean
    public RisParser risParser() {
        return new RisParser();
    }

    @Bean
    public RisExporter risExporter(AppProperties properties) {
        return new RisExporter(properties.getExport().getDefaultReferenceType());
    }
}
