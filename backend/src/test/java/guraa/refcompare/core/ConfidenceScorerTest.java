package guraa.refcompare.core;

import guraa.refcompare.model.MatchConfidence;
import org.junit.jupiter.api.Test;

import static guraa.refcompare.RecordFixtures.record;
import static guraa.refcompare.RecordFixtures.titled;
import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    @Test
    void score_shouldGiveFullConfidenceForEqualDoi() {
        MatchConfidence confidence = scorer.score(
                record("doi", "10.1234/example", "title", "Test Paper", "year", "2023"),
                record("do", " 10.1234/EXAMPLE ", "title", "Something Else", "year", "1999"));

        assertThat(confidence).isEqualTo(new MatchConfidence(1.0, "DOI match"));
    }

    @Test
    void score_shouldNotTreatBlankDoisAsEqual() {
        MatchConfidence confidence = scorer.score(
                record("doi", "  ", "title", "Alpha"), record("doi", " ", "title", "Omega"));

        assertThat(confidence.getConfidence()).isEqualTo(0.50);
    }

    @Test
    void score_shouldRateExactTitleAndYear() {
        MatchConfidence confidence = scorer.score(
                titled("Machine Learning", "2023"), titled("The Machine Learning", "2023"));

        assertThat(confidence.getConfidence()).isGreaterThanOrEqualTo(0.95);
        assertThat(confidence.getReason()).isEqualTo("Exact title+year match");
    }

    @Test
    void score_shouldPreferDoiRuleOverTitleRule() {
        MatchConfidence confidence = scorer.score(
                record("doi", "10.1/a", "title", "Same", "year", "2020"),
                record("doi", "10.1/A", "title", "Same", "year", "2020"));

        assertThat(confidence.getConfidence()).isEqualTo(1.0);
    }

    @Test
    void score_shouldRateSimilarityTiers() {
        assertThat(scorer.score(titled("Neural Networks", "2020"), titled("Neural Network", "2020")))
                .isEqualTo(new MatchConfidence(0.90, "High similarity (0.96)"));
        assertThat(scorer.score(titled("abcdefghijklmnopqrst", "2020"), titled("abcdefghijklmnopqrXY", "2020")))
                .isEqualTo(new MatchConfidence(0.85, "Good similarity (0.90)"));
        assertThat(scorer.score(titled("abcdefghijklmnopqrst", "2020"), titled("abcdefghijklmnopqXYZ", "2020")))
                .isEqualTo(new MatchConfidence(0.75, "Fair similarity (0.85)"));
    }

    @Test
    void score_shouldFallBackToLowConfidence() {
        assertThat(scorer.score(titled("Quantum Computing", "2020"), titled("Ancient History", "2020")))
                .isEqualTo(new MatchConfidence(0.50, "Low confidence match"));
    }

    @Test
    void score_shouldRequireEqualYearsForSimilarityTiers() {
        MatchConfidence confidence = scorer.score(
                titled("Neural Networks", "2020"), titled("Neural Network", "2021"));

        assertThat(confidence.getConfidence()).isEqualTo(0.50);
    }

    @Test
    void score_shouldNotRateEqualTitlesWithoutYearAsExact() {
        MatchConfidence confidence = scorer.score(record("title", "Graph Theory"), record("title", "Graph Theory"));

        // identical titles without year fall through to the similarity tiers
        assertThat(confidence).isEqualTo(new MatchConfidence(0.90, "High similarity (1.00)"));
    }

    @Test
    void score_shouldResolveAliases() {
        MatchConfidence confidence = scorer.score(
                record("ti", "Machine Learning", "py", "2023"), record("primary_title", "Machine Learning", "year", 2023));

        assertThat(confidence.getConfidence()).isEqualTo(0.95);
    }
}
