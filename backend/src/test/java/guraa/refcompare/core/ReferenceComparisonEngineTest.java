package guraa.refcompare.core;

import guraa.refcompare.model.ComparisonResult;
import guraa.refcompare.model.InvalidRecordShapeException;
import guraa.refcompare.model.MatchedPair;
import guraa.refcompare.model.ReferenceRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static guraa.refcompare.RecordFixtures.map;
import static guraa.refcompare.RecordFixtures.record;
import static guraa.refcompare.RecordFixtures.titled;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceComparisonEngineTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();
    private final ReferenceComparisonEngine engine = new ReferenceComparisonEngine(
            new ExactMatcher(new KeyGenerator()), new FuzzyMatcher(scorer));

    @Test
    void compare_shouldReturnAllOfAWhenBIsEmpty() {
        List<ReferenceRecord> recordsA = List.of(titled("Test", "2023"));

        ComparisonResult result = engine.compare(recordsA, List.of(), true);

        assertThat(result.getOverlap()).isEmpty();
        assertThat(result.getUniqueA()).isEqualTo(recordsA);
        assertThat(result.getUniqueB()).isEmpty();
    }

    @Test
    void compare_shouldReturnAllOfBWhenAIsEmpty() {
        List<ReferenceRecord> recordsB = List.of(titled("Test", "2023"));

        ComparisonResult result = engine.compare(List.of(), recordsB, false);

        assertThat(result.getOverlap()).isEmpty();
        assertThat(result.getUniqueA()).isEmpty();
        assertThat(result.getUniqueB()).isEqualTo(recordsB);
    }

    @Test
    void compare_shouldReturnNothingForTwoEmptyLists() {
        ComparisonResult result = engine.compare(List.of(), List.of());

        assertThat(result.getOverlap()).isEmpty();
        assertThat(result.getUniqueA()).isEmpty();
        assertThat(result.getUniqueB()).isEmpty();
        assertThat(result.getFuzzyPairs()).isEmpty();
    }

    @Test
    void compare_shouldTreatNullListsAsEmpty() {
        ComparisonResult result = engine.compare(null, List.of(titled("Test", "2023")), true);

        assertThat(result.getUniqueB()).hasSize(1);
    }

    @Test
    void compare_shouldAddFuzzyMatchesToOverlapWhenEnabled() {
        List<Map<String, Object>> recordsA = List.of(map("title", "Machine Learning in Healthcare", "year", "2023"));
        List<Map<String, Object>> recordsB = List.of(map("title", "Machine Learing in Healthcare", "year", "2023"));

        ComparisonResult result = engine.compare(recordsA, recordsB, true);

        assertThat(result.getOverlap()).hasSize(1);
        ReferenceRecord matched = result.getOverlap().get(0);
        assertThat(matched.get(ReferenceComparisonEngine.FUZZY_MATCH_FIELD)).isEqualTo(Boolean.TRUE);
        assertThat(matched.get("title")).isEqualTo("Machine Learning in Healthcare");
        assertThat(result.getUniqueA()).isEmpty();
        assertThat(result.getUniqueB()).isEmpty();
    }

    @Test
    void compare_shouldLeaveTyposUnmatchedWhenFuzzyDisabled() {
        List<Map<String, Object>> recordsA = List.of(map("title", "Machine Learning in Healthcare", "year", "2023"));
        List<Map<String, Object>> recordsB = List.of(map("title", "Machine Learing in Healthcare", "year", "2023"));

        ComparisonResult result = engine.compare(recordsA, recordsB, false);

        assertThat(result.getOverlap()).isEmpty();
        assertThat(result.getUniqueA()).hasSize(1);
        assertThat(result.getUniqueB()).hasSize(1);
        assertThat(result.getFuzzyPairs()).isEmpty();
    }

    @Test
    void compare_shouldLetDoiWinOverTitleMismatch() {
        ComparisonResult result = engine.compare(
                List.of(record("doi", "10.1234/X", "title", "T1")),
                List.of(record("doi", "10.1234/x", "title", "T2 (different)")));

        assertThat(result.getOverlap()).hasSize(1);
        assertThat(result.getOverlap().get(0).has(ReferenceComparisonEngine.FUZZY_MATCH_FIELD)).isFalse();
        assertThat(result.getUniqueA()).isEmpty();
        assertThat(result.getUniqueB()).isEmpty();
    }

    @Test
    void compare_shouldMatchArticleVariantsExactly() {
        ComparisonResult result = engine.compare(
                List.of(titled("Machine Learning in Healthcare", "2023"), titled("The Impact of AI on Society", "2024")),
                List.of(titled("Machine Learing in Healthcare", "2023"), titled("Impact of AI on Society", "2024")));

        assertThat(result.getOverlap()).hasSize(2);
        assertThat(result.getOverlap().get(0).get("title")).isEqualTo("The Impact of AI on Society");
        assertThat(result.getOverlap().get(1).get(ReferenceComparisonEngine.FUZZY_MATCH_FIELD)).isEqualTo(true);
        assertThat(result.getFuzzyMatchCount()).isEqualTo(1);
    }

    @Test
    void compare_shouldKeepBothSidesOfFuzzyMatchInPairs() {
        ReferenceRecord b = titled("Machine Learing in Healthcare", "2023");

        ComparisonResult result = engine.compare(
                List.of(titled("Machine Learning in Healthcare", "2023")), List.of(b));

        assertThat(result.getFuzzyPairs()).hasSize(1);
        MatchedPair pair = result.getFuzzyPairs().get(0);
        assertThat(pair.getRecordB()).isEqualTo(b);
        assertThat(pair.isFuzzy()).isTrue();
        assertThat(pair.getConfidence()).isBetween(0.0, 1.0);
    }

    @Test
    void compare_shouldNotMatchTitlesDifferingOnlyInSubscriptDigit() {
        List<ReferenceRecord> recordsA = List.of(titled("CO\u2082 Emissions in Cities", "2020"));
        List<ReferenceRecord> recordsB = List.of(titled("CO Emissions in Cities", "2020"));

        ComparisonResult result = engine.compare(recordsA, recordsB, false);

        assertThat(result.getOverlap()).isEmpty();
        assertThat(result.getUniqueA()).hasSize(1);
        assertThat(result.getUniqueB()).hasSize(1);
    }

    @Test
    void compare_shouldNotModifyInputRecords() {
        ReferenceRecord a = titled("Machine Learning in Healthcare", "2023");

        engine.compare(List.of(a), List.of(titled("Machine Learing in Healthcare", "2023")));

        assertThat(a.has(ReferenceComparisonEngine.FUZZY_MATCH_FIELD)).isFalse();
    }

    @Test
    void compare_shouldStripInternalKeyField() {
        ComparisonResult result = engine.compare(
                List.of(record("title", "Graph Theory", "year", "2001", "temp_key", "stale"),
                        record("title", "Set Theory", "year", "2001", "temp_key", "stale")),
                List.of(record("title", "Graph Theory", "year", "2001", "temp_key", "other")),
                true);

        assertThat(result.getOverlap()).allSatisfy(r -> assertThat(r.has("temp_key")).isFalse());
        assertThat(result.getUniqueA()).allSatisfy(r -> assertThat(r.has("temp_key")).isFalse());
        assertThat(result.getOverlap()).hasSize(1);
        assertThat(result.getUniqueA()).hasSize(1);
    }

    @Test
    void compare_shouldOnlyAcceptFuzzyPairsWithEqualYears() {
        ComparisonResult result = engine.compare(
                List.of(titled("Machine Learning in Healthcare", "2023"), titled("Neural Networks", "2019")),
                List.of(titled("Machine Learing in Healthcare", "2022"), titled("Neural Network", "2019")));

        assertThat(result.getFuzzyPairs()).allSatisfy(pair ->
                assertThat(KeyGenerator.truncatedYear(pair.getRecordA()))
                        .isEqualTo(KeyGenerator.truncatedYear(pair.getRecordB())));
        assertThat(result.getFuzzyPairs()).hasSize(1);
    }

    @Test
    void compare_shouldRejectRecordsThatAreNotMappings() {
        List<Object> recordsA = List.of(map("title", "Fine"), "not a record");

        assertThatThrownBy(() -> engine.compare(recordsA, List.of(map("title", "Other"))))
                .isInstanceOf(InvalidRecordShapeException.class)
                .hasMessageContaining("String");
    }

    @Test
    void compare_shouldBeDeterministic() {
        List<ReferenceRecord> recordsA = List.of(
                titled("Machine Learning in Healthcare", "2023"), titled("Ancient History", "1990"));
        List<ReferenceRecord> recordsB = List.of(
                titled("Machine Learing in Healthcare", "2023"), titled("Quantum Computing", "2022"));

        ComparisonResult first = engine.compare(recordsA, recordsB);
        ComparisonResult second = engine.compare(recordsA, recordsB);

        assertThat(second.getOverlap()).isEqualTo(first.getOverlap());
        assertThat(second.getUniqueA()).isEqualTo(first.getUniqueA());
        assertThat(second.getUniqueB()).isEqualTo(first.getUniqueB());
    }
}
