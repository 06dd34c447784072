package guraa.refcompare.core;

import guraa.refcompare.model.MatchConfidence;
import guraa.refcompare.model.RecordField;
import guraa.refcompare.model.ReferenceRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Rates how likely two references are the same work. The rules are checked in
 * order and the first that applies decides the score:
 * <ol>
 *   <li>equal DOI: 1.0</li>
 *   <li>equal normalized title and equal, present year: 0.95</li>
 *   <li>similar normalized title and equal year: 0.90, 0.85 or 0.75 by similarity</li>
 *   <li>anything else: 0.50</li>
 * </ol>
 * The score is advisory and does not influence which references are matched.
 */
@Slf4j
public class ConfidenceScorer {

    public static final String DOI_MATCH = "DOI match";
    public static final String EXACT_TITLE_YEAR_MATCH = "Exact title+year match";
    public static final String LOW_CONFIDENCE_MATCH = "Low confidence match";

    private static final double HIGH_SIMILARITY = 0.95;
    private static final double GOOD_SIMILARITY = 0.90;
    private static final double FAIR_SIMILARITY = 0.85;

    /**
     * Score a pair of references.
     *
     * @param recordA Reference from list A
     * @param recordB Reference from list B
     * @return Confidence and the reason for it
     */
    public MatchConfidence score(ReferenceRecord recordA, ReferenceRecord recordB) {
        String doiA = KeyGenerator.normalizedDoi(recordA);
        String doiB = KeyGenerator.normalizedDoi(recordB);
        if (!doiA.isEmpty() && doiA.equals(doiB)) {
            return new MatchConfidence(1.0, DOI_MATCH);
        }

        String titleA = TitleNormalizer.normalize(recordA.resolve(RecordField.TITLE));
        String titleB = TitleNormalizer.normalize(recordB.resolve(RecordField.TITLE));
        String yearA = KeyGenerator.truncatedYear(recordA);
        String yearB = KeyGenerator.truncatedYear(recordB);
        boolean sameYear = yearA.equals(yearB);

        if (titleA.equals(titleB) && sameYear && !yearA.isEmpty()) {
            return new MatchConfidence(0.95, EXACT_TITLE_YEAR_MATCH);
        }

        if (!titleA.isEmpty() && !titleB.isEmpty() && sameYear) {
            double similarity = SequenceMatcher.ratio(titleA, titleB);
            log.debug("Title similarity for confidence: {}", String.format("%.4f", similarity));

            if (similarity >= HIGH_SIMILARITY) {
                return new MatchConfidence(0.90, "High similarity (" + formatRatio(similarity) + ")");
            } else if (similarity >= GOOD_SIMILARITY) {
                return new MatchConfidence(0.85, "Good similarity (" + formatRatio(similarity) + ")");
            } else if (similarity >= FAIR_SIMILARITY) {
                return new MatchConfidence(0.75, "Fair similarity (" + formatRatio(similarity) + ")");
            }
        }

        return new MatchConfidence(0.50, LOW_CONFIDENCE_MATCH);
    }

    private static String formatRatio(double similarity) {
        return String.format(Locale.ROOT, "%.2f", similarity);
    }
}
