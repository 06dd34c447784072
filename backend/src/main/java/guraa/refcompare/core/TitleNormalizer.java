package guraa.refcompare.core;

import java.util.List;
import java.util.Locale;

/**
 * Canonicalizes reference titles for key generation and similarity comparison.
 */
public final class TitleNormalizer {

    private static final List<String> ARTICLE_PREFIXES = List.of("the ", "a ", "an ");

    private static final double SAME_TITLE_THRESHOLD = 0.9;

    private TitleNormalizer() {
        // Utility class, no instances allowed
    }

    /**
     * Normalize a title: lowercase and trim, drop one leading English article,
     * then keep only letters and numbers. Anything that is not a string
     * normalizes to the empty string.
     *
     * <p>Applying this twice gives the same result as applying it once.</p>
     *
     * @param title The raw title value
     * @return The normalized title, never null
     */
    public static String normalize(Object title) {
        if (!(title instanceof String)) {
            return "";
        }

        String lower = trim(((String) title).toLowerCase(Locale.ROOT));

        for (String prefix : ARTICLE_PREFIXES) {
            if (lower.startsWith(prefix)) {
                lower = lower.substring(prefix.length());
                break;
            }
        }

        StringBuilder clean = new StringBuilder(lower.length());
        lower.codePoints()
                .filter(TitleNormalizer::isAlphanumeric)
                .forEach(clean::appendCodePoint);
        return clean.toString();
    }

    /**
     * Letters and every kind of number, including subscript, superscript and
     * letter-like numerals such as {@code \u2082} or {@code \u2167}.
     */
    static boolean isAlphanumeric(int codePoint) {
        if (Character.isLetterOrDigit(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.OTHER_NUMBER || type == Character.LETTER_NUMBER;
    }

    /**
     * Whitespace includes no-break and other Unicode space separators.
     */
    static boolean isBlankCodePoint(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint) || codePoint == '\u0085';
    }

    private static String trim(String value) {
        int start = 0;
        int end = value.length();
        while (start < end) {
            int codePoint = value.codePointAt(start);
            if (!isBlankCodePoint(codePoint)) {
                break;
            }
            start += Character.charCount(codePoint);
        }
        while (end > start) {
            int codePoint = value.codePointBefore(end);
            if (!isBlankCodePoint(codePoint)) {
                break;
            }
            end -= Character.charCount(codePoint);
        }
        return value.substring(start, end);
    }

    /**
     * Check if two titles name the same work: equal after normalization,
     * or more than 90% similar.
     *
     * @param title1 First title
     * @param title2 Second title
     * @return true if the titles match
     */
    public static boolean isSameTitle(Object title1, Object title2) {
        if (!(title1 instanceof String) || !(title2 instanceof String)) {
            return false;
        }

        String t1 = normalize(title1);
        String t2 = normalize(title2);

        if (t1.equals(t2)) {
            return true;
        }

        return SequenceMatcher.ratio(t1, t2) > SAME_TITLE_THRESHOLD;
    }
}
