package com.williamcallahan.omnibus_engine.util;

import java.util.regex.Pattern;

/**
 * Cleans up work titles taken from an omnibus table of contents.
 *
 * <p>Rules are applied in a fixed order:</p>
 * <ol>
 *   <li>strip a leading index with its separator ({@code "12. "}, {@code "3 - "}, {@code "IV. "})</li>
 *   <li>strip bracketed or parenthesized annotations anywhere in the title</li>
 *   <li>strip trailing punctuation and whitespace</li>
 *   <li>collapse inner whitespace and trim</li>
 * </ol>
 * The rules are re-applied until the title stops changing, so the result is a fixed point
 * and {@code normalize(normalize(x)).equals(normalize(x))} holds for every input.
 */
public final class TitleNormalizer {

    private static final Pattern LEADING_NUMERIC_INDEX = Pattern.compile("^\\d+[\\s.\\-]+");
    // Roman numerals need an explicit "." or ")" so titles like "I Am Legend" survive.
    // A lone L, C, D or M is read as an initial ("M. Butterfly"), not an index.
    private static final Pattern LEADING_ROMAN_INDEX = Pattern.compile("^(?:[IVX]|[IVXLCDM]{2,})[.)]\\s+");
    private static final Pattern BRACKETED_ANNOTATION = Pattern.compile("[\\[({].*?[})\\]]");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.,;:]+$");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TitleNormalizer() {
        // Utility class
    }

    /**
     * Normalizes a raw table-of-contents label.
     *
     * @param raw label as found in the container, may be null
     * @return the cleaned title, empty when nothing meaningful remains
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String current = raw.strip();
        // Every pass either shortens the string or leaves it unchanged
        for (int pass = 0; pass <= raw.length(); pass++) {
            String next = applyRules(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    private static String applyRules(String title) {
        String cleaned = LEADING_NUMERIC_INDEX.matcher(title).replaceFirst("");
        cleaned = LEADING_ROMAN_INDEX.matcher(cleaned).replaceFirst("");
        cleaned = BRACKETED_ANNOTATION.matcher(cleaned).replaceAll("");
        cleaned = TRAILING_PUNCTUATION.matcher(cleaned).replaceFirst("");
        return WHITESPACE_RUN.matcher(cleaned).replaceAll(" ").strip();
    }
}
