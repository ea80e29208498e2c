package org.chillsense.frontend.scanner;

import java.util.Locale;

/**
 * One line of comment-free source (comments blanked out) as seen by the line classifiers.
 *
 * @param number     The 1-based line number.
 * @param text       The line as it appears after comment stripping, untrimmed.
 * @param normalized The trimmed, upper-cased text used for prefix tests.
 */
public record SourceLine(int number, String text, String normalized) {

    public static SourceLine of(int number, String text) {
        return new SourceLine(number, text, text.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * @return The trimmed text with its original case.
     */
    public String trimmed() {
        return text.trim();
    }

    /**
     * @return The number of characters before the first non-whitespace character.
     */
    public int indent() {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    public boolean isBlank() {
        return normalized.isEmpty();
    }
}
