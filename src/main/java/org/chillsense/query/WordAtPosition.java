package org.chillsense.query;

import java.util.Optional;

/**
 * Extracts the identifier under a cursor position.
 */
public final class WordAtPosition {

    private WordAtPosition() {}

    /**
     * @param text      The full document text.
     * @param line      The 0-based line.
     * @param character The 0-based column. Values past the end of the line are clamped.
     * @return The identifier touching the position, or empty if there is none.
     */
    public static Optional<String> extract(String text, int line, int character) {
        String[] lines = text.split("\n", -1);
        if (line < 0 || line >= lines.length) {
            return Optional.empty();
        }
        String lineText = lines[line];
        int pos = Math.max(0, Math.min(character, lineText.length()));

        int start = pos;
        while (start > 0 && isWordChar(lineText.charAt(start - 1))) {
            start--;
        }
        int end = pos;
        while (end < lineText.length() && isWordChar(lineText.charAt(end))) {
            end++;
        }
        return start == end ? Optional.empty() : Optional.of(lineText.substring(start, end));
    }

    /**
     * @return {@code true} for {@code [A-Za-z0-9_]}.
     */
    public static boolean isWordChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }
}
