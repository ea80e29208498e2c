package org.chillsense.query;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual whole-word search. Matches are case-insensitive and are found in comments and
 * strings too, since no token stream exists.
 */
public final class ReferenceFinder {

    private ReferenceFinder() {}

    /**
     * @param text The raw document text.
     * @param word The identifier to search for.
     * @return Every occurrence in document order; empty for a blank word.
     */
    public static List<TextSpan> find(String text, String word) {
        List<TextSpan> spans = new ArrayList<>();
        if (word == null || word.isBlank()) {
            return spans;
        }
        Pattern pattern = Pattern.compile(
                "(?<![A-Za-z0-9_])" + Pattern.quote(word) + "(?![A-Za-z0-9_])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            Matcher m = pattern.matcher(lines[i]);
            while (m.find()) {
                spans.add(new TextSpan(i, m.start(), m.end()));
            }
        }
        return spans;
    }
}
