package org.chillsense.frontend.scanner;

import org.chillsense.frontend.model.Parameter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Splits parenthesized lists found in procedure, process and signal headers.
 */
public final class ParameterListParser {

    private static final Pattern INOUT = Pattern.compile("\\bINOUT\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern OUT = Pattern.compile("\\bOUT\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern IN = Pattern.compile("\\bIN\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ParameterListParser() {}

    /**
     * Parses a formal parameter list.
     * Each entry yields its first token as name and its last token as mode, after the
     * direction keyword has been removed. An entry with a single token gets mode {@code UNKNOWN}.
     * @param list The text between the parentheses.
     * @return The parameters in order. Blank entries are skipped.
     */
    public static List<Parameter> parseParameters(String list) {
        List<Parameter> params = new ArrayList<>();
        for (String entry : splitTopLevel(list)) {
            Parameter.Direction direction = Parameter.Direction.IN;
            String rest = entry;
            if (INOUT.matcher(rest).find()) {
                direction = Parameter.Direction.INOUT;
                rest = INOUT.matcher(rest).replaceAll(" ");
            } else if (OUT.matcher(rest).find()) {
                direction = Parameter.Direction.OUT;
                rest = OUT.matcher(rest).replaceAll(" ");
            } else {
                rest = IN.matcher(rest).replaceAll(" ");
            }
            String[] tokens = tokens(rest);
            if (tokens.length >= 2) {
                params.add(new Parameter(tokens[0], tokens[tokens.length - 1], direction));
            } else if (tokens.length == 1) {
                params.add(new Parameter(tokens[0], "UNKNOWN", direction));
            }
        }
        return params;
    }

    /**
     * Splits on commas that are not nested inside parentheses. Entries are trimmed and
     * blank entries dropped.
     * @param list The list text.
     * @return The entries.
     */
    public static List<String> splitTopLevel(String list) {
        List<String> entries = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < list.length(); i++) {
            char c = list.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && depth > 0) {
                depth--;
            } else if (c == ',' && depth == 0) {
                addEntry(entries, list.substring(start, i));
                start = i + 1;
            }
        }
        addEntry(entries, list.substring(start));
        return entries;
    }

    /**
     * Extracts the text inside the parenthesis group that opens at {@code openIndex}.
     * @param text      The text.
     * @param openIndex Index of a {@code '('} in {@code text}.
     * @return The enclosed text, or empty if the group is not closed on this line.
     */
    public static Optional<String> balancedGroup(String text, int openIndex) {
        if (openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != '(') {
            return Optional.empty();
        }
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return Optional.of(text.substring(openIndex + 1, i));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @param text Any text.
     * @return The whitespace-separated tokens, without empty strings.
     */
    public static String[] tokens(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
    }

    private static void addEntry(List<String> entries, String entry) {
        String trimmed = entry.trim();
        if (!trimmed.isEmpty()) {
            entries.add(trimmed);
        }
    }
}
