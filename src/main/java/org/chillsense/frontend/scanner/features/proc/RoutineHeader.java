package org.chillsense.frontend.scanner.features.proc;

import org.chillsense.frontend.model.Parameter;
import org.chillsense.frontend.scanner.ParameterListParser;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The parts of a {@code name: PROC ...} or {@code name: PROCESS ...} header line.
 *
 * @param name        The routine name.
 * @param parameters  The formal parameters, empty when the header has no list.
 * @param returnsMode The text inside {@code RETURNS(...)}, or {@code null}.
 */
record RoutineHeader(String name, List<Parameter> parameters, String returnsMode) {

    private static final Pattern RETURNS = Pattern.compile("^\\s*RETURNS\\s*\\(", Pattern.CASE_INSENSITIVE);

    /**
     * Reads a header.
     * @param header   A matcher whose group 1 is the name and group 2 the text after the keyword.
     * @return The header parts.
     */
    static RoutineHeader read(Matcher header) {
        String name = header.group(1);
        String rest = header.group(2);

        List<Parameter> parameters = List.of();
        String afterParams = rest;
        int open = firstNonBlank(rest);
        if (open >= 0 && rest.charAt(open) == '(') {
            Optional<String> list = ParameterListParser.balancedGroup(rest, open);
            if (list.isPresent()) {
                parameters = ParameterListParser.parseParameters(list.get());
                afterParams = rest.substring(open + list.get().length() + 2);
            }
        }

        String returnsMode = null;
        Matcher returns = RETURNS.matcher(afterParams);
        if (returns.find()) {
            returnsMode = ParameterListParser.balancedGroup(afterParams, returns.end() - 1)
                    .map(String::trim)
                    .filter(text -> !text.isEmpty())
                    .orElse(null);
        }
        return new RoutineHeader(name, parameters, returnsMode);
    }

    private static int firstNonBlank(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
