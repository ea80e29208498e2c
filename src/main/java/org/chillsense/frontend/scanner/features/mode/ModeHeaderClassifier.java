package org.chillsense.frontend.scanner.features.mode;

import org.chillsense.frontend.model.ChillMode;
import org.chillsense.frontend.model.DclDefinition;
import org.chillsense.frontend.model.ModeDefinition;
import org.chillsense.frontend.scanner.ILineClassifier;
import org.chillsense.frontend.scanner.MalformedLineException;
import org.chillsense.frontend.scanner.ModeInference;
import org.chillsense.frontend.scanner.ParameterListParser;
import org.chillsense.frontend.scanner.ScanContext;
import org.chillsense.frontend.scanner.SourceLine;
import org.chillsense.frontend.semantics.ScopeContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes {@code NEWMODE name = ...;} and {@code SYNMODE name = ...;}.
 * {@code SET}, {@code RANGE} and {@code STRUCT} right-hand sides are taken apart further.
 */
public class ModeHeaderClassifier implements ILineClassifier {

    private static final Pattern PREFIX = Pattern.compile("^(?:NEWMODE|SYNMODE)\\b");
    private static final Pattern HEADER = Pattern.compile(
            "^(NEWMODE|SYNMODE)\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SET = Pattern.compile("^SET\\s*\\(([^)]+)\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RANGE = Pattern.compile(
            "^RANGE\\s*\\(\\s*(-?\\d+)\\s*:\\s*(-?\\d+)\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern STRUCT = Pattern.compile("^STRUCT\\s*\\(", Pattern.CASE_INSENSITIVE);

    @Override
    public boolean matches(String normalized) {
        return PREFIX.matcher(normalized).find();
    }

    @Override
    public ScopeContext extract(SourceLine line, ScanContext context, ScopeContext scope) throws MalformedLineException {
        Matcher m = HEADER.matcher(line.trimmed());
        if (!m.find()) {
            throw new MalformedLineException(line.number(), "mode definition without '='");
        }
        boolean synonymMode = m.group(1).toUpperCase(Locale.ROOT).equals("SYNMODE");
        String name = m.group(2);
        String rhs = stripSemicolons(m.group(3));

        List<String> enumValues = new ArrayList<>();
        Long low = null;
        Long high = null;
        Map<String, DclDefinition> fields = new LinkedHashMap<>();

        Matcher set = SET.matcher(rhs);
        if (set.find()) {
            for (String value : set.group(1).split(",")) {
                enumValues.add(value.trim());
            }
        }
        Matcher range = RANGE.matcher(rhs);
        if (range.find()) {
            try {
                low = Long.parseLong(range.group(1));
                high = Long.parseLong(range.group(2));
            } catch (NumberFormatException e) {
                throw new MalformedLineException(line.number(), "range bound out of bounds: " + rhs, e);
            }
        }
        Matcher struct = STRUCT.matcher(rhs);
        if (struct.find()) {
            ParameterListParser.balancedGroup(rhs, struct.end() - 1)
                    .ifPresent(body -> collectFields(body, name, line.number(), fields));
        }

        context.model().addMode(new ModeDefinition(
                name, ModeInference.infer(rhs), synonymMode, enumValues, low, high, fields, line.number()));
        return scope;
    }

    private static void collectFields(String body, String owner, int lineNumber, Map<String, DclDefinition> fields) {
        for (String entry : ParameterListParser.splitTopLevel(body)) {
            String[] tokens = ParameterListParser.tokens(entry);
            if (tokens.length >= 2) {
                ChillMode mode = ModeInference.fromToken(tokens[tokens.length - 1]);
                fields.put(tokens[0], DclDefinition.field(tokens[0], mode, lineNumber, owner));
            }
        }
    }

    private static String stripSemicolons(String text) {
        String result = text.trim();
        while (result.endsWith(";")) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }
}
