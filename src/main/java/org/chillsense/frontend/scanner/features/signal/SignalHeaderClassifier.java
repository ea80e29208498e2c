package org.chillsense.frontend.scanner.features.signal;

import org.chillsense.frontend.model.SignalDefinition;
import org.chillsense.frontend.model.SignalDefinition.SignalParameter;
import org.chillsense.frontend.scanner.ILineClassifier;
import org.chillsense.frontend.scanner.MalformedLineException;
import org.chillsense.frontend.scanner.ParameterListParser;
import org.chillsense.frontend.scanner.ScanContext;
import org.chillsense.frontend.scanner.SourceLine;
import org.chillsense.frontend.semantics.ScopeContext;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes {@code SIGNAL name [(params)];}. Parameter entries need a name and a mode;
 * entries with a single token are dropped.
 */
public class SignalHeaderClassifier implements ILineClassifier {

    private static final Pattern PREFIX = Pattern.compile("^SIGNAL\\b");
    private static final Pattern HEADER = Pattern.compile(
            "^SIGNAL\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*(.*)$", Pattern.CASE_INSENSITIVE);

    @Override
    public boolean matches(String normalized) {
        return PREFIX.matcher(normalized).find();
    }

    @Override
    public ScopeContext extract(SourceLine line, ScanContext context, ScopeContext scope) throws MalformedLineException {
        Matcher m = HEADER.matcher(line.trimmed());
        if (!m.find()) {
            throw new MalformedLineException(line.number(), "signal without a name");
        }
        String rest = m.group(2);
        List<SignalParameter> parameters = new ArrayList<>();
        if (rest.startsWith("(")) {
            ParameterListParser.balancedGroup(rest, 0).ifPresent(list -> {
                for (String entry : ParameterListParser.splitTopLevel(list)) {
                    String[] tokens = ParameterListParser.tokens(entry);
                    if (tokens.length >= 2) {
                        parameters.add(new SignalParameter(tokens[0], tokens[tokens.length - 1]));
                    }
                }
            });
        }
        context.model().addSignal(new SignalDefinition(m.group(1), parameters, line.number()));
        return scope;
    }
}
