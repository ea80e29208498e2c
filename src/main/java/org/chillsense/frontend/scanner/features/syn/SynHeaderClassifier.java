package org.chillsense.frontend.scanner.features.syn;

import org.chillsense.frontend.model.SynDefinition;
import org.chillsense.frontend.scanner.ILineClassifier;
import org.chillsense.frontend.scanner.MalformedLineException;
import org.chillsense.frontend.scanner.ScanContext;
import org.chillsense.frontend.scanner.SourceLine;
import org.chillsense.frontend.semantics.ScopeContext;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes {@code SYN name [mode] = value;}. The value is kept as text.
 */
public class SynHeaderClassifier implements ILineClassifier {

    private static final Pattern PREFIX = Pattern.compile("^SYN\\b");
    private static final Pattern HEADER = Pattern.compile(
            "^SYN\\s+([A-Za-z_][A-Za-z0-9_]*)(?:\\s+([A-Za-z_][A-Za-z0-9_]*))?\\s*=\\s*([^;]+)",
            Pattern.CASE_INSENSITIVE);

    @Override
    public boolean matches(String normalized) {
        return PREFIX.matcher(normalized).find();
    }

    @Override
    public ScopeContext extract(SourceLine line, ScanContext context, ScopeContext scope) throws MalformedLineException {
        Matcher m = HEADER.matcher(line.trimmed());
        if (!m.find()) {
            throw new MalformedLineException(line.number(), "synonym without a value");
        }
        context.model().addSynonym(new SynDefinition(m.group(1), m.group(3).trim(), m.group(2), line.number()));
        return scope;
    }
}
