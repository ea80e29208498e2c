package org.chillsense.frontend.scanner.features.module;

import org.chillsense.frontend.model.ModuleDefinition;
import org.chillsense.frontend.scanner.BodyExtentResolver;
import org.chillsense.frontend.scanner.ILineClassifier;
import org.chillsense.frontend.scanner.MalformedLineException;
import org.chillsense.frontend.scanner.ScanContext;
import org.chillsense.frontend.scanner.SourceLine;
import org.chillsense.frontend.semantics.ScopeContext;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes module headers in the forms {@code MODULE name}, {@code SPEC MODULE name} and
 * {@code name: [SPEC] MODULE}, and opens a module scope that lasts until the matching {@code END}.
 */
public class ModuleHeaderClassifier implements ILineClassifier {

    private static final Pattern PREFIX =
            Pattern.compile("^(?:(?:SPEC\\s+)?MODULE\\b|[A-Z_][A-Z0-9_]*\\s*:\\s*(?:SPEC\\s+)?MODULE\\b)");

    private static final Pattern HEADER = Pattern.compile(
            "^(?:([A-Za-z_][A-Za-z0-9_]*)\\s*:\\s*)?(SPEC\\s+)?MODULE\\b(?:\\s+([A-Za-z_][A-Za-z0-9_]*))?",
            Pattern.CASE_INSENSITIVE);

    @Override
    public boolean matches(String normalized) {
        return PREFIX.matcher(normalized).find();
    }

    @Override
    public ScopeContext extract(SourceLine line, ScanContext context, ScopeContext scope) throws MalformedLineException {
        Matcher m = HEADER.matcher(line.trimmed());
        if (!m.find()) {
            throw new MalformedLineException(line.number(), "unreadable module header");
        }
        String name = m.group(1) != null ? m.group(1) : m.group(3);
        if (name == null) {
            throw new MalformedLineException(line.number(), "module header without a name");
        }
        boolean spec = m.group(2) != null;

        OptionalInt end = BodyExtentResolver.resolve(context.lines(), line.number() - 1);
        context.model().addModule(new ModuleDefinition(name, spec, line.number(), end.orElse(line.number())));
        // an unterminated module stays open until the end of the document
        return scope.enterModule(name, end.orElse(Integer.MAX_VALUE));
    }
}
