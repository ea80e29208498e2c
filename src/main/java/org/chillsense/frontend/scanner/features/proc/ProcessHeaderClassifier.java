package org.chillsense.frontend.scanner.features.proc;

import org.chillsense.frontend.model.ProcessDefinition;
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
 * Recognizes {@code name: PROCESS [(params)];}.
 */
public class ProcessHeaderClassifier implements ILineClassifier {

    private static final Pattern PREFIX = Pattern.compile("^[A-Z_][A-Z0-9_]*\\s*:\\s*PROCESS\\b");
    private static final Pattern HEADER = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_]*)\\s*:\\s*PROCESS\\b(.*)$", Pattern.CASE_INSENSITIVE);

    @Override
    public boolean matches(String normalized) {
        return PREFIX.matcher(normalized).find();
    }

    @Override
    public ScopeContext extract(SourceLine line, ScanContext context, ScopeContext scope) throws MalformedLineException {
        Matcher m = HEADER.matcher(line.trimmed());
        if (!m.find()) {
            throw new MalformedLineException(line.number(), "unreadable process header");
        }
        RoutineHeader header = RoutineHeader.read(m);

        OptionalInt end = BodyExtentResolver.resolve(context.lines(), line.number() - 1);
        context.model().addProcess(new ProcessDefinition(
                header.name(), header.parameters(), line.number(), end.orElse(line.number())));
        return end.isPresent() ? scope.enterBody(header.name(), end.getAsInt()) : scope;
    }
}
