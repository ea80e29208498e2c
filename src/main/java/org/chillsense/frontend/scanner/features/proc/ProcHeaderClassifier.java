package org.chillsense.frontend.scanner.features.proc;

import org.chillsense.frontend.model.ProcDefinition;
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
 * Recognizes {@code name: PROC [(params)] [RETURNS (mode)] [GENERAL];} and records the
 * procedure together with the line of its closing {@code END}.
 */
public class ProcHeaderClassifier implements ILineClassifier {

    private static final Pattern PREFIX = Pattern.compile("^[A-Z_][A-Z0-9_]*\\s*:\\s*PROC\\b");
    private static final Pattern HEADER = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_]*)\\s*:\\s*PROC\\b(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern GENERAL = Pattern.compile("\\bGENERAL\\b");

    @Override
    public boolean matches(String normalized) {
        return PREFIX.matcher(normalized).find();
    }

    @Override
    public ScopeContext extract(SourceLine line, ScanContext context, ScopeContext scope) throws MalformedLineException {
        Matcher m = HEADER.matcher(line.trimmed());
        if (!m.find()) {
            throw new MalformedLineException(line.number(), "unreadable procedure header");
        }
        RoutineHeader header = RoutineHeader.read(m);
        boolean general = GENERAL.matcher(line.normalized()).find();

        OptionalInt end = BodyExtentResolver.resolve(context.lines(), line.number() - 1);
        context.model().addProc(new ProcDefinition(
                header.name(), header.parameters(), header.returnsMode(), general,
                line.number(), end.orElse(line.number())));
        return end.isPresent() ? scope.enterBody(header.name(), end.getAsInt()) : scope;
    }
}
