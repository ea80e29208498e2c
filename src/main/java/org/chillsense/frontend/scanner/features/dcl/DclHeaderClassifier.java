package org.chillsense.frontend.scanner.features.dcl;

import org.chillsense.frontend.model.DclDefinition;
import org.chillsense.frontend.scanner.ILineClassifier;
import org.chillsense.frontend.scanner.MalformedLineException;
import org.chillsense.frontend.scanner.ModeInference;
import org.chillsense.frontend.scanner.ScanContext;
import org.chillsense.frontend.scanner.SourceLine;
import org.chillsense.frontend.semantics.ScopeContext;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes {@code DCL name [attributes] mode [:= init];}.
 * The attributes {@code STATIC}, {@code DYNAMIC}, {@code LOC} and {@code READ} become flags.
 */
public class DclHeaderClassifier implements ILineClassifier {

    private static final Pattern PREFIX = Pattern.compile("^DCL\\b");
    private static final Pattern HEADER = Pattern.compile(
            "^DCL\\s+([A-Za-z_][A-Za-z0-9_]*)\\s+([^:;]+)(?:\\s*:=\\s*([^;]+))?\\s*;?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern STATIC = attribute("STATIC");
    private static final Pattern DYNAMIC = attribute("DYNAMIC");
    private static final Pattern LOC = attribute("LOC");
    private static final Pattern READ = attribute("READ");

    @Override
    public boolean matches(String normalized) {
        return PREFIX.matcher(normalized).find();
    }

    @Override
    public ScopeContext extract(SourceLine line, ScanContext context, ScopeContext scope) throws MalformedLineException {
        Matcher m = HEADER.matcher(line.trimmed());
        if (!m.find()) {
            throw new MalformedLineException(line.number(), "declaration without a mode");
        }
        String name = m.group(1);
        String modeText = m.group(2).trim();
        String init = m.group(3) != null ? m.group(3).trim() : null;

        boolean isStatic = STATIC.matcher(modeText).find();
        boolean isDynamic = DYNAMIC.matcher(modeText).find();
        boolean isLoc = LOC.matcher(modeText).find();
        boolean isRead = READ.matcher(modeText).find();
        String bareMode = strip(modeText, STATIC, DYNAMIC, LOC, READ);
        if (bareMode.isEmpty()) {
            throw new MalformedLineException(line.number(), "declaration of " + name + " has only attributes");
        }

        int columnStart = line.indent() + m.start(1);
        DclDefinition dcl = new DclDefinition(
                name,
                ModeInference.fromToken(bareMode),
                ModeInference.isBuiltin(bareMode) ? null : bareMode,
                init,
                isStatic, isDynamic, isLoc, isRead,
                line.number(),
                columnStart,
                columnStart + name.length(),
                scope.scopeName());
        context.model().addDcl(dcl, scope);
        return scope;
    }

    private static Pattern attribute(String keyword) {
        return Pattern.compile("\\b" + keyword + "\\b", Pattern.CASE_INSENSITIVE);
    }

    private static String strip(String text, Pattern... attributes) {
        String result = text;
        for (Pattern attribute : attributes) {
            result = attribute.matcher(result).replaceAll(" ");
        }
        return result.trim().replaceAll("\\s+", " ");
    }
}
