package org.chillsense.frontend.scanner;

import org.chillsense.frontend.semantics.ScopeContext;

/**
 * A recognizer for one kind of declaration header.
 * The scanner asks each registered classifier in order and lets the first match extract.
 */
public interface ILineClassifier {

    /**
     * Tests whether the line starts a construct this classifier handles.
     * @param normalized The trimmed, upper-cased line.
     * @return {@code true} if {@link #extract} should be called for this line.
     */
    boolean matches(String normalized);

    /**
     * Reads the construct starting on the given line and records it in the context's model.
     *
     * @param line    The line that matched.
     * @param context The scan-wide lines and model.
     * @param scope   The scope active at this line.
     * @return The scope for the following lines. Classifiers that open no scope return {@code scope}.
     * @throws MalformedLineException if the line cannot be read. Nothing is recorded in that case.
     */
    ScopeContext extract(SourceLine line, ScanContext context, ScopeContext scope) throws MalformedLineException;
}
