package org.chillsense.query;

import org.chillsense.frontend.model.SymbolKind;

/**
 * One outline entry.
 *
 * @param name        The entity name.
 * @param kind        The entity kind.
 * @param startLine   The 1-based first line.
 * @param endLine     The 1-based last line.
 * @param detail      A one-line description, e.g. {@code DCL INT}.
 * @param columnStart The 0-based start column of the name on {@code startLine}, or 0 for entries
 *                    that cover whole lines.
 * @param columnEnd   The exclusive end column on {@code endLine}.
 */
public record DocumentSymbolEntry(
        String name,
        SymbolKind kind,
        int startLine,
        int endLine,
        String detail,
        int columnStart,
        int columnEnd) {}
