package org.chillsense.query;

import org.chillsense.frontend.model.SymbolKind;

/**
 * A completion suggestion.
 *
 * @param label  The text to insert.
 * @param kind   What the label names.
 * @param detail A short description shown next to the label.
 */
public record CompletionCandidate(String label, SymbolKind kind, String detail) {}
