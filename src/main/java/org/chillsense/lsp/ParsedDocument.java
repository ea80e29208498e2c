package org.chillsense.lsp;

import org.chillsense.frontend.semantics.SemanticModel;

/**
 * An open document together with the model built from exactly this text.
 *
 * @param text  The full document text.
 * @param model The model scanned from {@code text}.
 */
public record ParsedDocument(String text, SemanticModel model) {

    /**
     * @param line The 0-based line.
     * @return The line's text, or an empty string past the end of the document.
     */
    public String lineText(int line) {
        String[] lines = text.split("\n", -1);
        return line >= 0 && line < lines.length ? lines[line] : "";
    }
}
