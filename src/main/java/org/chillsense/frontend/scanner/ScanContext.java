package org.chillsense.frontend.scanner;

import org.chillsense.frontend.semantics.SemanticModel;

import java.util.List;

/**
 * Shared state of a single scan: the cleaned lines and the model being filled.
 * A context lives for one call to {@link DeclarationScanner#scan(String)}.
 *
 * @param lines The comment-free lines of the document, index 0 is line 1.
 * @param model The model the classifiers write to.
 */
public record ScanContext(List<String> lines, SemanticModel model) {

    public ScanContext {
        lines = List.copyOf(lines);
    }
}
