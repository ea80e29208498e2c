package org.chillsense.frontend.model;

import java.util.List;

/**
 * A module or spec module.
 *
 * @param name    The module name.
 * @param spec    {@code true} for a {@code SPEC MODULE}.
 * @param line    The 1-based header line.
 * @param lineEnd The line of the matching {@code END}, or the header line if unterminated.
 * @param grants  Names granted by the module. Not collected by the scanner.
 * @param seizes  Names seized by the module. Not collected by the scanner.
 */
public record ModuleDefinition(
        String name,
        boolean spec,
        int line,
        int lineEnd,
        List<String> grants,
        List<String> seizes) implements ChillEntity {

    public ModuleDefinition {
        grants = List.copyOf(grants);
        seizes = List.copyOf(seizes);
    }

    public ModuleDefinition(String name, boolean spec, int line, int lineEnd) {
        this(name, spec, line, lineEnd, List.of(), List.of());
    }

    @Override
    public SymbolKind kind() {
        return SymbolKind.MODULE;
    }
}
