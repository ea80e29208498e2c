package org.chillsense.frontend.model;

/**
 * A {@code SYN} constant. The value is kept as source text and never evaluated.
 *
 * @param name  The synonym name.
 * @param value The text after {@code =}, up to the terminating semicolon.
 * @param mode  The declared mode name, or {@code null}.
 * @param line  The 1-based line of the definition.
 */
public record SynDefinition(String name, String value, String mode, int line) implements ChillEntity {

    @Override
    public SymbolKind kind() {
        return SymbolKind.SYNONYM;
    }
}
