package org.chillsense.frontend.model;

/**
 * Common view of every entity the declaration scanner can record in a
 * {@link org.chillsense.frontend.semantics.SemanticModel}.
 *
 * <p>Line numbers are 1-based and refer to the line of the introducing keyword. Comment
 * stripping keeps line breaks, so they are valid in the original text as well.</p>
 */
public sealed interface ChillEntity
        permits DclDefinition, ModeDefinition, SynDefinition, ProcDefinition,
                ProcessDefinition, ModuleDefinition, SignalDefinition {

    /**
     * @return The name as written in the source.
     */
    String name();

    /**
     * @return The kind of entity, used for dispatch instead of {@code instanceof} chains.
     */
    SymbolKind kind();

    /**
     * @return The 1-based start line.
     */
    int line();

    /**
     * @return The 1-based end line. Entities without a body end on their start line.
     */
    default int lineEnd() {
        return line();
    }
}
