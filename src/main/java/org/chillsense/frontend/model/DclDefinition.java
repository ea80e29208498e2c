package org.chillsense.frontend.model;

/**
 * A {@code DCL} declaration, or a field of a {@code STRUCT} mode.
 *
 * @param name         The declared name.
 * @param mode         The inferred mode category.
 * @param modeName     The mode text when it does not name a built-in mode, otherwise {@code null}.
 * @param initialValue The unparsed initializer after {@code :=}, or {@code null}.
 * @param isStatic     {@code STATIC} was present.
 * @param isDynamic    {@code DYNAMIC} was present.
 * @param isLoc        {@code LOC} was present.
 * @param isRead       {@code READ} was present.
 * @param line         The 1-based line of the declaration.
 * @param columnStart  The 0-based column where the name starts in the original line.
 * @param columnEnd    The 0-based column just past the name.
 * @param parentScope  The module scope active when the declaration was scanned.
 */
public record DclDefinition(
        String name,
        ChillMode mode,
        String modeName,
        String initialValue,
        boolean isStatic,
        boolean isDynamic,
        boolean isLoc,
        boolean isRead,
        int line,
        int columnStart,
        int columnEnd,
        String parentScope) implements ChillEntity {

    /**
     * Creates a struct field entry. Fields carry no flags, initializer or column span.
     */
    public static DclDefinition field(String name, ChillMode mode, int line, String owner) {
        return new DclDefinition(name, mode, null, null, false, false, false, false, line, 0, 0, owner);
    }

    @Override
    public SymbolKind kind() {
        return SymbolKind.DCL;
    }
}
