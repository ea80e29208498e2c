package org.chillsense.frontend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@code NEWMODE} or {@code SYNMODE} definition.
 *
 * @param name        The mode name.
 * @param baseMode    The category inferred from the right-hand side.
 * @param synonymMode {@code true} for {@code SYNMODE}, {@code false} for {@code NEWMODE}.
 * @param enumValues  Enumerators of a {@code SET} mode, in declaration order.
 * @param rangeLow    Lower bound of a {@code RANGE} mode, or {@code null}.
 * @param rangeHigh   Upper bound of a {@code RANGE} mode, or {@code null}.
 * @param fields      Fields of a {@code STRUCT} mode, in declaration order.
 * @param line        The 1-based line of the definition.
 */
public record ModeDefinition(
        String name,
        ChillMode baseMode,
        boolean synonymMode,
        List<String> enumValues,
        Long rangeLow,
        Long rangeHigh,
        Map<String, DclDefinition> fields,
        int line) implements ChillEntity {

    public ModeDefinition {
        enumValues = List.copyOf(enumValues);
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * @return {@code NEWMODE} or {@code SYNMODE}.
     */
    public String keyword() {
        return synonymMode ? "SYNMODE" : "NEWMODE";
    }

    @Override
    public SymbolKind kind() {
        return SymbolKind.MODE;
    }
}
