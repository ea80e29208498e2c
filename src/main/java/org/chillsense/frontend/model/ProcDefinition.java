package org.chillsense.frontend.model;

import java.util.List;
import java.util.Map;

/**
 * A procedure ({@code name: PROC ...}).
 *
 * @param name        The procedure name.
 * @param parameters  Formal parameters in declaration order.
 * @param returnsMode Text inside {@code RETURNS(...)}, or {@code null}.
 * @param general     {@code GENERAL} attribute present.
 * @param line        The 1-based header line.
 * @param lineEnd     The line of the matching {@code END}, or the header line if unterminated.
 * @param localDcls   Declarations local to the body. The scanner records nested declarations
 *                    at module scope, so this map is always empty.
 * @param localModes  Modes local to the body. Always empty, see {@code localDcls}.
 */
public record ProcDefinition(
        String name,
        List<Parameter> parameters,
        String returnsMode,
        boolean general,
        int line,
        int lineEnd,
        Map<String, DclDefinition> localDcls,
        Map<String, ModeDefinition> localModes) implements ChillEntity {

    public ProcDefinition {
        parameters = List.copyOf(parameters);
        localDcls = Map.copyOf(localDcls);
        localModes = Map.copyOf(localModes);
    }

    public ProcDefinition(String name, List<Parameter> parameters, String returnsMode,
                          boolean general, int line, int lineEnd) {
        this(name, parameters, returnsMode, general, line, lineEnd, Map.of(), Map.of());
    }

    @Override
    public SymbolKind kind() {
        return SymbolKind.PROC;
    }
}
