package org.chillsense.frontend.model;

import java.util.List;
import java.util.Map;

/**
 * A process definition ({@code name: PROCESS ...}), the concurrent counterpart of a procedure.
 *
 * @param name       The process name.
 * @param parameters Formal parameters in declaration order.
 * @param line       The 1-based header line.
 * @param lineEnd    The line of the matching {@code END}, or the header line if unterminated.
 * @param localDcls  Always empty, see {@link ProcDefinition#localDcls()}.
 * @param localModes Always empty.
 */
public record ProcessDefinition(
        String name,
        List<Parameter> parameters,
        int line,
        int lineEnd,
        Map<String, DclDefinition> localDcls,
        Map<String, ModeDefinition> localModes) implements ChillEntity {

    public ProcessDefinition {
        parameters = List.copyOf(parameters);
        localDcls = Map.copyOf(localDcls);
        localModes = Map.copyOf(localModes);
    }

    public ProcessDefinition(String name, List<Parameter> parameters, int line, int lineEnd) {
        this(name, parameters, line, lineEnd, Map.of(), Map.of());
    }

    @Override
    public SymbolKind kind() {
        return SymbolKind.PROCESS;
    }
}
