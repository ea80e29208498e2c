package org.chillsense.frontend.model;

import java.util.List;

/**
 * A {@code SIGNAL} definition: a typed inter-process message without a body.
 *
 * @param name       The signal name.
 * @param parameters Carried values in declaration order.
 * @param line       The 1-based line of the definition.
 */
public record SignalDefinition(String name, List<SignalParameter> parameters, int line) implements ChillEntity {

    public SignalDefinition {
        parameters = List.copyOf(parameters);
    }

    /**
     * @param name The parameter name.
     * @param mode The mode text (last token of the entry).
     */
    public record SignalParameter(String name, String mode) {}

    @Override
    public SymbolKind kind() {
        return SymbolKind.SIGNAL;
    }
}
