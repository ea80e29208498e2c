package org.chillsense.query;

import org.chillsense.frontend.model.DclDefinition;
import org.chillsense.frontend.model.ModeDefinition;
import org.chillsense.frontend.model.ModuleDefinition;
import org.chillsense.frontend.model.Parameter;
import org.chillsense.frontend.model.ProcDefinition;
import org.chillsense.frontend.model.SynDefinition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Short one-line descriptions of entities, shared by completion, hover and the outline.
 */
final class EntityDescriptions {

    private EntityDescriptions() {}

    static String dcl(DclDefinition dcl) {
        return "DCL " + dcl.mode().label();
    }

    static String mode(ModeDefinition mode) {
        return mode.keyword() + " " + mode.baseMode().label();
    }

    static String synonym(SynDefinition syn) {
        return "SYN = " + syn.value();
    }

    static String module(ModuleDefinition module) {
        return module.spec() ? "SPEC MODULE" : "MODULE";
    }

    /**
     * @return {@code PROC(name mode, ...)}.
     */
    static String procSignature(ProcDefinition proc) {
        return "PROC(" + join(proc.parameters(), false) + ")";
    }

    /**
     * @return {@code PROC(name DIRECTION mode, ...)} followed by {@code RETURNS(mode)} if present.
     */
    static String procSignatureWithDirections(ProcDefinition proc) {
        String signature = "PROC(" + join(proc.parameters(), true) + ")";
        return proc.returnsMode() == null ? signature : signature + " RETURNS(" + proc.returnsMode() + ")";
    }

    private static String join(List<Parameter> parameters, boolean withDirection) {
        return parameters.stream()
                .map(p -> withDirection
                        ? p.name() + " " + p.direction() + " " + p.mode()
                        : p.name() + " " + p.mode())
                .collect(Collectors.joining(", "));
    }
}
