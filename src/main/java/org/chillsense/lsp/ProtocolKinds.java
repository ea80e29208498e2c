package org.chillsense.lsp;

import org.chillsense.frontend.model.SymbolKind;
import org.eclipse.lsp4j.CompletionItemKind;

/**
 * Maps entity kinds to the LSP enumerations.
 */
public final class ProtocolKinds {

    private ProtocolKinds() {}

    public static CompletionItemKind completionKind(SymbolKind kind) {
        return switch (kind) {
            case KEYWORD -> CompletionItemKind.Keyword;
            case PREDEFINED, PROC, PROCESS -> CompletionItemKind.Function;
            case DCL -> CompletionItemKind.Variable;
            case MODE -> CompletionItemKind.Class;
            case SYNONYM -> CompletionItemKind.Constant;
            case MODULE -> CompletionItemKind.Module;
            case SIGNAL -> CompletionItemKind.Event;
        };
    }

    public static org.eclipse.lsp4j.SymbolKind symbolKind(SymbolKind kind) {
        return switch (kind) {
            case MODULE -> org.eclipse.lsp4j.SymbolKind.Module;
            case MODE -> org.eclipse.lsp4j.SymbolKind.Class;
            case DCL -> org.eclipse.lsp4j.SymbolKind.Variable;
            case SYNONYM -> org.eclipse.lsp4j.SymbolKind.Constant;
            case PROC, PROCESS, PREDEFINED -> org.eclipse.lsp4j.SymbolKind.Function;
            case SIGNAL -> org.eclipse.lsp4j.SymbolKind.Event;
            case KEYWORD -> org.eclipse.lsp4j.SymbolKind.Key;
        };
    }
}
