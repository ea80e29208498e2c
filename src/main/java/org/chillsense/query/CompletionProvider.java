package org.chillsense.query;

import org.chillsense.frontend.model.ChillEntity;
import org.chillsense.frontend.model.DclDefinition;
import org.chillsense.frontend.model.ModeDefinition;
import org.chillsense.frontend.model.ProcDefinition;
import org.chillsense.frontend.model.SymbolKind;
import org.chillsense.frontend.model.SynDefinition;
import org.chillsense.frontend.semantics.ChillLanguage;
import org.chillsense.frontend.semantics.SemanticModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Suggests names that extend the identifier left of the cursor.
 *
 * <p>Candidates come in a fixed order: reserved words, predefined names, declarations, modes,
 * procedures, synonyms. The prefix test ignores case.</p>
 */
public final class CompletionProvider {

    private CompletionProvider() {}

    /**
     * @param model    The document's model.
     * @param lineText The text of the cursor line.
     * @param column   The 0-based cursor column. Values past the end of the line are clamped.
     * @return All matching candidates, possibly empty.
     */
    public static List<CompletionCandidate> complete(SemanticModel model, String lineText, int column) {
        String prefix = prefixAt(lineText, column).toUpperCase(Locale.ROOT);
        List<CompletionCandidate> result = new ArrayList<>();

        for (String keyword : ChillLanguage.reservedWords()) {
            if (keyword.startsWith(prefix)) {
                result.add(new CompletionCandidate(keyword, SymbolKind.KEYWORD, "CHILL keyword"));
            }
        }
        for (String name : ChillLanguage.predefinedNames()) {
            if (name.startsWith(prefix)) {
                result.add(new CompletionCandidate(name, SymbolKind.PREDEFINED, "Built-in"));
            }
        }
        for (ChillEntity entity : model.entities(SymbolKind.DCL)) {
            if (matches(entity, prefix)) {
                result.add(new CompletionCandidate(entity.name(), SymbolKind.DCL,
                        EntityDescriptions.dcl((DclDefinition) entity)));
            }
        }
        for (ChillEntity entity : model.entities(SymbolKind.MODE)) {
            if (matches(entity, prefix)) {
                result.add(new CompletionCandidate(entity.name(), SymbolKind.MODE,
                        EntityDescriptions.mode((ModeDefinition) entity)));
            }
        }
        for (ChillEntity entity : model.entities(SymbolKind.PROC)) {
            if (matches(entity, prefix)) {
                result.add(new CompletionCandidate(entity.name(), SymbolKind.PROC,
                        EntityDescriptions.procSignature((ProcDefinition) entity)));
            }
        }
        for (ChillEntity entity : model.entities(SymbolKind.SYNONYM)) {
            if (matches(entity, prefix)) {
                result.add(new CompletionCandidate(entity.name(), SymbolKind.SYNONYM,
                        EntityDescriptions.synonym((SynDefinition) entity)));
            }
        }
        return result;
    }

    /**
     * Returns the run of identifier characters ending at the cursor.
     * @param lineText The line.
     * @param column   The 0-based cursor column.
     * @return The prefix, empty if the character left of the cursor is not an identifier character.
     */
    public static String prefixAt(String lineText, int column) {
        int end = Math.max(0, Math.min(column, lineText.length()));
        int start = end;
        while (start > 0 && WordAtPosition.isWordChar(lineText.charAt(start - 1))) {
            start--;
        }
        return lineText.substring(start, end);
    }

    private static boolean matches(ChillEntity entity, String upperPrefix) {
        return entity.name().toUpperCase(Locale.ROOT).startsWith(upperPrefix);
    }
}
