package org.chillsense.query;

import org.chillsense.frontend.model.ChillEntity;
import org.chillsense.frontend.model.DclDefinition;
import org.chillsense.frontend.model.ModeDefinition;
import org.chillsense.frontend.model.ModuleDefinition;
import org.chillsense.frontend.model.ProcDefinition;
import org.chillsense.frontend.model.SymbolKind;
import org.chillsense.frontend.model.SynDefinition;
import org.chillsense.frontend.semantics.SemanticModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lists every entity of a model as a flat outline, ordered by start line.
 * Declarations are listed once even though the model stores them under several keys.
 */
public final class DocumentSymbolProvider {

    // Tie-break order for entities starting on the same line.
    private static final List<SymbolKind> LISTING_ORDER = List.of(
            SymbolKind.MODE, SymbolKind.DCL, SymbolKind.SYNONYM, SymbolKind.PROC,
            SymbolKind.PROCESS, SymbolKind.MODULE, SymbolKind.SIGNAL);

    private DocumentSymbolProvider() {}

    /**
     * @param model The document's model.
     * @param text  The document text, used to find where whole-line entries end.
     * @return The outline.
     */
    public static List<DocumentSymbolEntry> symbols(SemanticModel model, String text) {
        String[] lines = text.split("\n", -1);
        List<DocumentSymbolEntry> entries = new ArrayList<>();
        for (SymbolKind kind : LISTING_ORDER) {
            for (ChillEntity entity : model.entities(kind)) {
                entries.add(toEntry(entity, lines));
            }
        }
        entries.sort(Comparator.comparingInt(DocumentSymbolEntry::startLine));
        return entries;
    }

    private static DocumentSymbolEntry toEntry(ChillEntity entity, String[] lines) {
        if (entity instanceof DclDefinition dcl) {
            return new DocumentSymbolEntry(dcl.name(), SymbolKind.DCL, dcl.line(), dcl.line(),
                    EntityDescriptions.dcl(dcl), dcl.columnStart(), dcl.columnEnd());
        }
        String detail = switch (entity.kind()) {
            case MODE -> EntityDescriptions.mode((ModeDefinition) entity);
            case SYNONYM -> EntityDescriptions.synonym((SynDefinition) entity);
            case PROC -> EntityDescriptions.procSignature((ProcDefinition) entity);
            case MODULE -> EntityDescriptions.module((ModuleDefinition) entity);
            case PROCESS -> "PROCESS";
            case SIGNAL -> "SIGNAL";
            case DCL, KEYWORD, PREDEFINED -> entity.kind().name();
        };
        return new DocumentSymbolEntry(entity.name(), entity.kind(), entity.line(), entity.lineEnd(),
                detail, 0, lineLength(lines, entity.lineEnd()));
    }

    private static int lineLength(String[] lines, int oneBasedLine) {
        int index = oneBasedLine - 1;
        return index >= 0 && index < lines.length ? lines[index].length() : 0;
    }
}
