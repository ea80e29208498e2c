package org.chillsense.query;

import org.chillsense.frontend.model.DclDefinition;
import org.chillsense.frontend.model.ModeDefinition;
import org.chillsense.frontend.model.ProcDefinition;
import org.chillsense.frontend.model.SynDefinition;
import org.chillsense.frontend.semantics.ChillLanguage;
import org.chillsense.frontend.semantics.SemanticModel;

import java.util.Optional;

/**
 * Builds markdown hover text for a word.
 *
 * <p>Reserved words and predefined names take precedence over user entities of the same name.
 * After them come declarations, modes, procedures and synonyms, in that order.</p>
 */
public final class HoverProvider {

    private HoverProvider() {}

    /**
     * @param model The document's model.
     * @param word  The hovered identifier.
     * @return The markdown text, or empty if the word is unknown.
     */
    public static Optional<String> hover(SemanticModel model, String word) {
        if (word == null || word.isBlank()) {
            return Optional.empty();
        }
        if (ChillLanguage.isReservedWord(word)) {
            return Optional.of(headline(word, ChillLanguage.documentation(word).orElse("CHILL reserved word")));
        }
        if (ChillLanguage.isPredefined(word)) {
            return Optional.of(headline(word, ChillLanguage.documentation(word).orElse("CHILL predefined name")));
        }

        Optional<DclDefinition> dcl = model.findDcl(word);
        if (dcl.isPresent()) {
            return Optional.of(describe(word, dcl.get()));
        }
        Optional<ModeDefinition> mode = model.findMode(word);
        if (mode.isPresent()) {
            return Optional.of(describe(word, mode.get()));
        }
        Optional<ProcDefinition> proc = model.findProc(word);
        if (proc.isPresent()) {
            return Optional.of(headline(word, EntityDescriptions.procSignatureWithDirections(proc.get())));
        }
        return model.findSynonym(word).map(syn -> describe(word, syn));
    }

    private static String describe(String word, DclDefinition dcl) {
        StringBuilder sb = new StringBuilder(headline(word, EntityDescriptions.dcl(dcl)));
        if (dcl.modeName() != null) {
            sb.append(" (").append(dcl.modeName()).append(')');
        }
        if (dcl.initialValue() != null) {
            sb.append("\n\nInitial value: ").append(dcl.initialValue());
        }
        return sb.toString();
    }

    private static String describe(String word, ModeDefinition mode) {
        StringBuilder sb = new StringBuilder(headline(word, EntityDescriptions.mode(mode)));
        if (!mode.enumValues().isEmpty()) {
            sb.append("\n\nValues: ").append(String.join(", ", mode.enumValues()));
        }
        if (mode.rangeLow() != null) {
            sb.append("\n\nRange: ").append(mode.rangeLow()).append(':').append(mode.rangeHigh());
        }
        if (!mode.fields().isEmpty()) {
            sb.append("\n\nFields: ").append(String.join(", ", mode.fields().keySet()));
        }
        return sb.toString();
    }

    private static String describe(String word, SynDefinition syn) {
        return headline(word, EntityDescriptions.synonym(syn));
    }

    private static String headline(String word, String text) {
        return "**" + word + "** - " + text;
    }
}
