package org.chillsense.query;

import org.chillsense.frontend.model.ChillEntity;
import org.chillsense.frontend.semantics.SemanticModel;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Go-to-definition over a single document's model.
 * Lookup order is declaration, mode, procedure, process, synonym, signal, module.
 */
public final class DefinitionFinder {

    private DefinitionFinder() {}

    /**
     * @return The 1-based line of the definition, or empty.
     */
    public static OptionalInt find(SemanticModel model, String word) {
        return findEntity(model, word).map(e -> OptionalInt.of(e.line())).orElse(OptionalInt.empty());
    }

    public static Optional<ChillEntity> findEntity(SemanticModel model, String word) {
        if (word == null || word.isBlank()) {
            return Optional.empty();
        }
        return model.findAny(word);
    }
}
