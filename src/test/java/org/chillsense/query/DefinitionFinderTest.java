package org.chillsense.query;

import org.chillsense.frontend.io.SourceLoader;
import org.chillsense.frontend.model.ChillEntity;
import org.chillsense.frontend.model.SymbolKind;
import org.chillsense.frontend.scanner.DeclarationScanner;
import org.chillsense.frontend.semantics.SemanticModel;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DefinitionFinderTest {

    private static SemanticModel model;

    @BeforeAll
    static void scanExample() throws IOException {
        model = new DeclarationScanner().scan(SourceLoader.loadClasspath("samples/example.chl").content());
    }

    @ParameterizedTest
    @CsvSource({
            "example, 1",
            "counter, 3",
            "max_size, 7",
            "count, 9",
            "HANDLER, 13",
            "worker, 19",
            "ready, 25"
    })
    void find_returnsDeclarationLine(String word, int line) {
        assertThat(DefinitionFinder.find(model, word)).hasValue(line);
    }

    @Test
    void find_unknownOrBlank_isEmpty() {
        assertThat(DefinitionFinder.find(model, "missing")).isEmpty();
        assertThat(DefinitionFinder.find(model, "")).isEmpty();
        assertThat(DefinitionFinder.find(model, null)).isEmpty();
    }

    @Test
    void findEntity_modeWinsOverProcedure() {
        SemanticModel clash = new DeclarationScanner().scan("NEWMODE shared = INT;\nshared: PROC();\nEND shared;");

        assertThat(DefinitionFinder.findEntity(clash, "shared")).map(ChillEntity::kind).contains(SymbolKind.MODE);
        assertThat(DefinitionFinder.find(clash, "shared")).hasValue(1);
    }
}
