package org.chillsense.query;

import org.chillsense.frontend.io.SourceLoader;
import org.chillsense.frontend.model.SymbolKind;
import org.chillsense.frontend.scanner.DeclarationScanner;
import org.chillsense.frontend.semantics.ChillLanguage;
import org.chillsense.frontend.semantics.SemanticModel;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CompletionProviderTest {

    private static SemanticModel model;

    @BeforeAll
    static void scanExample() throws IOException {
        model = new DeclarationScanner().scan(SourceLoader.loadClasspath("samples/example.chl").content());
    }

    @Test
    void complete_listsKeywordsThenBuiltinsThenEntities() {
        List<CompletionCandidate> candidates = CompletionProvider.complete(model, "DCL x co", 8);

        assertThat(candidates).extracting(CompletionCandidate::label)
                .containsExactly("CONSTR", "CONTEXT", "CONTINUE", "CONNECT", "COS", "count", "counter");
        assertThat(candidates).contains(
                new CompletionCandidate("CONSTR", SymbolKind.KEYWORD, "CHILL keyword"),
                new CompletionCandidate("COS", SymbolKind.PREDEFINED, "Built-in"),
                new CompletionCandidate("count", SymbolKind.DCL, "DCL USER"),
                new CompletionCandidate("counter", SymbolKind.MODE, "NEWMODE RANGE"));
    }

    @Test
    void complete_everyCandidateStartsWithPrefix() {
        List<CompletionCandidate> candidates = CompletionProvider.complete(model, "  st", 4);

        assertThat(candidates).isNotEmpty().allSatisfy(c ->
                assertThat(c.label().toUpperCase(Locale.ROOT)).startsWith("ST"));
        assertThat(candidates).extracting(CompletionCandidate::label).contains("state", "STATIC", "STRUCT");
    }

    @Test
    void complete_procedureDetailShowsParameters() {
        assertThat(CompletionProvider.complete(model, "h", 1))
                .contains(new CompletionCandidate("handler", SymbolKind.PROC, "PROC(input INT)"));
    }

    @Test
    void complete_columnPastEndOfLine_isClamped() {
        assertThat(CompletionProvider.complete(model, "ma", 99)).extracting(CompletionCandidate::label)
                .containsExactly("MAX", "max_size");
    }

    @Test
    void complete_emptyPrefix_offersEverything() {
        List<CompletionCandidate> candidates = CompletionProvider.complete(model, "", 0);

        int expected = ChillLanguage.reservedWords().size() + ChillLanguage.predefinedNames().size()
                + model.entities(SymbolKind.DCL).size() + model.entities(SymbolKind.MODE).size()
                + model.entities(SymbolKind.PROC).size() + model.entities(SymbolKind.SYNONYM).size();
        assertThat(candidates).hasSize(expected);
    }

    @Test
    void complete_processesAndSignalsAreNotOffered() {
        assertThat(CompletionProvider.complete(model, "wor", 3)).isEmpty();
        assertThat(CompletionProvider.complete(model, "read", 4)).extracting(CompletionCandidate::label)
                .doesNotContain("ready");
    }

    @Test
    void prefixAt_takesWordCharactersLeftOfColumn() {
        assertThat(CompletionProvider.prefixAt("DCL foo_bar", 11)).isEqualTo("foo_bar");
        assertThat(CompletionProvider.prefixAt("x(ab", 4)).isEqualTo("ab");
        assertThat(CompletionProvider.prefixAt("ab ", 3)).isEmpty();
        assertThat(CompletionProvider.prefixAt("abc", -5)).isEmpty();
    }
}
