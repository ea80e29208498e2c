package org.chillsense.frontend.semantics;

import org.chillsense.frontend.model.ChillEntity;
import org.chillsense.frontend.model.ChillMode;
import org.chillsense.frontend.model.DclDefinition;
import org.chillsense.frontend.model.ModeDefinition;
import org.chillsense.frontend.model.ProcDefinition;
import org.chillsense.frontend.model.SymbolKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SemanticModelTest {

    private static DclDefinition dcl(String name, ChillMode mode, int line, String scope) {
        return new DclDefinition(name, mode, null, null, false, false, false, false,
                line, 4, 4 + name.length(), scope);
    }

    private static ModeDefinition mode(String name, int line) {
        return new ModeDefinition(name, ChillMode.INT, false, List.of(), null, null, Map.of(), line);
    }

    @Test
    void addDcl_global_storesBareAndGlobalQualifiedKeys() {
        SemanticModel model = new SemanticModel();

        model.addDcl(dcl("x", ChillMode.INT, 1, ScopeContext.GLOBAL), ScopeContext.global());

        assertThat(model.dclKeys()).containsExactly("X", "GLOBAL.X");
        assertThat(model.entities(SymbolKind.DCL)).hasSize(1);
    }

    @Test
    void findDcl_globalShadowedByBodyLocal_bothReachable() {
        SemanticModel model = new SemanticModel();
        model.addDcl(dcl("x", ChillMode.BOOL, 1, ScopeContext.GLOBAL), ScopeContext.global());
        model.addDcl(dcl("x", ChillMode.INT, 3, ScopeContext.GLOBAL), ScopeContext.global().enterBody("p", 4));

        assertThat(model.findDcl("x")).map(DclDefinition::line).contains(1);
        assertThat(model.findDcl("p.x")).map(DclDefinition::line).contains(3);
        assertThat(model.findDcl("GLOBAL.x")).map(DclDefinition::line).contains(1);
    }

    @Test
    void addDcl_insideModuleAndBody_storesQualifiedKeys() {
        SemanticModel model = new SemanticModel();
        ScopeContext scope = ScopeContext.global().enterModule("m", 20).enterBody("p", 10);

        model.addDcl(dcl("x", ChillMode.INT, 3, "m"), scope);

        assertThat(model.dclKeys()).containsExactly("X", "M.X", "P.X");
        assertThat(model.findDcl("m.x")).isPresent();
        assertThat(model.findDcl("P.X")).isPresent();
    }

    @Test
    void findMode_isCaseInsensitive() {
        SemanticModel model = new SemanticModel();
        model.addMode(mode("counter", 1));

        assertThat(model.findMode("COUNTER")).map(ModeDefinition::name).contains("counter");
    }

    @Test
    void findDcl_prefersResolutionScope() {
        SemanticModel model = new SemanticModel();
        model.addDcl(dcl("x", ChillMode.INT, 2, "m"), ScopeContext.global().enterModule("m", 3));
        model.addDcl(dcl("x", ChillMode.BOOL, 5, ScopeContext.GLOBAL), ScopeContext.global());

        assertThat(model.findDcl("x")).map(DclDefinition::mode).contains(ChillMode.BOOL);

        model.setResolutionScope("m");

        assertThat(model.getResolutionScope()).isEqualTo("m");
        assertThat(model.findDcl("x")).map(DclDefinition::mode).contains(ChillMode.INT);
    }

    @Test
    void findAny_prefersDeclarationOverMode() {
        SemanticModel model = new SemanticModel();
        model.addMode(mode("dup", 1));
        model.addDcl(dcl("dup", ChillMode.BOOL, 2, ScopeContext.GLOBAL), ScopeContext.global());

        assertThat(model.findAny("dup")).map(ChillEntity::kind).contains(SymbolKind.DCL);
    }

    @Test
    void findAny_prefersModeOverProcedure() {
        SemanticModel model = new SemanticModel();
        model.addProc(new ProcDefinition("shared", List.of(), null, false, 1, 2));
        model.addMode(mode("shared", 3));

        assertThat(model.findAny("shared")).map(ChillEntity::kind).contains(SymbolKind.MODE);
        assertThat(model.find("shared", SymbolKind.PROC)).map(ChillEntity::line).contains(1);
    }

    @Test
    void find_keywordKinds_alwaysEmpty() {
        SemanticModel model = new SemanticModel();
        model.addMode(mode("INT", 1));

        assertThat(model.find("INT", SymbolKind.KEYWORD)).isEmpty();
        assertThat(model.find("INT", SymbolKind.PREDEFINED)).isEmpty();
    }

    @Test
    void entities_listQualifiedDeclarationsOnce() {
        SemanticModel model = new SemanticModel();
        model.addDcl(dcl("x", ChillMode.INT, 2, "m"), ScopeContext.global().enterModule("m", 3));
        model.addMode(mode("t", 4));

        assertThat(model.entities(SymbolKind.DCL)).hasSize(1);
        assertThat(model.allNames(SymbolKind.DCL)).containsExactly("x");
        assertThat(model.entityCount()).isEqualTo(2);
    }

    @Test
    void addDcl_sameName_lastWriteWinsForBareKey() {
        SemanticModel model = new SemanticModel();
        model.addDcl(dcl("x", ChillMode.INT, 1, ScopeContext.GLOBAL), ScopeContext.global());
        model.addDcl(dcl("x", ChillMode.CHAR, 2, ScopeContext.GLOBAL), ScopeContext.global());

        assertThat(model.findDcl("x")).map(DclDefinition::line).contains(2);
        assertThat(model.entityCount()).isEqualTo(1);
    }
}
