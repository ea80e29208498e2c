package org.chillsense.frontend.scanner;

import org.chillsense.frontend.io.SourceLoader;
import org.chillsense.frontend.model.ChillEntity;
import org.chillsense.frontend.model.ChillMode;
import org.chillsense.frontend.model.DclDefinition;
import org.chillsense.frontend.model.ModeDefinition;
import org.chillsense.frontend.model.ModuleDefinition;
import org.chillsense.frontend.model.Parameter;
import org.chillsense.frontend.model.Parameter.Direction;
import org.chillsense.frontend.model.ProcDefinition;
import org.chillsense.frontend.model.ProcessDefinition;
import org.chillsense.frontend.model.SignalDefinition.SignalParameter;
import org.chillsense.frontend.model.SymbolKind;
import org.chillsense.frontend.model.SynDefinition;
import org.chillsense.frontend.semantics.ScopeContext;
import org.chillsense.frontend.semantics.SemanticModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DeclarationScannerTest {

    private DeclarationScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new DeclarationScanner();
    }

    private SemanticModel scanSample(String name) throws IOException {
        return scanner.scan(SourceLoader.loadClasspath("samples/" + name).content());
    }

    @Test
    void scan_exampleModule_recordsModuleExtent() throws IOException {
        SemanticModel model = scanSample("example.chl");

        ModuleDefinition module = model.findModule("example").orElseThrow();
        assertThat(module.line()).isEqualTo(1);
        assertThat(module.lineEnd()).isEqualTo(27);
        assertThat(module.spec()).isFalse();
        assertThat(model.getResolutionScope()).isEqualTo(ScopeContext.GLOBAL);
    }

    @Test
    void scan_exampleModes_decomposeSetRangeAndStruct() throws IOException {
        SemanticModel model = scanSample("example.chl");

        ModeDefinition counter = model.findMode("counter").orElseThrow();
        assertThat(counter.baseMode()).isEqualTo(ChillMode.RANGE);
        assertThat(counter.rangeLow()).isEqualTo(0L);
        assertThat(counter.rangeHigh()).isEqualTo(65535L);
        assertThat(counter.line()).isEqualTo(3);

        assertThat(model.findMode("status").orElseThrow().enumValues()).containsExactly("idle", "active", "error");

        ModeDefinition point = model.findMode("point").orElseThrow();
        assertThat(point.baseMode()).isEqualTo(ChillMode.STRUCT);
        assertThat(point.fields()).containsOnlyKeys("x", "y");
        assertThat(point.fields().get("x").mode()).isEqualTo(ChillMode.INT);
    }

    @Test
    void scan_exampleDeclarations_carryModeInitializerAndColumns() throws IOException {
        SemanticModel model = scanSample("example.chl");

        DclDefinition count = model.findDcl("count").orElseThrow();
        assertThat(count.mode()).isEqualTo(ChillMode.USER_DEFINED);
        assertThat(count.modeName()).isEqualTo("counter");
        assertThat(count.initialValue()).isEqualTo("0");
        assertThat(count.line()).isEqualTo(9);
        assertThat(count.columnStart()).isEqualTo(4);
        assertThat(count.columnEnd()).isEqualTo(9);
        assertThat(count.parentScope()).isEqualTo("example");

        assertThat(model.findDcl("position").orElseThrow().initialValue()).isNull();
    }

    @Test
    void scan_exampleSynonym_keepsValueText() throws IOException {
        SynDefinition syn = scanSample("example.chl").findSynonym("max_size").orElseThrow();

        assertThat(syn.value()).isEqualTo("100");
        assertThat(syn.mode()).isNull();
        assertThat(syn.line()).isEqualTo(7);
    }

    @Test
    void scan_exampleProcedure_readsSignatureAndEnd() throws IOException {
        ProcDefinition handler = scanSample("example.chl").findProc("handler").orElseThrow();

        assertThat(handler.parameters()).containsExactly(new Parameter("input", "INT", Direction.IN));
        assertThat(handler.returnsMode()).isEqualTo("INT");
        assertThat(handler.general()).isFalse();
        assertThat(handler.line()).isEqualTo(13);
        assertThat(handler.lineEnd()).isEqualTo(17);
        assertThat(handler.localDcls()).isEmpty();
    }

    @Test
    void scan_exampleProcessAndSignal() throws IOException {
        SemanticModel model = scanSample("example.chl");

        ProcessDefinition worker = model.findProcess("worker").orElseThrow();
        assertThat(worker.parameters()).containsExactly(new Parameter("id", "INT", Direction.IN));
        assertThat(worker.line()).isEqualTo(19);
        assertThat(worker.lineEnd()).isEqualTo(23);

        assertThat(model.findSignal("ready").orElseThrow().parameters())
                .containsExactly(new SignalParameter("code", "INT"));
    }

    @Test
    void scan_declarationInsideProcedure_reachableByBodyAndModule() throws IOException {
        SemanticModel model = scanSample("example.chl");

        assertThat(model.dclKeys()).contains("RESULT", "EXAMPLE.RESULT", "HANDLER.RESULT");
        assertThat(model.findDcl("handler.result").orElseThrow().parentScope()).isEqualTo("example");
    }

    @Test
    void scan_rangeModeOnThirdLine() {
        SemanticModel model = scanner.scan("\n\nNEWMODE counter = RANGE(0:65535);");

        ModeDefinition counter = model.findMode("counter").orElseThrow();
        assertThat(counter.line()).isEqualTo(3);
        assertThat(counter.rangeLow()).isZero();
        assertThat(counter.rangeHigh()).isEqualTo(65535L);
    }

    @Test
    void scan_rangeBoundOverflow_skipsLine() {
        SemanticModel model = scanner.scan("NEWMODE huge = RANGE(0:99999999999999999999);");

        assertThat(model.findMode("huge")).isEmpty();
    }

    @Test
    void scan_sameNameInTwoScopes_lastWriteWinsForBareName() {
        SemanticModel model = scanner.scan(String.join("\n",
                "MODULE p;",
                "DCL x INT;",
                "END p;",
                "DCL x BOOL;"));

        assertThat(model.findDcl("p.x")).map(DclDefinition::mode).contains(ChillMode.INT);
        assertThat(model.findDcl("x")).map(DclDefinition::mode).contains(ChillMode.BOOL);
        assertThat(model.findDcl("x").orElseThrow().parentScope()).isEqualTo(ScopeContext.GLOBAL);
        assertThat(model.dclKeys()).containsExactly("X", "P.X", "GLOBAL.X");
    }

    @Test
    void scan_globalShadowedInsideProcedure_bothReachable() {
        SemanticModel model = scanner.scan(String.join("\n",
                "DCL x BOOL;",
                "p: PROC();",
                "  DCL x INT;",
                "END p;"));

        assertThat(model.findDcl("p.x")).map(DclDefinition::line).contains(3);
        assertThat(model.findDcl("p.x")).map(DclDefinition::mode).contains(ChillMode.INT);
        assertThat(model.findDcl("x")).map(DclDefinition::line).contains(1);
        assertThat(model.findDcl("x")).map(DclDefinition::mode).contains(ChillMode.BOOL);
        assertThat(model.dclKeys()).containsExactly("X", "GLOBAL.X", "P.X");
    }

    @Test
    void scan_twice_producesEqualModels() throws IOException {
        String source = SourceLoader.loadClasspath("samples/example.chl").content();

        SemanticModel first = scanner.scan(source);
        SemanticModel second = scanner.scan(source);

        for (SymbolKind kind : SymbolKind.values()) {
            assertThat(List.<ChillEntity>copyOf(second.entities(kind)))
                    .containsExactlyElementsOf(List.<ChillEntity>copyOf(first.entities(kind)));
        }
        assertThat(second.dclKeys()).containsExactlyElementsOf(first.dclKeys());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "DCL ;\nNEWMODE = ;\nSYN x;\nMODULE;\n: PROC",
            "DCL a INT; DCL b INT;",
            "x := 1;\nIF x THEN y := 2; FI;",
            "(((\n)))\n;;;;",
            "DCL STATIC READ;"
    })
    void scan_arbitraryInput_neverThrowsAndStaysBounded(String source) {
        SemanticModel model = scanner.scan(source);

        assertThat(model.entityCount()).isLessThanOrEqualTo(source.split("\n", -1).length);
    }

    @Test
    void scan_malformedLines_recordNothing() {
        assertThat(scanner.scan("DCL ;\nNEWMODE = ;\nSYN x;\nMODULE;\n: PROC").entityCount()).isZero();
    }

    @Test
    void scan_malformedLine_doesNotStopScan() {
        SemanticModel model = scanner.scan("DCL ;\nDCL ok INT;");

        assertThat(model.findDcl("ok")).isPresent();
    }

    @Test
    void scan_declarationAttributes_becomeFlags() {
        DclDefinition buffer = scanner.scan("DCL buffer STATIC READ INT := 5;").findDcl("buffer").orElseThrow();

        assertThat(buffer.isStatic()).isTrue();
        assertThat(buffer.isRead()).isTrue();
        assertThat(buffer.isDynamic()).isFalse();
        assertThat(buffer.isLoc()).isFalse();
        assertThat(buffer.mode()).isEqualTo(ChillMode.INT);
        assertThat(buffer.modeName()).isNull();
        assertThat(buffer.initialValue()).isEqualTo("5");
    }

    @Test
    void scan_parameterizedBuiltinMode_hasNoModeName() {
        DclDefinition name = scanner.scan("DCL name CHARS(20);").findDcl("name").orElseThrow();

        assertThat(name.mode()).isEqualTo(ChillMode.CHARS);
        assertThat(name.modeName()).isNull();
    }

    @Test
    void scan_lowerCaseSource_matchesCaseInsensitively() {
        DclDefinition dcl = scanner.scan("dcl Counter int;").findDcl("COUNTER").orElseThrow();

        assertThat(dcl.name()).isEqualTo("Counter");
        assertThat(dcl.mode()).isEqualTo(ChillMode.INT);
    }

    @Test
    void scan_indentedDeclaration_columnsPointAtName() {
        DclDefinition dcl = scanner.scan("    DCL flag BOOL;").findDcl("flag").orElseThrow();

        assertThat(dcl.columnStart()).isEqualTo(8);
        assertThat(dcl.columnEnd()).isEqualTo(12);
    }

    @Test
    void scan_synonymWithMode() {
        SynDefinition syn = scanner.scan("SYN limit INT = 10;").findSynonym("limit").orElseThrow();

        assertThat(syn.mode()).isEqualTo("INT");
        assertThat(syn.value()).isEqualTo("10");
    }

    @Test
    void scan_synonymMode_isMarkedAsSynmode() {
        ModeDefinition alias = scanner.scan("SYNMODE alias = INT;").findMode("alias").orElseThrow();

        assertThat(alias.synonymMode()).isTrue();
        assertThat(alias.keyword()).isEqualTo("SYNMODE");
        assertThat(alias.baseMode()).isEqualTo(ChillMode.INT);
    }

    @Test
    void scan_specModule() {
        ModuleDefinition module = scanner.scan("SPEC MODULE iface;\nEND iface;").findModule("iface").orElseThrow();

        assertThat(module.spec()).isTrue();
        assertThat(module.lineEnd()).isEqualTo(2);
    }

    @Test
    void scan_labelledModule() {
        SemanticModel model = scanner.scan("sw: MODULE\nDCL x INT;\nEND sw;");

        assertThat(model.findModule("sw")).isPresent();
        assertThat(model.dclKeys()).contains("SW.X");
    }

    @Test
    void scan_unterminatedModule_staysOpen() {
        SemanticModel model = scanner.scan("MODULE open;\nDCL x INT;");

        assertThat(model.findModule("open").orElseThrow().lineEnd()).isEqualTo(1);
        assertThat(model.dclKeys()).contains("OPEN.X");
        assertThat(model.getResolutionScope()).isEqualTo("open");
    }

    @Test
    void scan_unterminatedProcedure_opensNoBody() {
        SemanticModel model = scanner.scan("p: PROC();\nDCL x INT;");

        assertThat(model.findProc("p").orElseThrow().lineEnd()).isEqualTo(1);
        assertThat(model.dclKeys()).containsExactly("X", "GLOBAL.X");
    }

    @Test
    void scan_processHeader_isNotAProcedure() {
        SemanticModel model = scanner.scan("w: PROCESS();\nEND w;");

        assertThat(model.findProc("w")).isEmpty();
        assertThat(model.findProcess("w")).isPresent();
    }

    @Test
    void scan_generalProcedure() {
        assertThat(scanner.scan("g: PROC(a INT) GENERAL;\nEND g;").findProc("g").orElseThrow().general()).isTrue();
    }

    @Test
    void scan_parameterDirections() {
        ProcDefinition io = scanner.scan("io: PROC(a INT, b OUT INT, c INOUT BOOL, d IN CHAR, single);\nEND io;")
                .findProc("io").orElseThrow();

        assertThat(io.parameters()).containsExactly(
                new Parameter("a", "INT", Direction.IN),
                new Parameter("b", "INT", Direction.OUT),
                new Parameter("c", "BOOL", Direction.INOUT),
                new Parameter("d", "CHAR", Direction.IN),
                new Parameter("single", "UNKNOWN", Direction.IN));
    }

    @Test
    void scan_nestedBeginEnd_findsOuterEnd() {
        ProcDefinition p = scanner.scan("p: PROC();\nBEGIN\nDCL x INT;\nEND;\nEND p;").findProc("p").orElseThrow();

        assertThat(p.lineEnd()).isEqualTo(5);
    }

    @Test
    void scan_commentedSample_ignoresCommentedDeclarations() throws IOException {
        SemanticModel model = scanSample("comments.chl");

        ModuleDefinition module = model.findModule("switching").orElseThrow();
        assertThat(module.line()).isEqualTo(4);
        assertThat(module.lineEnd()).isEqualTo(10);
        assertThat(model.findDcl("line_count").orElseThrow().line()).isEqualTo(6);
        assertThat(model.findDcl("hidden")).isEmpty();
        assertThat(model.findDcl("also_hidden")).isEmpty();
        assertThat(model.findDcl("commented_out")).isEmpty();
    }

    @Test
    void scan_declarationAfterBlockComment_keepsOriginalColumn() throws IOException {
        DclDefinition visible = scanSample("comments.chl").findDcl("visible").orElseThrow();

        assertThat(visible.line()).isEqualTo(7);
        assertThat(visible.columnStart()).isEqualTo(32);
        assertThat(visible.columnEnd()).isEqualTo(39);
        assertThat(visible.mode()).isEqualTo(ChillMode.BOOL);
    }

    @Test
    void scan_customRegistry_onlyUsesRegisteredClassifiers() {
        LineClassifierRegistry registry = new LineClassifierRegistry();
        registry.register(new org.chillsense.frontend.scanner.features.syn.SynHeaderClassifier());

        SemanticModel model = new DeclarationScanner(registry).scan("SYN a = 1;\nDCL b INT;");

        assertThat(model.findSynonym("a")).isPresent();
        assertThat(model.findDcl("b")).isEmpty();
    }
}
