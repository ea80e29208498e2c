package org.chillsense.frontend.scanner;

import org.chillsense.frontend.scanner.features.dcl.DclHeaderClassifier;
import org.chillsense.frontend.scanner.features.mode.ModeHeaderClassifier;
import org.chillsense.frontend.scanner.features.module.ModuleHeaderClassifier;
import org.chillsense.frontend.scanner.features.proc.ProcHeaderClassifier;
import org.chillsense.frontend.scanner.features.proc.ProcessHeaderClassifier;
import org.chillsense.frontend.scanner.features.signal.SignalHeaderClassifier;
import org.chillsense.frontend.scanner.features.syn.SynHeaderClassifier;
import org.chillsense.frontend.semantics.ScopeContext;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LineClassifierRegistryTest {

    private final LineClassifierRegistry registry = LineClassifierRegistry.initializeWithDefaults();

    @Test
    void initializeWithDefaults_registersInScanOrder() {
        assertThat(registry.classifiers()).extracting(Object::getClass).containsExactly(
                ModuleHeaderClassifier.class,
                ModeHeaderClassifier.class,
                DclHeaderClassifier.class,
                SynHeaderClassifier.class,
                ProcHeaderClassifier.class,
                ProcessHeaderClassifier.class,
                SignalHeaderClassifier.class);
    }

    @Test
    void resolve_synmodeIsNotASynonym() {
        assertThat(registry.resolve("SYNMODE X = INT;")).containsInstanceOf(ModeHeaderClassifier.class);
        assertThat(registry.resolve("SYN X = 1;")).containsInstanceOf(SynHeaderClassifier.class);
    }

    @Test
    void resolve_processIsNotAProcedure() {
        assertThat(registry.resolve("P: PROCESS;")).containsInstanceOf(ProcessHeaderClassifier.class);
        assertThat(registry.resolve("P: PROC (A INT);")).containsInstanceOf(ProcHeaderClassifier.class);
    }

    @Test
    void resolve_statement_isEmpty() {
        assertThat(registry.resolve("X := 1;")).isEmpty();
        assertThat(registry.resolve("DCLX := 1;")).isEmpty();
    }

    @Test
    void register_appendsAfterDefaults() {
        ILineClassifier custom = new ILineClassifier() {
            @Override
            public boolean matches(String normalized) {
                return normalized.startsWith("GRANT");
            }

            @Override
            public ScopeContext extract(SourceLine line, ScanContext context, ScopeContext scope) {
                return scope;
            }
        };

        registry.register(custom);

        assertThat(registry.classifiers()).hasSize(8).last().isSameAs(custom);
        assertThat(registry.resolve("GRANT X;")).containsSame(custom);
    }
}
