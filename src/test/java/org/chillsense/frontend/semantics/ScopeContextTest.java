package org.chillsense.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ScopeContextTest {

    @Test
    void global_hasNoFrames() {
        ScopeContext global = ScopeContext.global();

        assertThat(global.scopeName()).isEqualTo(ScopeContext.GLOBAL);
        assertThat(global.isGlobal()).isTrue();
        assertThat(global.depth()).isZero();
        assertThat(global.enclosingBody()).isEmpty();
    }

    @Test
    void enterModule_leavesOriginalUnchanged() {
        ScopeContext global = ScopeContext.global();

        ScopeContext module = global.enterModule("m", 10);

        assertThat(module.scopeName()).isEqualTo("m");
        assertThat(module.isGlobal()).isFalse();
        assertThat(global.scopeName()).isEqualTo(ScopeContext.GLOBAL);
    }

    @Test
    void leaveExpired_keepsFrameUpToItsEndLine() {
        ScopeContext module = ScopeContext.global().enterModule("m", 10);

        assertThat(module.leaveExpired(10).scopeName()).isEqualTo("m");
        assertThat(module.leaveExpired(11).isGlobal()).isTrue();
    }

    @Test
    void enterBody_doesNotChangeModuleScope() {
        ScopeContext body = ScopeContext.global().enterModule("m", 10).enterBody("p", 5);

        assertThat(body.scopeName()).isEqualTo("m");
        assertThat(body.enclosingBody()).contains("p");
        assertThat(body.depth()).isEqualTo(2);
    }

    @Test
    void leaveExpired_dropsBodyButKeepsModule() {
        ScopeContext body = ScopeContext.global().enterModule("m", 10).enterBody("p", 5);

        ScopeContext after = body.leaveExpired(6);

        assertThat(after.scopeName()).isEqualTo("m");
        assertThat(after.enclosingBody()).isEmpty();
        assertThat(after.depth()).isEqualTo(1);
    }

    @Test
    void enterBody_atTopLevel_staysGlobal() {
        ScopeContext body = ScopeContext.global().enterBody("p", 5);

        assertThat(body.isGlobal()).isTrue();
        assertThat(body.scopeName()).isEqualTo(ScopeContext.GLOBAL);
        assertThat(body.enclosingBody()).contains("p");
    }
}
