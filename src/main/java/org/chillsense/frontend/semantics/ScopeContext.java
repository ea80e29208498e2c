package org.chillsense.frontend.semantics;

import java.util.Optional;

/**
 * Immutable stack of lexical frames active at a given line during a scan.
 *
 * <p>Entering a module or a procedure/process body returns a new context with one more frame;
 * the previous context is unchanged. Frames carry the last line of their construct and are
 * dropped by {@link #leaveExpired(int)} once the scan moves past it.</p>
 *
 * <p>Only module frames qualify declaration names. Body frames are tracked so that a
 * declaration inside a procedure can additionally be looked up as {@code proc.name}.</p>
 */
public final class ScopeContext {

    /**
     * Name of the outermost scope, used when no module is active.
     */
    public static final String GLOBAL = "GLOBAL";

    private static final ScopeContext ROOT = new ScopeContext(null, GLOBAL, FrameKind.MODULE, Integer.MAX_VALUE);

    /**
     * What opened a frame.
     */
    public enum FrameKind {
        MODULE,
        BODY
    }

    private final ScopeContext parent;
    private final String name;
    private final FrameKind kind;
    private final int endLine;

    private ScopeContext(ScopeContext parent, String name, FrameKind kind, int endLine) {
        this.parent = parent;
        this.name = name;
        this.kind = kind;
        this.endLine = endLine;
    }

    /**
     * @return The context with only the global frame.
     */
    public static ScopeContext global() {
        return ROOT;
    }

    /**
     * Enters a module scope.
     * @param moduleName The module name.
     * @param endLine    The last line that belongs to the module.
     * @return A new context with the module frame on top.
     */
    public ScopeContext enterModule(String moduleName, int endLine) {
        return new ScopeContext(this, moduleName, FrameKind.MODULE, endLine);
    }

    /**
     * Enters a procedure or process body.
     * @param bodyName The procedure or process name.
     * @param endLine  The last line of the body.
     * @return A new context with the body frame on top.
     */
    public ScopeContext enterBody(String bodyName, int endLine) {
        return new ScopeContext(this, bodyName, FrameKind.BODY, endLine);
    }

    /**
     * Drops every frame on top of the stack whose construct ended before the given line.
     * @param line The 1-based line about to be scanned.
     * @return This context, or an enclosing one.
     */
    public ScopeContext leaveExpired(int line) {
        ScopeContext ctx = this;
        while (ctx.parent != null && ctx.endLine < line) {
            ctx = ctx.parent;
        }
        return ctx;
    }

    /**
     * @return The innermost module name, or {@link #GLOBAL}.
     */
    public String scopeName() {
        for (ScopeContext ctx = this; ctx != null; ctx = ctx.parent) {
            if (ctx.kind == FrameKind.MODULE) {
                return ctx.name;
            }
        }
        return GLOBAL;
    }

    /**
     * @return {@code true} if no module frame is active.
     */
    public boolean isGlobal() {
        return parentModuleFrame() == null;
    }

    /**
     * @return The innermost procedure or process name, if the current line lies in a body.
     */
    public Optional<String> enclosingBody() {
        for (ScopeContext ctx = this; ctx != null; ctx = ctx.parent) {
            if (ctx.kind == FrameKind.BODY) {
                return Optional.of(ctx.name);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The number of frames above the global frame.
     */
    public int depth() {
        int depth = 0;
        for (ScopeContext ctx = this; ctx.parent != null; ctx = ctx.parent) {
            depth++;
        }
        return depth;
    }

    private ScopeContext parentModuleFrame() {
        for (ScopeContext ctx = this; ctx.parent != null; ctx = ctx.parent) {
            if (ctx.kind == FrameKind.MODULE) {
                return ctx;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return parent == null ? name : parent + "/" + name;
    }
}
