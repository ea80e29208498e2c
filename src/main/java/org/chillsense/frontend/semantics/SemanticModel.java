package org.chillsense.frontend.semantics;

import org.chillsense.frontend.model.ChillEntity;
import org.chillsense.frontend.model.DclDefinition;
import org.chillsense.frontend.model.ModeDefinition;
import org.chillsense.frontend.model.ModuleDefinition;
import org.chillsense.frontend.model.ProcDefinition;
import org.chillsense.frontend.model.ProcessDefinition;
import org.chillsense.frontend.model.SignalDefinition;
import org.chillsense.frontend.model.SymbolKind;
import org.chillsense.frontend.model.SynDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The symbol table of one CHILL document: every entity the declaration scanner found,
 * keyed by upper-cased name per kind.
 *
 * <p>A model is filled by a single scan and then only read. Callers that re-parse a document
 * build a fresh model and replace the old one; a model is never cleared and refilled.</p>
 *
 * <p>Declarations are stored under their bare name and under {@code MODULE.NAME}, or
 * {@code GLOBAL.NAME} outside any module. The bare-name slot follows last-write-wins, so a
 * global declaration shadowed by a body-local one stays reachable through its qualified key.
 * Declarations inside a procedure or process body are also reachable as {@code BODY.NAME}.</p>
 */
public final class SemanticModel {

    private static final List<SymbolKind> LOOKUP_PRECEDENCE = List.of(
            SymbolKind.DCL, SymbolKind.MODE, SymbolKind.PROC, SymbolKind.PROCESS,
            SymbolKind.SYNONYM, SymbolKind.SIGNAL, SymbolKind.MODULE);

    private final Map<String, DclDefinition> dcls = new LinkedHashMap<>();
    private final Map<String, ModeDefinition> modes = new LinkedHashMap<>();
    private final Map<String, SynDefinition> synonyms = new LinkedHashMap<>();
    private final Map<String, ProcDefinition> procs = new LinkedHashMap<>();
    private final Map<String, ProcessDefinition> processes = new LinkedHashMap<>();
    private final Map<String, ModuleDefinition> modules = new LinkedHashMap<>();
    private final Map<String, SignalDefinition> signals = new LinkedHashMap<>();

    private String resolutionScope = ScopeContext.GLOBAL;

    // === Registration ===

    /**
     * Registers a declaration under its bare name and its scope-qualified names.
     * @param dcl   The declaration.
     * @param scope The scope context active at the declaration's line.
     */
    public void addDcl(DclDefinition dcl, ScopeContext scope) {
        String key = key(dcl.name());
        dcls.put(key, dcl);
        dcls.put(key(scope.scopeName()) + "." + key, dcl);
        scope.enclosingBody().ifPresent(body -> dcls.put(key(body) + "." + key, dcl));
    }

    public void addMode(ModeDefinition mode) {
        modes.put(key(mode.name()), mode);
    }

    public void addSynonym(SynDefinition syn) {
        synonyms.put(key(syn.name()), syn);
    }

    public void addProc(ProcDefinition proc) {
        procs.put(key(proc.name()), proc);
    }

    public void addProcess(ProcessDefinition process) {
        processes.put(key(process.name()), process);
    }

    public void addModule(ModuleDefinition module) {
        modules.put(key(module.name()), module);
    }

    public void addSignal(SignalDefinition signal) {
        signals.put(key(signal.name()), signal);
    }

    /**
     * Sets the scope used to qualify unqualified declaration lookups.
     * The scanner sets it to the scope still open at the end of the document.
     * @param scopeName A module name or {@link ScopeContext#GLOBAL}.
     */
    public void setResolutionScope(String scopeName) {
        this.resolutionScope = scopeName;
    }

    public String getResolutionScope() {
        return resolutionScope;
    }

    // === Lookup ===

    /**
     * Finds a declaration, trying the resolution-scope-qualified key before the bare name.
     * @param name A bare or qualified ({@code scope.name}) declaration name.
     * @return The declaration, or empty if not found.
     */
    public Optional<DclDefinition> findDcl(String name) {
        return findDcl(name, resolutionScope);
    }

    /**
     * Finds a declaration as seen from the given scope.
     * @param name      A bare or qualified declaration name.
     * @param scopeName The scope to try first.
     * @return The declaration, or empty if not found.
     */
    public Optional<DclDefinition> findDcl(String name, String scopeName) {
        DclDefinition scoped = dcls.get(key(scopeName) + "." + key(name));
        if (scoped != null) {
            return Optional.of(scoped);
        }
        return Optional.ofNullable(dcls.get(key(name)));
    }

    public Optional<ModeDefinition> findMode(String name) {
        return Optional.ofNullable(modes.get(key(name)));
    }

    public Optional<SynDefinition> findSynonym(String name) {
        return Optional.ofNullable(synonyms.get(key(name)));
    }

    public Optional<ProcDefinition> findProc(String name) {
        return Optional.ofNullable(procs.get(key(name)));
    }

    public Optional<ProcessDefinition> findProcess(String name) {
        return Optional.ofNullable(processes.get(key(name)));
    }

    public Optional<ModuleDefinition> findModule(String name) {
        return Optional.ofNullable(modules.get(key(name)));
    }

    public Optional<SignalDefinition> findSignal(String name) {
        return Optional.ofNullable(signals.get(key(name)));
    }

    /**
     * Kind-specific lookup.
     * @param name The name to look up.
     * @param kind The entity kind.
     * @return The entity, or empty. Keywords and predefined names are never in the model.
     */
    public Optional<ChillEntity> find(String name, SymbolKind kind) {
        return switch (kind) {
            case DCL -> findDcl(name).map(ChillEntity.class::cast);
            case MODE -> findMode(name).map(ChillEntity.class::cast);
            case SYNONYM -> findSynonym(name).map(ChillEntity.class::cast);
            case PROC -> findProc(name).map(ChillEntity.class::cast);
            case PROCESS -> findProcess(name).map(ChillEntity.class::cast);
            case MODULE -> findModule(name).map(ChillEntity.class::cast);
            case SIGNAL -> findSignal(name).map(ChillEntity.class::cast);
            case KEYWORD, PREDEFINED -> Optional.empty();
        };
    }

    /**
     * Kind-agnostic lookup with fixed precedence: declaration, mode, procedure, process,
     * synonym, signal, module.
     * @param name The name to look up.
     * @return The first entity found, or empty.
     */
    public Optional<ChillEntity> findAny(String name) {
        for (SymbolKind kind : LOOKUP_PRECEDENCE) {
            Optional<ChillEntity> entity = find(name, kind);
            if (entity.isPresent()) {
                return entity;
            }
        }
        return Optional.empty();
    }

    // === Enumeration ===

    /**
     * Names of all entities of one kind, in scan order. Declarations are listed once,
     * by their bare name.
     * @param kind The entity kind.
     * @return The names as written in the source.
     */
    public List<String> allNames(SymbolKind kind) {
        List<String> names = new ArrayList<>();
        for (ChillEntity entity : entities(kind)) {
            names.add(entity.name());
        }
        return names;
    }

    /**
     * Entities of one kind, in scan order. Scope-qualified duplicates of declarations are
     * left out.
     * @param kind The entity kind.
     * @return An unmodifiable collection.
     */
    public Collection<? extends ChillEntity> entities(SymbolKind kind) {
        return switch (kind) {
            case DCL -> bareDcls();
            case MODE -> Collections.unmodifiableCollection(modes.values());
            case SYNONYM -> Collections.unmodifiableCollection(synonyms.values());
            case PROC -> Collections.unmodifiableCollection(procs.values());
            case PROCESS -> Collections.unmodifiableCollection(processes.values());
            case MODULE -> Collections.unmodifiableCollection(modules.values());
            case SIGNAL -> Collections.unmodifiableCollection(signals.values());
            case KEYWORD, PREDEFINED -> List.of();
        };
    }

    /**
     * @return Every declaration key, bare and qualified, in insertion order.
     */
    public Set<String> dclKeys() {
        return Collections.unmodifiableSet(dcls.keySet());
    }

    /**
     * @return The number of distinct entities in the model.
     */
    public int entityCount() {
        Set<ChillEntity> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        distinct.addAll(dcls.values());
        return distinct.size() + modes.size() + synonyms.size() + procs.size()
                + processes.size() + modules.size() + signals.size();
    }

    private List<DclDefinition> bareDcls() {
        Set<DclDefinition> seen = new LinkedHashSet<>();
        for (Map.Entry<String, DclDefinition> entry : dcls.entrySet()) {
            if (entry.getKey().indexOf('.') < 0) {
                seen.add(entry.getValue());
            }
        }
        return List.copyOf(seen);
    }

    private static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
