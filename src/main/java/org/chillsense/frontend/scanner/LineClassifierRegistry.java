package org.chillsense.frontend.scanner;

import org.chillsense.frontend.scanner.features.dcl.DclHeaderClassifier;
import org.chillsense.frontend.scanner.features.mode.ModeHeaderClassifier;
import org.chillsense.frontend.scanner.features.module.ModuleHeaderClassifier;
import org.chillsense.frontend.scanner.features.proc.ProcHeaderClassifier;
import org.chillsense.frontend.scanner.features.proc.ProcessHeaderClassifier;
import org.chillsense.frontend.scanner.features.signal.SignalHeaderClassifier;
import org.chillsense.frontend.scanner.features.syn.SynHeaderClassifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered registry of line classifiers. Lookup returns the first classifier whose
 * predicate accepts the line, so registration order decides between overlapping prefixes.
 */
public final class LineClassifierRegistry {

    private final List<ILineClassifier> classifiers = new ArrayList<>();

    /**
     * Appends a classifier. It is consulted after all previously registered ones.
     * @param classifier The classifier.
     */
    public void register(ILineClassifier classifier) {
        classifiers.add(classifier);
    }

    /**
     * Finds the classifier responsible for a line.
     * @param normalized The trimmed, upper-cased line.
     * @return The first matching classifier, or empty if the line declares nothing.
     */
    public Optional<ILineClassifier> resolve(String normalized) {
        for (ILineClassifier classifier : classifiers) {
            if (classifier.matches(normalized)) {
                return Optional.of(classifier);
            }
        }
        return Optional.empty();
    }

    public List<ILineClassifier> classifiers() {
        return Collections.unmodifiableList(classifiers);
    }

    /**
     * Creates a registry with the built-in CHILL classifiers in scan order:
     * module, mode, declaration, synonym, procedure, process, signal.
     * @return A new registry instance.
     */
    public static LineClassifierRegistry initializeWithDefaults() {
        LineClassifierRegistry registry = new LineClassifierRegistry();
        registry.register(new ModuleHeaderClassifier());
        registry.register(new ModeHeaderClassifier());
        registry.register(new DclHeaderClassifier());
        registry.register(new SynHeaderClassifier());
        registry.register(new ProcHeaderClassifier());
        registry.register(new ProcessHeaderClassifier());
        registry.register(new SignalHeaderClassifier());
        return registry;
    }
}
