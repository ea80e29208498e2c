package org.chillsense.frontend.scanner;

import org.chillsense.frontend.preprocessor.CommentStripper;
import org.chillsense.frontend.semantics.ScopeContext;
import org.chillsense.frontend.semantics.SemanticModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Builds a {@link SemanticModel} from CHILL source text in one pass over its lines.
 *
 * <p>Comments are blanked out first, keeping line and column positions. Each non-blank line
 * is handed to the first classifier in the registry that accepts it. Lines no classifier
 * accepts, including all statements, are ignored. Malformed declaration lines are skipped and logged at DEBUG,
 * so {@link #scan(String)} never fails on any input.</p>
 *
 * <p>A scanner holds no per-document state and can be shared between threads.</p>
 */
public final class DeclarationScanner {

    private static final Logger log = LoggerFactory.getLogger(DeclarationScanner.class);

    private final LineClassifierRegistry registry;

    public DeclarationScanner() {
        this(LineClassifierRegistry.initializeWithDefaults());
    }

    /**
     * @param registry The classifiers to consult, in order.
     */
    public DeclarationScanner(LineClassifierRegistry registry) {
        this.registry = registry;
    }

    /**
     * Scans a document.
     * @param source The raw document text.
     * @return A new, fully populated model.
     */
    public SemanticModel scan(String source) {
        List<String> lines = Arrays.asList(CommentStripper.mask(source).split("\n", -1));
        SemanticModel model = new SemanticModel();
        ScanContext context = new ScanContext(lines, model);

        ScopeContext scope = ScopeContext.global();
        for (int i = 0; i < lines.size(); i++) {
            SourceLine line = SourceLine.of(i + 1, lines.get(i));
            scope = scope.leaveExpired(line.number());
            if (line.isBlank()) {
                continue;
            }
            Optional<ILineClassifier> classifier = registry.resolve(line.normalized());
            if (classifier.isEmpty()) {
                continue;
            }
            try {
                scope = classifier.get().extract(line, context, scope);
            } catch (MalformedLineException e) {
                log.debug("Skipping line {}: {}", e.getLine(), e.getMessage());
            }
        }

        String resolution = scope.leaveExpired(lines.size() + 1).scopeName();
        model.setResolutionScope(resolution);
        log.debug("Scanned {} lines, {} entities, resolution scope {}", lines.size(), model.entityCount(), resolution);
        return model;
    }
}
