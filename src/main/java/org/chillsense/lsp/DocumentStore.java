package org.chillsense.lsp;

import org.chillsense.frontend.scanner.DeclarationScanner;
import org.chillsense.frontend.semantics.SemanticModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open documents by URI.
 *
 * <p>Every update scans the new text into a fresh model before it is published with a single
 * {@code put}, so a reader sees either the old or the new document, never a partly built model.</p>
 */
public class DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);

    private final Map<String, ParsedDocument> documents = new ConcurrentHashMap<>();
    private final DeclarationScanner scanner;

    public DocumentStore() {
        this(new DeclarationScanner());
    }

    public DocumentStore(DeclarationScanner scanner) {
        this.scanner = scanner;
    }

    /**
     * Replaces the text of a document and rebuilds its model.
     * @param uri  The document URI.
     * @param text The complete new text.
     * @return The published document.
     */
    public ParsedDocument update(String uri, String text) {
        SemanticModel model = scanner.scan(text);
        ParsedDocument document = new ParsedDocument(text, model);
        documents.put(uri, document);
        log.debug("Parsed {}: {} entities", uri, model.entityCount());
        return document;
    }

    public Optional<ParsedDocument> get(String uri) {
        return Optional.ofNullable(documents.get(uri));
    }

    /**
     * Forgets a document. Unknown URIs are ignored.
     * @param uri The document URI.
     */
    public void remove(String uri) {
        if (documents.remove(uri) != null) {
            log.debug("Closed {}", uri);
        }
    }

    public int size() {
        return documents.size();
    }
}
