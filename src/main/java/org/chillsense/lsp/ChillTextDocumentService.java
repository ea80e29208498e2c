package org.chillsense.lsp;

import org.chillsense.frontend.model.ChillEntity;
import org.chillsense.query.CompletionCandidate;
import org.chillsense.query.CompletionProvider;
import org.chillsense.query.DefinitionFinder;
import org.chillsense.query.DocumentSymbolEntry;
import org.chillsense.query.DocumentSymbolProvider;
import org.chillsense.query.HoverProvider;
import org.chillsense.query.ReferenceFinder;
import org.chillsense.query.TextSpan;
import org.chillsense.query.WordAtPosition;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.DocumentSymbolParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.ReferenceParams;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Document synchronization and the per-document queries.
 *
 * <p>Requests for documents that are not open, or positions without an identifier, get an empty
 * result. A failure inside a handler is logged and also answered with an empty result, so a
 * single bad request never breaks the connection.</p>
 */
public class ChillTextDocumentService implements TextDocumentService {

    private static final Logger log = LoggerFactory.getLogger(ChillTextDocumentService.class);

    private final DocumentStore documents;

    public ChillTextDocumentService(DocumentStore documents) {
        this.documents = documents;
    }

    // === Synchronization ===

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        documents.update(params.getTextDocument().getUri(), params.getTextDocument().getText());
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        List<TextDocumentContentChangeEvent> changes = params.getContentChanges();
        if (changes == null || changes.isEmpty()) {
            return;
        }
        // full sync: the last change carries the whole text
        documents.update(params.getTextDocument().getUri(), changes.get(changes.size() - 1).getText());
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        documents.remove(params.getTextDocument().getUri());
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
        // the model is already current after didChange
    }

    // === Queries ===

    @Override
    public CompletableFuture<Either<List<CompletionItem>, CompletionList>> completion(CompletionParams params) {
        return answer("completion", () -> {
            List<CompletionItem> items = new ArrayList<>();
            Optional<ParsedDocument> document = documents.get(params.getTextDocument().getUri());
            if (document.isPresent()) {
                Position position = params.getPosition();
                String lineText = document.get().lineText(position.getLine());
                List<CompletionCandidate> candidates =
                        CompletionProvider.complete(document.get().model(), lineText, position.getCharacter());
                for (int i = 0; i < candidates.size(); i++) {
                    items.add(toItem(candidates.get(i), i));
                }
            }
            return Either.forRight(new CompletionList(false, items));
        }, () -> Either.forRight(new CompletionList(false, List.of())));
    }

    @Override
    public CompletableFuture<Hover> hover(HoverParams params) {
        return answer("hover", () -> wordAt(params.getTextDocument().getUri(), params.getPosition())
                .flatMap(hit -> HoverProvider.hover(hit.document().model(), hit.word()))
                .map(text -> new Hover(new MarkupContent(MarkupKind.MARKDOWN, text)))
                .orElse(null), () -> null);
    }

    @Override
    public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>> definition(
            DefinitionParams params) {
        String uri = params.getTextDocument().getUri();
        return answer("definition", () -> {
            List<Location> locations = new ArrayList<>();
            wordAt(uri, params.getPosition()).ifPresent(hit -> {
                Optional<ChillEntity> entity = DefinitionFinder.findEntity(hit.document().model(), hit.word());
                entity.ifPresent(e -> {
                    int line = e.line() - 1;
                    int length = hit.document().lineText(line).length();
                    locations.add(new Location(uri, new Range(new Position(line, 0), new Position(line, length))));
                });
            });
            return Either.<List<? extends Location>, List<? extends LocationLink>>forLeft(locations);
        }, () -> Either.forLeft(List.of()));
    }

    @Override
    public CompletableFuture<List<? extends Location>> references(ReferenceParams params) {
        String uri = params.getTextDocument().getUri();
        return answer("references", () -> {
            List<Location> locations = new ArrayList<>();
            wordAt(uri, params.getPosition()).ifPresent(hit -> {
                for (TextSpan span : ReferenceFinder.find(hit.document().text(), hit.word())) {
                    locations.add(new Location(uri, range(span.line(), span.startColumn(), span.line(), span.endColumn())));
                }
            });
            return locations;
        }, List::of);
    }

    @Override
    public CompletableFuture<List<Either<SymbolInformation, DocumentSymbol>>> documentSymbol(
            DocumentSymbolParams params) {
        return answer("documentSymbol", () -> {
            List<Either<SymbolInformation, DocumentSymbol>> symbols = new ArrayList<>();
            documents.get(params.getTextDocument().getUri()).ifPresent(document -> {
                for (DocumentSymbolEntry entry : DocumentSymbolProvider.symbols(document.model(), document.text())) {
                    symbols.add(Either.forRight(toSymbol(entry, document)));
                }
            });
            return symbols;
        }, List::of);
    }

    // === Conversion ===

    private static CompletionItem toItem(CompletionCandidate candidate, int index) {
        CompletionItem item = new CompletionItem(candidate.label());
        item.setKind(ProtocolKinds.completionKind(candidate.kind()));
        item.setDetail(candidate.detail());
        item.setInsertText(candidate.label());
        item.setSortText(String.format("%04d", index));
        return item;
    }

    private static DocumentSymbol toSymbol(DocumentSymbolEntry entry, ParsedDocument document) {
        int start = entry.startLine() - 1;
        int end = entry.endLine() - 1;
        Range selection = range(start, entry.columnStart(), end, entry.columnEnd());
        // declarations select the name; the enclosing range still covers the whole line
        Range full = range(start, 0, end, Math.max(entry.columnEnd(), document.lineText(end).length()));
        return new DocumentSymbol(entry.name(), ProtocolKinds.symbolKind(entry.kind()), full, selection, entry.detail());
    }

    private static Range range(int startLine, int startChar, int endLine, int endChar) {
        return new Range(new Position(startLine, startChar), new Position(endLine, endChar));
    }

    private Optional<WordHit> wordAt(String uri, Position position) {
        return documents.get(uri).flatMap(document ->
                WordAtPosition.extract(document.text(), position.getLine(), position.getCharacter())
                        .map(word -> new WordHit(document, word)));
    }

    private static <T> CompletableFuture<T> answer(String request, Supplier<T> handler, Supplier<T> fallback) {
        try {
            return CompletableFuture.completedFuture(handler.get());
        } catch (RuntimeException e) {
            log.error("Failed to answer {} request", request, e);
            return CompletableFuture.completedFuture(fallback.get());
        }
    }

    private record WordHit(ParsedDocument document, String word) {}
}
