package org.chillsense.lsp;

import org.eclipse.lsp4j.CompletionOptions;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * CHILL language server: full-text synchronization plus completion, hover, definition,
 * references and document symbols for each open document.
 */
public class ChillLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger log = LoggerFactory.getLogger(ChillLanguageServer.class);

    private final ServerSettings settings;
    private final DocumentStore documents;
    private final ChillTextDocumentService textDocumentService;
    private final ChillWorkspaceService workspaceService = new ChillWorkspaceService();
    private final CompletableFuture<Integer> exitCode = new CompletableFuture<>();

    private volatile LanguageClient client;
    private volatile boolean shutdownRequested;

    public ChillLanguageServer(ServerSettings settings) {
        this(settings, new DocumentStore());
    }

    public ChillLanguageServer(ServerSettings settings, DocumentStore documents) {
        this.settings = settings;
        this.documents = documents;
        this.textDocumentService = new ChillTextDocumentService(documents);
    }

    @Override
    public void connect(LanguageClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        ServerCapabilities capabilities = new ServerCapabilities();
        capabilities.setTextDocumentSync(TextDocumentSyncKind.Full);
        capabilities.setCompletionProvider(new CompletionOptions(false, settings.triggerCharacters()));
        capabilities.setHoverProvider(true);
        capabilities.setDefinitionProvider(true);
        capabilities.setReferencesProvider(true);
        capabilities.setDocumentSymbolProvider(true);

        log.info("Initializing {} {}", settings.name(), settings.version());
        return CompletableFuture.completedFuture(
                new InitializeResult(capabilities, new ServerInfo(settings.name(), settings.version())));
    }

    @Override
    public void initialized(InitializedParams params) {
        LanguageClient current = client;
        if (current != null) {
            current.logMessage(new MessageParams(MessageType.Info, settings.name() + " ready"));
        }
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        shutdownRequested = true;
        log.info("Shutdown requested, {} document(s) open", documents.size());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void exit() {
        int code = shutdownRequested ? 0 : 1;
        log.info("Exit with code {}", code);
        exitCode.complete(code);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return textDocumentService;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return workspaceService;
    }

    /**
     * Completes when the client sends {@code exit}: 0 after a proper shutdown, 1 otherwise.
     * @return The exit code future.
     */
    public CompletableFuture<Integer> exitCode() {
        return exitCode;
    }

    public DocumentStore documents() {
        return documents;
    }
}
