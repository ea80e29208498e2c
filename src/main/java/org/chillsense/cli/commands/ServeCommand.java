package org.chillsense.cli.commands;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.chillsense.cli.CommandLineInterface;
import org.chillsense.lsp.ChillLanguageServer;
import org.chillsense.lsp.ServerSettings;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.services.LanguageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

/**
 * Runs the language server over stdin/stdout until the client sends {@code exit}
 * or closes the stream.
 */
@Command(
    name = "serve",
    description = "Run the CHILL language server on stdin/stdout"
)
public class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() {
        Optional<Config> config = parent.loadConfig();
        if (config.isEmpty()) {
            return 1;
        }
        ServerSettings settings;
        try {
            settings = ServerSettings.fromConfig(config.get());
        } catch (ConfigException e) {
            log.error("Invalid server configuration: {}", e.getMessage());
            return 1;
        }
        return serve(new ChillLanguageServer(settings), System.in, System.out);
    }

    /**
     * Connects the server to the given streams and blocks until the session ends.
     *
     * @param server The server instance.
     * @param in     The stream carrying client messages.
     * @param out    The stream for server messages.
     * @return 0 after {@code shutdown} followed by {@code exit}, 1 otherwise.
     */
    static int serve(ChillLanguageServer server, InputStream in, OutputStream out) {
        Launcher<LanguageClient> launcher = LSPLauncher.createServerLauncher(server, in, out);
        server.connect(launcher.getRemoteProxy());
        Future<Void> listening = launcher.startListening();
        server.exitCode().thenRun(() -> listening.cancel(true));

        log.info("Language server listening on stdio");
        try {
            listening.get();
        } catch (CancellationException e) {
            log.debug("Message loop stopped after exit notification");
        } catch (ExecutionException e) {
            log.error("Language server connection failed", e.getCause());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while serving");
            return 1;
        }
        return server.exitCode().getNow(1);
    }
}
