package org.chillsense.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.chillsense.cli.CommandLineInterface;
import org.chillsense.frontend.io.SourceLoader;
import org.chillsense.frontend.scanner.DeclarationScanner;
import org.chillsense.frontend.semantics.SemanticModel;
import org.chillsense.query.DocumentSymbolEntry;
import org.chillsense.query.DocumentSymbolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the outline of a CHILL source file, one entity per line.
 */
@Command(
    name = "symbols",
    description = "List the modules, modes, declarations, synonyms, procedures, processes and signals of a file"
)
public class SymbolsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SymbolsCommand.class);

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "CHILL source file to analyze"
    )
    private Path file;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        if (parent.loadConfig().isEmpty()) {
            return 1;
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        SourceLoader.LoadResult source;
        try {
            source = SourceLoader.loadFile(file);
        } catch (IOException e) {
            log.error("Cannot read {}: {}", file, e.getMessage());
            err.println("Error: cannot read " + file);
            return 1;
        }

        SemanticModel model = new DeclarationScanner().scan(source.content());
        List<DocumentSymbolEntry> entries = DocumentSymbolProvider.symbols(model, source.content());
        for (DocumentSymbolEntry entry : entries) {
            out.printf("%d-%d %s %s  %s%n",
                    entry.startLine(), entry.endLine(), entry.kind(), entry.name(), entry.detail());
        }
        out.flush();
        log.debug("Listed {} symbols of {}", entries.size(), source.logicalName());
        return 0;
    }
}
