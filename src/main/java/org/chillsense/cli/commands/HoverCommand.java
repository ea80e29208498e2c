package org.chillsense.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.chillsense.cli.CommandLineInterface;
import org.chillsense.frontend.io.SourceLoader;
import org.chillsense.frontend.scanner.DeclarationScanner;
import org.chillsense.query.HoverProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the hover text an editor would show for a word in a file.
 */
@Command(
    name = "hover",
    description = "Describe a name as seen from a CHILL source file"
)
public class HoverCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HoverCommand.class);

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "CHILL source file to analyze"
    )
    private Path file;

    @Option(
        names = {"-w", "--word"},
        required = true,
        description = "Name to describe (case-insensitive)"
    )
    private String word;

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

        String content;
        try {
            content = SourceLoader.loadFile(file).content();
        } catch (IOException e) {
            log.error("Cannot read {}: {}", file, e.getMessage());
            err.println("Error: cannot read " + file);
            return 1;
        }

        String text = HoverProvider.hover(new DeclarationScanner().scan(content), word)
                .orElse("No information for '" + word + "'");
        out.println(text);
        out.flush();
        return 0;
    }
}
