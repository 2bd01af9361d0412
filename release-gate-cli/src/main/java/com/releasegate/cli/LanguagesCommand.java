package com.releasegate.cli;

import com.releasegate.core.language.LanguageHandler;
import com.releasegate.core.language.LanguageRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Collection;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command to list the language handlers discovered via SPI.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * release-gate languages
 * }</pre>
 */
@Command(
    name = "languages",
    description = "List available language handlers",
    mixinStandardHelpOptions = true
)
public class LanguagesCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Language Handlers:");
        out.println();

        Collection<LanguageHandler> handlers = LanguageRegistry.discover().handlers();
        for (LanguageHandler handler : handlers) {
            out.printf("  • %s (ID: %s)%n", handler.getDisplayName(), handler.getId());
            out.printf("    Languages: %s%n", new TreeSet<>(handler.getLanguages()));
            out.println();
        }

        if (handlers.isEmpty()) {
            out.println("  No language handlers found.");
        }
        out.println("Other languages are analyzed with generic function detection.");
        out.flush();
        return 0;
    }
}
