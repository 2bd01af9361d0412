package com.releasegate;

import ch.qos.logback.classic.Level;
import com.releasegate.cli.AnalyzeCommand;
import com.releasegate.cli.LanguagesCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Main CLI entry point for release-gate.
 *
 * <p>release-gate analyzes source files in several languages and combines structural,
 * security and change signals into a per-file PASS/WARN/BLOCK gate and a repository
 * risk score.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze a repository and evaluate the release gate</li>
 *   <li>{@code languages} - List available language handlers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Analyze current directory
 * release-gate analyze
 *
 * # Analyze with verbose logging
 * release-gate -v analyze ./service
 * }</pre>
 */
@Command(
    name = "release-gate",
    mixinStandardHelpOptions = true,
    version = "release-gate " + ReleaseGateCLI.VERSION,
    description = "Multi-language static analysis and release risk gate",
    exitCodeOnInvalidInput = AnalyzeCommand.EXIT_ERROR,
    subcommands = {
        AnalyzeCommand.class,
        LanguagesCommand.class
    }
)
public class ReleaseGateCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ReleaseGateCLI.class);

    static final String VERSION = "1.0.0-SNAPSHOT";

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println("release-gate " + VERSION);
        out.println();
        spec.commandLine().usage(out);
        out.flush();
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Creates the command line with logging configured from the global options before any
     * subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ReleaseGateCLI cli = new ReleaseGateCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
