package com.releasegate.cli;

import com.releasegate.cli.ingest.GitChangeDetector;
import com.releasegate.cli.ingest.SecurityReportReader;
import com.releasegate.cli.ingest.SourceCollector;
import com.releasegate.cli.report.ReportWriter;
import com.releasegate.core.config.ConfigLoader;
import com.releasegate.core.config.ReleaseGateConfig;
import com.releasegate.core.language.LanguageRegistry;
import com.releasegate.core.model.AnalysisResult;
import com.releasegate.core.model.ChangeSignal;
import com.releasegate.core.model.FileRecord;
import com.releasegate.core.model.GateDecision;
import com.releasegate.core.model.SecuritySignal;
import com.releasegate.core.pipeline.AnalysisException;
import com.releasegate.core.pipeline.AnalysisPipeline;
import com.releasegate.core.pipeline.AnalysisRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to analyze a repository and evaluate the release gate.
 *
 * <p>Orchestrates ingestion and the analysis pipeline:
 * <ol>
 *   <li>Load {@code releasegate.yaml}</li>
 *   <li>Collect source files (directory walk or {@code --files})</li>
 *   <li>Read the security report and detect recent git changes</li>
 *   <li>Run the analysis pipeline</li>
 *   <li>Print or write the report</li>
 * </ol>
 *
 * <p><b>Exit codes:</b> 0 gate passed, 2 gate failed (any BLOCK, or any WARN with
 * {@code --fail-on-warn}), 3 analysis failed, 1 usage or I/O error.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Analyze current directory
 * release-gate analyze
 *
 * # Analyze with a security report, JSON to a file
 * release-gate analyze ./service --security-report scan.json --format json -o report.json
 *
 * # Only some files, fail on warnings
 * release-gate analyze --files src/app.py,src/db.py --fail-on-warn
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze source files and evaluate the release gate",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = AnalyzeCommand.EXIT_ERROR
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_GATE_FAILED = 2;
    public static final int EXIT_ANALYSIS_FAILED = 3;

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Repository directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: releasegate.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--files"},
        split = ",",
        description = "Analyze only these files (comma-separated, relative to the repository)"
    )
    private List<Path> files;

    @Option(
        names = {"--security-report"},
        description = "Security scanner report (JSON)"
    )
    private Path securityReport;

    @Option(
        names = {"--format"},
        description = "Output format: text or json (overrides config)"
    )
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Output file (overrides config, default: standard output)"
    )
    private Path outputFile;

    @Option(
        names = {"--timeout"},
        description = "Deadline for per-file analysis in seconds (overrides config)"
    )
    private Integer timeoutSeconds;

    @Option(
        names = {"--fail-on-warn"},
        description = "Fail the gate when any file is WARN"
    )
    private boolean failOnWarn;

    @Option(
        names = {"--no-git"},
        description = "Skip git change detection"
    )
    private boolean noGit;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        Path root = projectPath.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            err.println("✗ Not a directory: " + root);
            return EXIT_ERROR;
        }

        try {
            log.info("Starting analysis of: {}", root);
            ReleaseGateConfig config = loadConfiguration(root);
            ReportWriter.Format outputFormat = ReportWriter.Format.parse(
                format != null ? format : config.effectiveOutputFormat());

            SourceCollector collector = new SourceCollector(config.effectiveMaxFileSizeBytes());
            List<FileRecord> records = files != null && !files.isEmpty()
                ? collector.collect(root, files)
                : collector.collect(root);

            SecuritySignal security = SecurityReportReader.read(securityReport);
            ChangeSignal changes = noGit
                ? GitChangeDetector.fileCountOnly(records.size())
                : new GitChangeDetector().detect(root, records.size());

            int timeout = timeoutSeconds != null && timeoutSeconds > 0
                ? timeoutSeconds
                : config.effectiveTimeoutSeconds();

            AnalysisPipeline pipeline = AnalysisPipeline.fromConfig(config, LanguageRegistry.discover());
            AnalysisResult result = pipeline.run(new AnalysisRequest(
                root.toString(), records, security, changes, Duration.ofSeconds(timeout)));

            writeReport(result, outputFormat, resolveOutput(config));
            if (!result.complete()) {
                err.println("Analysis incomplete: deadline of " + timeout + "s elapsed, "
                    + result.skippedFiles().size() + " file(s) not analyzed: "
                    + String.join(", ", result.skippedFiles()));
                err.flush();
            }
            return exitCode(result, failOnWarn);

        } catch (AnalysisException e) {
            log.error("Analysis failed at {}", e.getStage(), e);
            err.println("Analysis failed at " + e.getStage() + ": " + e.getMessage());
            return EXIT_ANALYSIS_FAILED;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Analyze failed", e);
            err.println("✗ Analyze failed: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private ReleaseGateConfig loadConfiguration(Path root) {
        Path absoluteConfigPath = configPath.isAbsolute() ? configPath : root.resolve(configPath);
        log.debug("Loading configuration from: {}", absoluteConfigPath);
        return ConfigLoader.load(absoluteConfigPath);
    }

    private Path resolveOutput(ReleaseGateConfig config) {
        if (outputFile != null) {
            return outputFile;
        }
        if (config.output() != null && config.output().file() != null && !config.output().file().isBlank()) {
            return Paths.get(config.output().file());
        }
        return null;
    }

    private void writeReport(AnalysisResult result, ReportWriter.Format outputFormat, Path target) throws IOException {
        ReportWriter writer = new ReportWriter();
        if (target == null) {
            writer.write(result, outputFormat, spec.commandLine().getOut());
            return;
        }
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer fileWriter = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             PrintWriter out = new PrintWriter(fileWriter)) {
            writer.write(result, outputFormat, out);
        }
        spec.commandLine().getOut().println("✓ Report written to: " + target.toAbsolutePath());
        spec.commandLine().getOut().println("Overall gate: " + result.overallGate());
        spec.commandLine().getOut().flush();
    }

    /**
     * Maps a result to the process exit code. A run cut short by the deadline never
     * reports success, whatever the gate of the files that did finish.
     */
    static int exitCode(AnalysisResult result, boolean failOnWarn) {
        if (!result.complete()) {
            return EXIT_ANALYSIS_FAILED;
        }
        GateDecision gate = result.overallGate();
        if (gate == GateDecision.BLOCK || (failOnWarn && gate == GateDecision.WARN)) {
            return EXIT_GATE_FAILED;
        }
        return EXIT_OK;
    }
}
