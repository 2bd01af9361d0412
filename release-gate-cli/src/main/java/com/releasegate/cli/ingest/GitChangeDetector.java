package com.releasegate.cli.ingest;

import com.releasegate.core.model.ChangeSignal;
import com.releasegate.core.model.ChangeType;
import com.releasegate.core.model.FileChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Derives a {@link ChangeSignal} from recent git history.
 *
 * <p>Compares {@code HEAD~5..HEAD} (or the whole history when it is shorter) with
 * {@code git diff --name-status} and {@code git diff --numstat}, and counts commits with
 * {@code git log --oneline -10}. When the directory is not a git work tree or git is not
 * installed, returns a signal carrying only the number of scanned files.
 */
public class GitChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(GitChangeDetector.class);

    static final String EMPTY_TREE = "4b825dc642cb6eb9a060e54bf8d69288fbee4904";
    static final int HISTORY_DEPTH = 5;
    static final String FILE_COUNT_ONLY_NOTE = "Git not available - showing file count only";

    private static final long GIT_TIMEOUT_SECONDS = 5;

    private final String gitExecutable;

    public GitChangeDetector() {
        this("git");
    }

    GitChangeDetector(String gitExecutable) {
        this.gitExecutable = gitExecutable;
    }

    /**
     * Detects recent changes in a repository.
     *
     * @param repository repository root
     * @param scannedFiles number of files ingested, used when git is unavailable
     * @return change signal
     */
    public ChangeSignal detect(Path repository, int scannedFiles) {
        if (git(repository, "rev-parse", "--git-dir").isEmpty()) {
            log.info("Git history unavailable for {}; using file count only", repository);
            return fileCountOnly(scannedFiles);
        }

        String range = range(repository);
        Optional<String> nameStatus = git(repository, "diff", "--no-renames", "--name-status", range);
        if (nameStatus.isEmpty()) {
            return fileCountOnly(scannedFiles);
        }
        Map<String, int[]> lineCounts = parseNumstat(git(repository, "diff", "--no-renames", "--numstat", range).orElse(""));
        List<FileChange> changes = parseNameStatus(nameStatus.get(), lineCounts);

        int commits = (int) git(repository, "log", "--oneline", "-10").orElse("")
            .lines()
            .filter(line -> !line.isBlank())
            .count();

        log.info("Detected {} changed files over {} ({} commits)", changes.size(), range, commits);
        return ChangeSignal.fromChanges(changes, commits);
    }

    /**
     * Signal used when no history is available: total equals the number of scanned files.
     *
     * @param scannedFiles number of files ingested
     * @return change signal with an explanatory note
     */
    public static ChangeSignal fileCountOnly(int scannedFiles) {
        return new ChangeSignal(0, 0, 0, scannedFiles, Map.of("scanned", scannedFiles), List.of(), 0,
            FILE_COUNT_ONLY_NOTE);
    }

    private String range(Path repository) {
        int depth = git(repository, "rev-list", "--count", "HEAD")
            .map(String::trim)
            .map(GitChangeDetector::parseCount)
            .orElse(0);
        if (depth > HISTORY_DEPTH) {
            return "HEAD~" + HISTORY_DEPTH + "..HEAD";
        }
        if (depth > 1) {
            Optional<String> root = git(repository, "rev-list", "--max-parents=0", "HEAD")
                .flatMap(out -> out.lines().findFirst())
                .map(String::trim);
            if (root.isPresent()) {
                return root.get() + "..HEAD";
            }
        }
        return EMPTY_TREE + "..HEAD";
    }

    static List<FileChange> parseNameStatus(String output, Map<String, int[]> lineCounts) {
        List<FileChange> changes = new ArrayList<>();
        for (String line : output.split("\n")) {
            String[] parts = line.split("\t");
            if (parts.length < 2 || parts[0].isEmpty()) {
                continue;
            }
            String path = parts[parts.length - 1];
            ChangeType type = switch (parts[0].charAt(0)) {
                case 'A' -> ChangeType.ADDED;
                case 'D' -> ChangeType.DELETED;
                default -> ChangeType.MODIFIED;
            };
            int[] counts = lineCounts.getOrDefault(path, new int[2]);
            changes.add(new FileChange(path, type, counts[0], counts[1]));
        }
        return changes;
    }

    static Map<String, int[]> parseNumstat(String output) {
        Map<String, int[]> counts = new HashMap<>();
        for (String line : output.split("\n")) {
            String[] parts = line.split("\t");
            if (parts.length < 3) {
                continue;
            }
            // Binary files report "-" for both counts
            counts.put(parts[2], new int[] {parseCount(parts[0]), parseCount(parts[1])});
        }
        return counts;
    }

    private static int parseCount(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private Optional<String> git(Path repository, String... args) {
        List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.addAll(List.of(args));
        try {
            Process process = new ProcessBuilder(command)
                .directory(repository.toFile())
                .redirectErrorStream(false)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
            String output = readAll(process.getInputStream());
            if (!process.waitFor(GIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.debug("git {} timed out", String.join(" ", args));
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                log.debug("git {} exited with {}", String.join(" ", args), process.exitValue());
                return Optional.empty();
            }
            return Optional.of(output);
        } catch (IOException e) {
            log.debug("git {} failed: {}", String.join(" ", args), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while running git {}", String.join(" ", args));
            return Optional.empty();
        }
    }

    private static String readAll(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        in.transferTo(buffer);
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
