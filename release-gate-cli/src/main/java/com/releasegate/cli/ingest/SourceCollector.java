package com.releasegate.cli.ingest;

import com.releasegate.core.model.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Loads source files from a repository into {@link FileRecord}s.
 *
 * <p>Walks the repository (or takes an explicit file list), skipping dependency, build and
 * IDE directories, files with unmapped extensions and files above the size limit. Content
 * is decoded as UTF-8 with malformed input replaced. Paths are reported relative to the
 * repository root with forward slashes, matching what git prints.
 */
public class SourceCollector {

    private static final Logger log = LoggerFactory.getLogger(SourceCollector.class);

    static final Set<String> IGNORE_DIRS = Set.of(
        "node_modules", "__pycache__", ".git", ".svn", "venv", "env",
        "build", "dist", "target", ".idea", ".vscode", "bin", "obj"
    );

    private final long maxFileSizeBytes;

    public SourceCollector(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    /**
     * Collects every supported file under the repository root, sorted by path.
     *
     * @param root repository root
     * @return loaded files
     * @throws IOException if the directory cannot be walked
     */
    public List<FileRecord> collect(Path root) throws IOException {
        List<Path> candidates;
        try (Stream<Path> paths = Files.walk(root)) {
            candidates = paths
                .filter(Files::isRegularFile)
                .filter(path -> !isIgnored(root.relativize(path)))
                .sorted()
                .toList();
        }
        return load(root, candidates);
    }

    /**
     * Collects an explicit list of files, resolved against the repository root.
     *
     * @param root repository root
     * @param files files to load; missing or unsupported files are skipped with a warning
     * @return loaded files in the given order
     * @throws IOException if a file cannot be read
     */
    public List<FileRecord> collect(Path root, List<Path> files) throws IOException {
        List<Path> candidates = new ArrayList<>();
        for (Path file : files) {
            Path resolved = file.isAbsolute() ? file : root.resolve(file);
            if (!Files.isRegularFile(resolved)) {
                log.warn("File not found, skipping: {}", file);
                continue;
            }
            candidates.add(resolved.normalize());
        }
        return load(root, candidates);
    }

    private List<FileRecord> load(Path root, List<Path> candidates) throws IOException {
        List<FileRecord> records = new ArrayList<>();
        for (Path file : candidates) {
            String language = LanguageDetector.detect(file);
            if (LanguageDetector.UNKNOWN.equals(language)) {
                log.debug("Unsupported extension, skipping: {}", file);
                continue;
            }
            long size = Files.size(file);
            if (size > maxFileSizeBytes) {
                log.warn("Skipping {}: {} bytes exceeds limit of {}", file, size, maxFileSizeBytes);
                continue;
            }
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            records.add(FileRecord.of(relativePath(root, file), language, content));
        }
        log.info("Collected {} source files from {}", records.size(), root);
        return records;
    }

    private static boolean isIgnored(Path relative) {
        for (Path part : relative) {
            if (IGNORE_DIRS.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }

    private static String relativePath(Path root, Path file) {
        Path absoluteRoot = root.toAbsolutePath().normalize();
        Path absoluteFile = file.toAbsolutePath().normalize();
        Path relative = absoluteFile.startsWith(absoluteRoot) ? absoluteRoot.relativize(absoluteFile) : absoluteFile;
        return relative.toString().replace('\\', '/');
    }
}
