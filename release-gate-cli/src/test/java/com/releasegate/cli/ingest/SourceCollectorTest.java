package com.releasegate.cli.ingest;

import com.releasegate.core.model.FileRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SourceCollector}.
 */
class SourceCollectorTest {

    @TempDir
    Path repo;

    @Test
    void collect_walksRepositorySkippingIgnoredDirectories() throws IOException {
        // Given
        write("src/app.py", "print(1)\n");
        write("src/util/helpers.js", "export const a = 1;\n");
        write("node_modules/react/index.js", "module.exports = {};\n");
        write("target/classes/Gen.java", "class Gen {}\n");
        write(".git/hooks/pre-commit.sh", "exit 0\n");
        write("docs/README.md", "# docs\n");

        // When
        List<FileRecord> records = new SourceCollector(1024 * 1024).collect(repo);

        // Then
        assertThat(records).extracting(FileRecord::path).containsExactly("src/app.py", "src/util/helpers.js");
        assertThat(records).extracting(FileRecord::language).containsExactly("Python", "JavaScript");
        assertThat(records.get(0).name()).isEqualTo("app.py");
        assertThat(records.get(0).content()).isEqualTo("print(1)\n");
    }

    @Test
    void collect_skipsFilesAboveSizeLimit() throws IOException {
        write("small.py", "x = 1\n");
        write("large.py", "x = 1\n".repeat(100));

        List<FileRecord> records = new SourceCollector(50).collect(repo);

        assertThat(records).extracting(FileRecord::path).containsExactly("small.py");
    }

    @Test
    void collect_explicitFiles_keepsGivenOrderAndSkipsMissing() throws IOException {
        write("b.go", "package b\n");
        write("a.rs", "fn main() {}\n");
        write("notes.txt", "todo\n");

        List<FileRecord> records = new SourceCollector(1024).collect(repo,
            List.of(Path.of("b.go"), Path.of("missing.py"), Path.of("notes.txt"), repo.resolve("a.rs")));

        assertThat(records).extracting(FileRecord::path).containsExactly("b.go", "a.rs");
        assertThat(records).extracting(FileRecord::language).containsExactly("Go", "Rust");
    }

    @Test
    void collect_emptyRepository_returnsNothing() throws IOException {
        assertThat(new SourceCollector(1024).collect(repo)).isEmpty();
    }

    private void write(String relative, String content) throws IOException {
        Path file = repo.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
