package com.releasegate.cli.ingest;

import com.releasegate.core.model.ChangeSignal;
import com.releasegate.core.model.ChangeType;
import com.releasegate.core.model.FileChange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GitChangeDetector}.
 */
class GitChangeDetectorTest {

    @TempDir
    Path repo;

    @Test
    void parseNameStatus_mapsStatusLettersAndLineCounts() {
        String nameStatus = "A\tsrc/new.py\nM\tsrc/app.py\nD\told/legacy.js\nT\tscripts/run.sh\n\n";
        Map<String, int[]> numstat = GitChangeDetector.parseNumstat(
            "12\t0\tsrc/new.py\n3\t4\tsrc/app.py\n0\t40\told/legacy.js\n-\t-\tscripts/run.sh\n");

        List<FileChange> changes = GitChangeDetector.parseNameStatus(nameStatus, numstat);

        assertThat(changes).containsExactly(
            new FileChange("src/new.py", ChangeType.ADDED, 12, 0),
            new FileChange("src/app.py", ChangeType.MODIFIED, 3, 4),
            new FileChange("old/legacy.js", ChangeType.DELETED, 0, 40),
            new FileChange("scripts/run.sh", ChangeType.MODIFIED, 0, 0));
    }

    @Test
    void parseNameStatus_fileWithoutNumstat_hasZeroLines() {
        List<FileChange> changes = GitChangeDetector.parseNameStatus("M\tREADME.py\n", Map.of());

        assertThat(changes).containsExactly(new FileChange("README.py", ChangeType.MODIFIED, 0, 0));
    }

    @Test
    void parseNameStatus_emptyOutput_hasNoChanges() {
        assertThat(GitChangeDetector.parseNameStatus("", Map.of())).isEmpty();
    }

    @Test
    void fileCountOnly_reportsScannedFilesAsTotal() {
        ChangeSignal signal = GitChangeDetector.fileCountOnly(7);

        assertThat(signal.total()).isEqualTo(7);
        assertThat(signal.byType()).containsExactly(Map.entry("scanned", 7));
        assertThat(signal.fileChanges()).isEmpty();
        assertThat(signal.note()).isEqualTo(GitChangeDetector.FILE_COUNT_ONLY_NOTE);
    }

    @Test
    void detect_gitNotInstalled_fallsBackToFileCount() {
        GitChangeDetector detector = new GitChangeDetector("git-executable-that-does-not-exist");

        ChangeSignal signal = detector.detect(repo, 3);

        assertThat(signal).isEqualTo(GitChangeDetector.fileCountOnly(3));
    }
}
