package com.releasegate.cli;

import com.releasegate.core.model.AnalysisResult;
import com.releasegate.core.model.GateCounts;
import com.releasegate.core.model.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Exit code mapping of {@link AnalyzeCommand}.
 */
class AnalyzeCommandTest {

    @Test
    void exitCode_cleanCompleteRun_isOk() {
        AnalysisResult result = result(true, new GateCounts(3, 0, 0), List.of());

        assertThat(AnalyzeCommand.exitCode(result, true)).isEqualTo(AnalyzeCommand.EXIT_OK);
    }

    @Test
    void exitCode_deadlineElapsedBeforeAnyFile_isAnalysisFailed() {
        // Given: every file timed out, so nothing was scored
        AnalysisResult result = result(false, new GateCounts(0, 0, 0), List.of("huge.slow"));

        // When / Then: an unscored run is never reported as success
        assertThat(AnalyzeCommand.exitCode(result, false)).isEqualTo(AnalyzeCommand.EXIT_ANALYSIS_FAILED);
        assertThat(AnalyzeCommand.exitCode(result, true)).isEqualTo(AnalyzeCommand.EXIT_ANALYSIS_FAILED);
    }

    @Test
    void exitCode_incompleteRunWithPassingFiles_isAnalysisFailed() {
        AnalysisResult result = result(false, new GateCounts(4, 0, 0), List.of("stuck.py"));

        assertThat(AnalyzeCommand.exitCode(result, false)).isEqualTo(AnalyzeCommand.EXIT_ANALYSIS_FAILED);
    }

    @Test
    void exitCode_skippedFileOnCompleteRun_failsOnlyWithFailOnWarn() {
        AnalysisResult result = result(true, new GateCounts(2, 0, 0), List.of("src/Main.java"));

        assertThat(AnalyzeCommand.exitCode(result, false)).isEqualTo(AnalyzeCommand.EXIT_OK);
        assertThat(AnalyzeCommand.exitCode(result, true)).isEqualTo(AnalyzeCommand.EXIT_GATE_FAILED);
    }

    @Test
    void exitCode_blockedFile_isGateFailed() {
        AnalysisResult result = result(true, new GateCounts(1, 0, 1), List.of());

        assertThat(AnalyzeCommand.exitCode(result, false)).isEqualTo(AnalyzeCommand.EXIT_GATE_FAILED);
    }

    private static AnalysisResult result(boolean complete, GateCounts counts, List<String> skipped) {
        return new AnalysisResult("/repo", "2024-05-01T10:15:30Z", complete,
            counts.passed() + counts.warned() + counts.blocked(), counts, null, null, 0, null, null,
            null, null, null, 0.0, RiskLevel.LOW, null, skipped, null);
    }
}
