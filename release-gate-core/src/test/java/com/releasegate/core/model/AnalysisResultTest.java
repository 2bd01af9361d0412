package com.releasegate.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisResultTest {

    @Test
    void overallGate_allFilesPassed_isPass() {
        assertThat(result(true, new GateCounts(2, 0, 0), List.of()).overallGate()).isEqualTo(GateDecision.PASS);
    }

    @Test
    void overallGate_incompleteWithNothingScored_isWarn() {
        // Given: the deadline elapsed before any file finished
        AnalysisResult result = result(false, new GateCounts(0, 0, 0), List.of("huge.slow"));

        // Then
        assertThat(result.overallGate()).isEqualTo(GateDecision.WARN);
    }

    @Test
    void overallGate_skippedFileOnCompleteRun_isWarn() {
        assertThat(result(true, new GateCounts(1, 0, 0), List.of("src/Main.java")).overallGate())
            .isEqualTo(GateDecision.WARN);
    }

    @Test
    void overallGate_blockedFile_winsOverIncompleteRun() {
        assertThat(result(false, new GateCounts(0, 0, 1), List.of("huge.slow")).overallGate())
            .isEqualTo(GateDecision.BLOCK);
    }

    static AnalysisResult result(boolean complete, GateCounts counts, List<String> skipped) {
        return new AnalysisResult("/repo", "2024-05-01T10:15:30Z", complete,
            counts.passed() + counts.warned() + counts.blocked(), counts, null, null, 0, null, null,
            null, null, null, 0.0, RiskLevel.LOW, null, skipped, null);
    }
}
