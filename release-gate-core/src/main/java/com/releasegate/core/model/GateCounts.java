package com.releasegate.core.model;

import java.util.Collection;

/**
 * Number of files per gate decision.
 *
 * @param passed files with PASS
 * @param warned files with WARN
 * @param blocked files with BLOCK
 */
public record GateCounts(
    int passed,
    int warned,
    int blocked
) {
    /**
     * Counts gate decisions over file details.
     *
     * @param details per-file details
     * @return gate counts
     */
    public static GateCounts of(Collection<FileRiskDetail> details) {
        int passed = 0;
        int warned = 0;
        int blocked = 0;
        for (FileRiskDetail detail : details) {
            switch (detail.gateDecision()) {
                case PASS -> passed++;
                case WARN -> warned++;
                case BLOCK -> blocked++;
            }
        }
        return new GateCounts(passed, warned, blocked);
    }

    public int total() {
        return passed + warned + blocked;
    }
}
