package com.releasegate.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of the change-detection collaborator. All counts default to 0.
 *
 * @param added number of added files
 * @param deleted number of deleted files
 * @param modified number of modified files
 * @param total total changed files
 * @param byType free-form breakdown by change type
 * @param fileChanges per-file changes, used for per-file change volume
 * @param commits number of commits inspected
 * @param note explanation when only partial information was available
 */
public record ChangeSignal(
    int added,
    int deleted,
    int modified,
    int total,
    Map<String, Integer> byType,
    List<FileChange> fileChanges,
    int commits,
    String note
) {
    private static final ChangeSignal NONE =
        new ChangeSignal(0, 0, 0, 0, Map.of(), List.of(), 0, null);

    public ChangeSignal {
        byType = byType == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byType));
        fileChanges = fileChanges == null ? List.of() : List.copyOf(fileChanges);
    }

    public static ChangeSignal none() {
        return NONE;
    }

    /**
     * Builds a signal from a list of file changes, deriving the counters.
     *
     * @param changes changed files
     * @param commits number of commits inspected
     * @return change signal
     */
    public static ChangeSignal fromChanges(List<FileChange> changes, int commits) {
        int added = 0;
        int deleted = 0;
        int modified = 0;
        for (FileChange change : changes) {
            switch (change.type()) {
                case ADDED -> added++;
                case DELETED -> deleted++;
                case MODIFIED -> modified++;
            }
        }
        Map<String, Integer> byType = Map.of("added", added, "modified", modified, "deleted", deleted);
        return new ChangeSignal(added, deleted, modified, changes.size(), byType, changes, commits, null);
    }
}
