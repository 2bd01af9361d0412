package com.releasegate.core.model;

/**
 * Changed line counts for a single file.
 *
 * @param added lines added
 * @param deleted lines deleted
 * @param modified lines modified (counted by tools that report it separately)
 * @param total total changed lines
 */
public record FileChangeStats(
    int added,
    int deleted,
    int modified,
    int total
) {
    private static final FileChangeStats NONE = new FileChangeStats(0, 0, 0, 0);

    public static FileChangeStats none() {
        return NONE;
    }

    public static FileChangeStats of(int added, int deleted) {
        return new FileChangeStats(added, deleted, 0, added + deleted);
    }
}
