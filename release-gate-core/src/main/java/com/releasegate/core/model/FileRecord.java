package com.releasegate.core.model;

import java.util.Objects;

/**
 * A single source file handed over by the ingestion step.
 *
 * <p>Content is already decoded; the pipeline never touches the file system.
 *
 * @param path path of the file as reported by ingestion (used for provenance and signal matching)
 * @param name file name without directories
 * @param language language label (e.g., "Python", "Java", "C++"); "Unknown" when not detected
 * @param content decoded file content
 * @param lineCount number of lines in the content
 */
public record FileRecord(
    String path,
    String name,
    String language,
    String content,
    int lineCount
) {
    /**
     * Compact constructor with validation.
     */
    public FileRecord {
        Objects.requireNonNull(path, "path must not be null");
        if (name == null || name.isBlank()) {
            int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
            name = path.substring(slash + 1);
        }
        if (language == null || language.isBlank()) {
            language = "Unknown";
        }
        if (content == null) {
            content = "";
        }
        if (lineCount < 0) {
            lineCount = 0;
        }
    }

    /**
     * Creates a file record, counting lines from the content.
     *
     * @param path file path
     * @param language language label
     * @param content file content
     * @return file record
     */
    public static FileRecord of(String path, String language, String content) {
        String text = content != null ? content : "";
        return new FileRecord(path, null, language, text, text.split("\n", -1).length);
    }
}
