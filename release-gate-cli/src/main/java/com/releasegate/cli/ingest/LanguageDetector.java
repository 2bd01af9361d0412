package com.releasegate.cli.ingest;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps file extensions to language labels.
 *
 * <p>Labels match the ones the language handlers register under; extensions without a
 * handler (Rust, Ruby, ...) still get a label so they are reported and analyzed by the
 * fallback extractor.
 */
public final class LanguageDetector {

    public static final String UNKNOWN = "Unknown";

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
        Map.entry("py", "Python"),
        Map.entry("java", "Java"),
        Map.entry("js", "JavaScript"),
        Map.entry("jsx", "JavaScript"),
        Map.entry("mjs", "JavaScript"),
        Map.entry("cjs", "JavaScript"),
        Map.entry("ts", "TypeScript"),
        Map.entry("tsx", "TypeScript"),
        Map.entry("c", "C"),
        Map.entry("cpp", "C++"),
        Map.entry("cc", "C++"),
        Map.entry("cxx", "C++"),
        Map.entry("h", "C/C++"),
        Map.entry("hpp", "C++"),
        Map.entry("go", "Go"),
        Map.entry("rs", "Rust"),
        Map.entry("rb", "Ruby"),
        Map.entry("php", "PHP"),
        Map.entry("sh", "Shell")
    );

    private LanguageDetector() {
        // Utility class
    }

    /**
     * Detects the language label of a file.
     *
     * @param file file path
     * @return language label, {@value #UNKNOWN} for unmapped extensions
     */
    public static String detect(Path file) {
        return LANGUAGES.getOrDefault(extension(file), UNKNOWN);
    }

    /**
     * Returns the extensions that map to a language label.
     *
     * @return lower-case extensions without the dot
     */
    public static Set<String> extensions() {
        return LANGUAGES.keySet();
    }

    static String extension(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String fileName = name.toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
