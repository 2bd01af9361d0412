package com.releasegate.core.language;

import com.releasegate.core.model.ComponentRecord;
import com.releasegate.core.model.FileRecord;
import com.releasegate.core.model.StructuralFacts;

import java.util.List;
import java.util.Set;

/**
 * Extracts structural facts from source files of one language family.
 *
 * <p>Handlers are discovered via Java Service Provider Interface (SPI) or registered
 * explicitly in a {@link LanguageRegistry}. Each handler turns file content into
 * {@link StructuralFacts}: components (functions, classes, ...), dependencies
 * (imports, includes) and a cyclomatic complexity estimate.
 *
 * <p>Implementations must be stateless: a single instance is shared across worker threads.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.releasegate.core.language.LanguageHandler}
 *
 * @see LanguageRegistry
 */
public interface LanguageHandler {

    /**
     * Returns unique identifier for this handler (kebab-case, e.g., "python").
     *
     * @return handler identifier
     */
    String getId();

    /**
     * Returns human-readable display name (e.g., "Python Handler").
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the language labels this handler is registered under.
     *
     * <p>Labels match the ones produced by ingestion: "Python", "Java", "JavaScript",
     * "TypeScript", "C", "C++", "C/C++", "Go".
     *
     * @return supported language labels
     */
    Set<String> getLanguages();

    /**
     * Analyzes a file.
     *
     * <p>Never throws for malformed content: a file that cannot be parsed yields
     * {@link StructuralFacts#unparsed()}.
     *
     * @param file file to analyze
     * @return structural facts
     */
    StructuralFacts analyze(FileRecord file);

    /**
     * Extracts components (functions, methods, classes, structs) from source text.
     *
     * @param content source text
     * @return components in source order
     */
    List<ComponentRecord> extractComponents(String content);

    /**
     * Extracts dependency identifiers (imports, includes, requires) from source text.
     *
     * @param content source text
     * @return de-duplicated dependencies in source order
     */
    List<String> extractDependencies(String content);
}
