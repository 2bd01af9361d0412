package com.releasegate.core.language.base;

import com.releasegate.core.language.LanguageHandler;
import com.releasegate.core.model.FileRecord;
import com.releasegate.core.model.StructuralFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Abstract base class for language handlers providing common functionality.
 *
 * <p>This class reduces code duplication across handler implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per handler class)</li>
 *   <li>The analyze() template: parse check, then components, dependencies and complexity</li>
 *   <li>Control-flow keyword filtering for call-like syntax</li>
 *   <li>De-duplication helpers for dependency lists</li>
 * </ul>
 *
 * <p>Concrete handlers implement the three extraction methods and, when the language
 * has a notion of "unparseable", override {@link #isParseable(String)}.
 *
 * @see LanguageHandler
 */
public abstract class AbstractLanguageHandler implements LanguageHandler {

    /**
     * Keywords that look like calls ({@code if (x) {}}) but must never be reported as components.
     */
    protected static final Set<String> CONTROL_KEYWORDS = Set.of(
        "if", "for", "while", "switch", "catch", "return", "else", "do", "sizeof", "try"
    );

    /**
     * Baseline complexity of any parsed file.
     */
    protected static final int BASE_COMPLEXITY = 1;

    /**
     * Logger instance for this handler.
     * Automatically initialized with the concrete handler class name.
     */
    protected final Logger log;

    protected AbstractLanguageHandler() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public StructuralFacts analyze(FileRecord file) {
        String content = file.content();
        if (!isParseable(content)) {
            log.warn("Unable to parse {} file {}: structural facts unavailable", file.language(), file.path());
            return StructuralFacts.unparsed();
        }
        return new StructuralFacts(
            extractComponents(content),
            extractDependencies(content),
            estimateComplexity(content)
        );
    }

    /**
     * Checks whether the content is syntactically well-formed enough to analyze.
     *
     * <p><b>Default Implementation:</b> Returns {@code true}: pattern-only handlers never fail.
     *
     * @param content source text
     * @return true if the content can be analyzed
     */
    protected boolean isParseable(String content) {
        return true;
    }

    /**
     * Estimates the cyclomatic complexity of a whole file.
     *
     * @param content source text
     * @return complexity, at least {@value #BASE_COMPLEXITY}
     */
    protected abstract double estimateComplexity(String content);

    /**
     * Checks if a name is a control-flow keyword masquerading as a call.
     *
     * @param name candidate component name
     * @return true if the name must be ignored
     */
    protected boolean isControlKeyword(String name) {
        return name == null || CONTROL_KEYWORDS.contains(name);
    }

    /**
     * Removes duplicates while keeping first-occurrence order.
     *
     * @param values values to de-duplicate
     * @return distinct values
     */
    protected List<String> distinct(Collection<String> values) {
        Set<String> unique = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                unique.add(value.trim());
            }
        }
        return new ArrayList<>(unique);
    }
}
