package com.releasegate.core.language;

import com.releasegate.core.model.ComponentKind;
import com.releasegate.core.model.ComponentRecord;
import com.releasegate.core.model.FileRecord;
import com.releasegate.core.model.StructuralFacts;

import java.util.List;

/**
 * Base class for language handler tests.
 *
 * <p>Provides helpers for building in-memory files and reading component names and kinds
 * out of structural facts.
 */
public abstract class LanguageHandlerTestBase {

    /**
     * Handler under test.
     *
     * @return handler
     */
    protected abstract LanguageHandler handler();

    /**
     * Language label used for test files.
     *
     * @return language label
     */
    protected abstract String language();

    protected FileRecord file(String path, String content) {
        return FileRecord.of(path, language(), content);
    }

    protected StructuralFacts analyze(String path, String content) {
        return handler().analyze(file(path, content));
    }

    protected static List<String> names(List<ComponentRecord> components) {
        return components.stream().map(ComponentRecord::name).toList();
    }

    protected static List<ComponentKind> kinds(List<ComponentRecord> components) {
        return components.stream().map(ComponentRecord::kind).toList();
    }
}
