package com.releasegate.core.language;

import com.releasegate.core.model.ComponentKind;
import com.releasegate.core.model.ComponentRecord;
import com.releasegate.core.model.FileRecord;
import com.releasegate.core.model.StructuralFacts;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal structural extraction for files whose language has no registered handler.
 *
 * <p>Scans for generic function-like shapes ({@code def name}, {@code function name},
 * {@code type name(...) {}) and reports at most {@value #MAX_COMPONENTS} of them.
 * Complexity is not estimated: the result carries no complexity sample.
 */
public final class FallbackExtractor {

    public static final int MAX_COMPONENTS = 10;

    private static final List<Pattern> FUNCTION_PATTERNS = List.of(
        Pattern.compile("\\bdef\\s+(\\w+)"),
        Pattern.compile("\\bfunction\\s+(\\w+)"),
        Pattern.compile("\\b\\w+\\s+(\\w+)\\s*\\([^)]*\\)\\s*\\{")
    );

    private static final Set<String> CONTROL_KEYWORDS = Set.of("if", "for", "while", "switch", "catch");

    /**
     * Extracts function-like components from an unsupported file.
     *
     * @param file file to scan
     * @return facts with capped components, no dependencies and complexity 0
     */
    public StructuralFacts extract(FileRecord file) {
        List<ComponentRecord> components = new ArrayList<>();
        for (Pattern pattern : FUNCTION_PATTERNS) {
            Matcher matcher = pattern.matcher(file.content());
            while (matcher.find() && components.size() < MAX_COMPONENTS) {
                String name = matcher.group(1);
                if (!CONTROL_KEYWORDS.contains(name)) {
                    components.add(ComponentRecord.of(name, ComponentKind.FUNCTION));
                }
            }
        }
        return new StructuralFacts(components, List.of(), 0);
    }
}
