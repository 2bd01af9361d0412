package com.releasegate.core.language.impl.cpp;

import com.releasegate.core.language.base.AbstractRegexLanguageHandler;
import com.releasegate.core.language.base.SourceSanitizer;
import com.releasegate.core.model.ComponentKind;
import com.releasegate.core.model.ComponentRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handler for C and C++ source and header files.
 *
 * <p>Functions are recognized by the {@code name(...) {} shape with an optional return
 * type or qualifier, classes and structs by their declaration followed by a body or base
 * clause (forward declarations and template parameters are ignored). Dependencies are
 * {@code #include <...>} and {@code #include "..."} targets.
 *
 * <p><b>Complexity:</b> 1 + one per if/for/while/switch/catch + one per ternary operator.
 */
public class CppLanguageHandler extends AbstractRegexLanguageHandler {

    private static final String HANDLER_ID = "cpp";

    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
        "(?:[\\w:<>*&~]+\\s+)?([~\\w:]+)\\s*\\([^()]*\\)\\s*(?:const\\s*)?(?:noexcept\\s*)?(?:override\\s*)?\\{");

    private static final Pattern CLASS_PATTERN =
        Pattern.compile("\\bclass\\s+(\\w+)\\s*(?:final\\s*)?[:{]");

    private static final Pattern STRUCT_PATTERN =
        Pattern.compile("\\bstruct\\s+(\\w+)\\s*(?:final\\s*)?[:{]");

    // Run on code with only comments blanked: quoted include targets are string literals
    private static final Pattern INCLUDE_PATTERN =
        Pattern.compile("#\\s*include\\s*[<\"]([^>\"\\n]+)[>\"]");

    private static final SourceSanitizer.Syntax COMMENTS_ONLY =
        new SourceSanitizer.Syntax("//", true, "", "", false);

    private static final List<Pattern> DECISION_POINTS = List.of(
        Pattern.compile("\\bif\\s*(?:constexpr\\s*)?\\("),
        Pattern.compile("\\bfor\\s*\\("),
        Pattern.compile("\\bwhile\\s*\\("),
        Pattern.compile("\\bswitch\\s*\\("),
        Pattern.compile("\\bcatch\\s*\\("),
        Pattern.compile("\\?")
    );

    @Override
    public String getId() {
        return HANDLER_ID;
    }

    @Override
    public String getDisplayName() {
        return "C/C++ Handler";
    }

    @Override
    public Set<String> getLanguages() {
        return Set.of("C", "C++", "C/C++");
    }

    @Override
    protected SourceSanitizer.Syntax syntax() {
        return SourceSanitizer.C_LIKE;
    }

    @Override
    public List<ComponentRecord> extractComponents(String content) {
        String code = code(content);
        List<Located> found = new ArrayList<>();
        collect(FUNCTION_PATTERN, code, ComponentKind.FUNCTION, found);
        collect(CLASS_PATTERN, code, ComponentKind.CLASS, found);
        collect(STRUCT_PATTERN, code, ComponentKind.STRUCT, found);
        return inSourceOrder(found);
    }

    @Override
    public List<String> extractDependencies(String content) {
        String text = SourceSanitizer.sanitize(content, COMMENTS_ONLY).code();
        List<String> includes = new ArrayList<>();
        Matcher matcher = INCLUDE_PATTERN.matcher(text);
        while (matcher.find()) {
            includes.add(matcher.group(1));
        }
        return distinct(includes);
    }

    @Override
    protected double estimateComplexity(String content) {
        return countDecisionPoints(code(content), DECISION_POINTS);
    }

    /**
     * Qualified names ({@code Widget::draw}) are checked by their last segment.
     */
    @Override
    protected boolean isControlKeyword(String name) {
        return super.isControlKeyword(simpleName(name));
    }

    private static String simpleName(String name) {
        if (name == null) {
            return null;
        }
        int separator = name.lastIndexOf("::");
        return separator >= 0 ? name.substring(separator + 2) : name;
    }
}
