package com.releasegate.core.language.impl.go;

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
 * Handler for Go source files.
 *
 * <p>Recognizes functions ({@code func name(}), methods ({@code func (r *T) name(}),
 * struct types and both single and grouped import declarations.
 *
 * <p><b>Complexity:</b> 1 + one per if/for/switch/select. Go has no while loop
 * (every loop is a {@code for}), no exceptions and no ternary operator.
 */
public class GoLanguageHandler extends AbstractRegexLanguageHandler {

    private static final String HANDLER_ID = "go";

    private static final Pattern FUNCTION_PATTERN =
        Pattern.compile("^func\\s+(\\w+)\\s*(?:\\[[^\\]]*\\]\\s*)?\\(", Pattern.MULTILINE);

    private static final Pattern METHOD_PATTERN =
        Pattern.compile("^func\\s*\\([^)]*\\)\\s*(\\w+)\\s*\\(", Pattern.MULTILINE);

    private static final Pattern STRUCT_PATTERN =
        Pattern.compile("\\btype\\s+(\\w+)\\s*(?:\\[[^\\]]*\\]\\s*)?struct\\s*\\{");

    private static final Pattern SINGLE_IMPORT_PATTERN =
        Pattern.compile("\\bimport\\s+(?:[\\w.]+\\s+)?\"( *)\"");

    private static final Pattern IMPORT_BLOCK_PATTERN =
        Pattern.compile("\\bimport\\s*\\(([^)]*)\\)");

    private static final Pattern BLOCK_ENTRY_PATTERN =
        Pattern.compile("\"( *)\"");

    private static final List<Pattern> DECISION_POINTS = List.of(
        Pattern.compile("\\bif\\b"),
        Pattern.compile("\\bfor\\b"),
        Pattern.compile("\\bswitch\\b"),
        Pattern.compile("\\bselect\\b")
    );

    @Override
    public String getId() {
        return HANDLER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Go Handler";
    }

    @Override
    public Set<String> getLanguages() {
        return Set.of("Go");
    }

    @Override
    protected SourceSanitizer.Syntax syntax() {
        return SourceSanitizer.GO;
    }

    @Override
    public List<ComponentRecord> extractComponents(String content) {
        String code = code(content);
        List<Located> found = new ArrayList<>();
        collect(FUNCTION_PATTERN, code, ComponentKind.FUNCTION, found);
        collect(METHOD_PATTERN, code, ComponentKind.METHOD, found);
        collect(STRUCT_PATTERN, code, ComponentKind.STRUCT, found);
        return inSourceOrder(found);
    }

    @Override
    public List<String> extractDependencies(String content) {
        String code = code(content);
        List<String> imports = new ArrayList<>();

        Matcher single = SINGLE_IMPORT_PATTERN.matcher(code);
        while (single.find()) {
            imports.add(literal(content, single, 1));
        }

        Matcher block = IMPORT_BLOCK_PATTERN.matcher(code);
        while (block.find()) {
            Matcher entry = BLOCK_ENTRY_PATTERN.matcher(code);
            entry.region(block.start(1), block.end(1));
            while (entry.find()) {
                imports.add(literal(content, entry, 1));
            }
        }

        return distinct(imports);
    }

    @Override
    protected double estimateComplexity(String content) {
        return countDecisionPoints(code(content), DECISION_POINTS);
    }
}
