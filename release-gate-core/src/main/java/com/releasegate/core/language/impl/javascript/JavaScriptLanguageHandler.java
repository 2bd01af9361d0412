package com.releasegate.core.language.impl.javascript;

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
 * Handler for JavaScript and TypeScript source files.
 *
 * <p>Recognizes:
 * <ul>
 *   <li>Function declarations: {@code function name(...)}, {@code async function name(...)}</li>
 *   <li>Arrow functions bound to a name: {@code const name = (...) =>}, {@code const name = async x =>}</li>
 *   <li>Classes: {@code class Name}</li>
 *   <li>React components: classes extending {@code Component}/{@code PureComponent} and
 *       constants typed {@code React.FC}</li>
 *   <li>Dependencies: ES module imports/re-exports, side-effect imports, {@code require(...)}
 *       and dynamic {@code import(...)}</li>
 * </ul>
 *
 * <p><b>Complexity:</b> 1 + one per if/for/while/switch/catch + one per ternary operator.
 * Optional chaining ({@code ?.}), nullish coalescing ({@code ??}) and TypeScript optional
 * members ({@code name?:}) are not ternaries.
 */
public class JavaScriptLanguageHandler extends AbstractRegexLanguageHandler {

    private static final String HANDLER_ID = "javascript";

    private static final Pattern FUNCTION_PATTERN =
        Pattern.compile("\\bfunction\\s*\\*?\\s*(\\w+)\\s*\\(");

    private static final Pattern ARROW_PATTERN = Pattern.compile(
        "\\b(?:const|let|var)\\s+(\\w+)\\s*(?::[^=\\n]+)?=\\s*(?:async\\s+)?(?:\\([^)]*\\)|\\w+)\\s*(?::[^=\\n]+)?=>");

    private static final Pattern CLASS_PATTERN =
        Pattern.compile("\\bclass\\s+(\\w+)");

    private static final Pattern REACT_CLASS_PATTERN =
        Pattern.compile("\\bclass\\s+(\\w+)\\s+extends\\s+(?:React\\.)?(?:Pure)?Component\\b");

    private static final Pattern REACT_FC_PATTERN =
        Pattern.compile("\\b(?:const|let)\\s+(\\w+)\\s*:\\s*(?:React\\.)?(?:FC|FunctionComponent)\\b");

    // Dependency patterns run on sanitized code: group 2 spans the blanked literal contents
    private static final Pattern IMPORT_FROM_PATTERN =
        Pattern.compile("\\b(?:import|export)\\s+[^;'\"`]*?\\bfrom\\s*(['\"])( *)\\1");

    private static final Pattern SIDE_EFFECT_IMPORT_PATTERN =
        Pattern.compile("\\bimport\\s*(['\"])( *)\\1");

    private static final Pattern REQUIRE_PATTERN =
        Pattern.compile("\\b(?:require|import)\\s*\\(\\s*(['\"`])( *)\\1\\s*\\)");

    private static final List<Pattern> DECISION_POINTS = List.of(
        Pattern.compile("\\bif\\s*\\("),
        Pattern.compile("\\bfor\\s*(?:await\\s*)?\\("),
        Pattern.compile("\\bwhile\\s*\\("),
        Pattern.compile("\\bswitch\\s*\\("),
        Pattern.compile("\\bcatch\\b"),
        Pattern.compile("(?<![?])\\?(?![?.:=])")
    );

    @Override
    public String getId() {
        return HANDLER_ID;
    }

    @Override
    public String getDisplayName() {
        return "JavaScript/TypeScript Handler";
    }

    @Override
    public Set<String> getLanguages() {
        return Set.of("JavaScript", "TypeScript");
    }

    @Override
    protected SourceSanitizer.Syntax syntax() {
        return SourceSanitizer.JAVASCRIPT;
    }

    @Override
    public List<ComponentRecord> extractComponents(String content) {
        String code = code(content);
        List<Located> found = new ArrayList<>();
        // React classes first so they win over the plain class match at the same offset
        collect(REACT_CLASS_PATTERN, code, ComponentKind.COMPONENT, found);
        collect(REACT_FC_PATTERN, code, ComponentKind.COMPONENT, found);
        collect(FUNCTION_PATTERN, code, ComponentKind.FUNCTION, found);
        collect(ARROW_PATTERN, code, ComponentKind.FUNCTION, found);
        collect(CLASS_PATTERN, code, ComponentKind.CLASS, found);
        return inSourceOrder(found);
    }

    @Override
    public List<String> extractDependencies(String content) {
        String code = code(content);
        List<String> dependencies = new ArrayList<>();
        for (Pattern pattern : List.of(IMPORT_FROM_PATTERN, SIDE_EFFECT_IMPORT_PATTERN, REQUIRE_PATTERN)) {
            Matcher matcher = pattern.matcher(code);
            while (matcher.find()) {
                dependencies.add(literal(content, matcher, 2));
            }
        }
        return distinct(dependencies);
    }

    @Override
    protected double estimateComplexity(String content) {
        return countDecisionPoints(code(content), DECISION_POINTS);
    }
}
