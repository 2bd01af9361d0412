package com.releasegate.core.language.impl.python;

import com.releasegate.core.language.base.AbstractRegexLanguageHandler;
import com.releasegate.core.language.base.SourceSanitizer;
import com.releasegate.core.model.ComponentKind;
import com.releasegate.core.model.ComponentRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handler for Python source files.
 *
 * <p>Python has no parser on the JVM, so this handler combines indentation-aware patterns
 * with a structural well-formedness check that plays the role of a parse: unbalanced
 * brackets, unterminated strings and block headers missing their {@code :} make the file
 * unparseable.
 *
 * <p><b>Complexity:</b> 1 + one per {@code if}/{@code elif}/{@code for}/{@code while}/{@code except}
 * statement (comprehension clauses are not statements) + one per inline conditional expression + one per {@code and}/{@code or} operator
 * (an N-operand boolean chain adds N-1).
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * import os
 * from app.models import User
 *
 * class UserService:
 *     def find(self, name):
 *         if name and self.enabled:
 *             return User(name)
 * }</pre>
 * <p>yields components {@code UserService} (class) and {@code find} (function),
 * dependencies {@code os}, {@code app.models} and complexity 3.
 */
public class PythonLanguageHandler extends AbstractRegexLanguageHandler {

    private static final String HANDLER_ID = "python";

    private static final Pattern DEF_PATTERN =
        Pattern.compile("^[ \\t]*(?:async[ \\t]+)?def[ \\t]+(\\w+)[ \\t]*\\(", Pattern.MULTILINE);

    private static final Pattern CLASS_PATTERN =
        Pattern.compile("^[ \\t]*class[ \\t]+(\\w+)", Pattern.MULTILINE);

    private static final Pattern IMPORT_PATTERN =
        Pattern.compile("^[ \\t]*import[ \\t]+([^\\n#;]+)", Pattern.MULTILINE);

    private static final Pattern FROM_IMPORT_PATTERN =
        Pattern.compile("^[ \\t]*from[ \\t]+(\\.*)([\\w.]*)[ \\t]+import\\b", Pattern.MULTILINE);

    private static final Pattern BRANCH_PATTERN =
        Pattern.compile("^[ \\t]*(?:if|elif|while|for|async[ \\t]+for|except)\\b", Pattern.MULTILINE);

    private static final Pattern BOOLEAN_OPERATOR_PATTERN =
        Pattern.compile("\\b(?:and|or)\\b");

    private static final Pattern INLINE_IF_PATTERN =
        Pattern.compile("\\S[ \\t]+if\\b(?=([^\\n]*))");

    private static final Pattern ELSE_PATTERN =
        Pattern.compile("\\belse\\b");

    private static final Pattern HEADER_PATTERN = Pattern.compile(
        "^(?:async\\s+)?(?:def|class|if|elif|else|for|while|try|except|finally|with)\\b");

    @Override
    public String getId() {
        return HANDLER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Python Handler";
    }

    @Override
    public Set<String> getLanguages() {
        return Set.of("Python");
    }

    @Override
    protected SourceSanitizer.Syntax syntax() {
        return SourceSanitizer.PYTHON;
    }

    @Override
    protected boolean isParseable(String content) {
        SourceSanitizer.Result sanitized = SourceSanitizer.sanitize(content, syntax());
        if (!sanitized.terminated()) {
            log.debug("Unterminated string literal");
            return false;
        }
        return bracketsBalanced(sanitized.code()) && blockHeadersComplete(sanitized.code());
    }

    @Override
    public List<ComponentRecord> extractComponents(String content) {
        String code = code(content);
        List<Located> found = new ArrayList<>();
        collect(DEF_PATTERN, code, ComponentKind.FUNCTION, found);
        collect(CLASS_PATTERN, code, ComponentKind.CLASS, found);
        return inSourceOrder(found);
    }

    @Override
    public List<String> extractDependencies(String content) {
        String code = code(content);
        List<String> dependencies = new ArrayList<>();

        Matcher imports = IMPORT_PATTERN.matcher(code);
        while (imports.find()) {
            for (String part : imports.group(1).split(",")) {
                String module = part.trim().split("\\s+")[0];
                if (module.matches("[\\w.]+")) {
                    dependencies.add(module);
                }
            }
        }

        Matcher fromImports = FROM_IMPORT_PATTERN.matcher(code);
        while (fromImports.find()) {
            // "from . import x" has no module
            String module = fromImports.group(2);
            if (!module.isEmpty()) {
                dependencies.add(module);
            }
        }

        return distinct(dependencies);
    }

    @Override
    protected double estimateComplexity(String content) {
        String code = code(content);
        double complexity = countDecisionPoints(code, List.of(BOOLEAN_OPERATOR_PATTERN)) + countStatementBranches(code);

        Matcher inline = INLINE_IF_PATTERN.matcher(code);
        while (inline.find()) {
            if (ELSE_PATTERN.matcher(inline.group(1)).find()) {
                complexity++;
            }
        }
        return complexity;
    }

    /**
     * Counts branch keywords that start a statement. Comprehension clauses sit inside
     * brackets and are skipped whatever the line layout.
     */
    private int countStatementBranches(String code) {
        int branches = 0;
        int depth = 0;
        int scanned = 0;
        Matcher matcher = BRANCH_PATTERN.matcher(code);
        while (matcher.find()) {
            depth += bracketDelta(code, scanned, matcher.start());
            scanned = matcher.start();
            if (depth <= 0) {
                branches++;
            }
        }
        return branches;
    }

    private static int bracketDelta(String code, int from, int to) {
        int delta = 0;
        for (int i = from; i < to; i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                delta++;
            } else if (c == ')' || c == ']' || c == '}') {
                delta--;
            }
        }
        return delta;
    }

    /**
     * Python blocks end where indentation drops back to the header level.
     */
    @Override
    protected int spanFrom(String code, Matcher matcher) {
        String[] lines = code.split("\n", -1);
        int headerLine = lineOf(code, matcher.start()) - 1;
        int headerIndent = indentOf(lines[headerLine]);
        int lastLine = headerLine;
        for (int i = headerLine + 1; i < lines.length; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            if (indentOf(lines[i]) <= headerIndent) {
                break;
            }
            lastLine = i;
        }
        return lastLine - headerLine + 1;
    }

    private int indentOf(String line) {
        int indent = 0;
        while (indent < line.length() && (line.charAt(indent) == ' ' || line.charAt(indent) == '\t')) {
            indent++;
        }
        return indent;
    }

    private boolean bracketsBalanced(String code) {
        Deque<Character> open = new ArrayDeque<>();
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            switch (c) {
                case '(', '[', '{' -> open.push(c);
                case ')', ']', '}' -> {
                    if (open.isEmpty() || open.pop() != opening(c)) {
                        log.debug("Unbalanced '{}' at line {}", c, lineOf(code, i));
                        return false;
                    }
                }
                default -> {
                }
            }
        }
        if (!open.isEmpty()) {
            log.debug("{} unclosed bracket(s)", open.size());
            return false;
        }
        return true;
    }

    private static char opening(char closing) {
        return switch (closing) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }

    /**
     * Every compound statement header must contain a top-level colon in its logical line.
     */
    private boolean blockHeadersComplete(String code) {
        StringBuilder logical = new StringBuilder();
        int depth = 0;
        for (String line : code.split("\n", -1)) {
            logical.append(line).append(' ');
            depth += bracketDelta(line, 0, line.length());
            if (depth > 0 || line.stripTrailing().endsWith("\\")) {
                continue;
            }
            String statement = logical.toString().strip();
            logical.setLength(0);
            if (HEADER_PATTERN.matcher(statement).find() && !hasTopLevelColon(statement)) {
                log.debug("Block header without ':' -> {}", statement);
                return false;
            }
        }
        return true;
    }

    private boolean hasTopLevelColon(String statement) {
        int depth = 0;
        for (int i = 0; i < statement.length(); i++) {
            char c = statement.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ':' && depth == 0
                    && (i + 1 >= statement.length() || statement.charAt(i + 1) != '=')) {
                return true;
            }
        }
        return false;
    }
}
