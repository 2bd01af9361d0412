package com.releasegate.core.language.impl.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.releasegate.core.language.base.AbstractLanguageHandler;
import com.releasegate.core.model.ComponentKind;
import com.releasegate.core.model.ComponentRecord;
import com.releasegate.core.model.FileRecord;
import com.releasegate.core.model.StructuralFacts;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Handler for Java source files using the JavaParser AST.
 *
 * <p>Java is the one language this tool parses with a real grammar, so structural
 * facts come from a syntax walk rather than patterns:
 * <ul>
 *   <li>Components: type declarations (classes, interfaces, enums, records) and
 *       methods/constructors, with line spans from the AST ranges</li>
 *   <li>Dependencies: import declarations ({@code a.b.*} for on-demand imports)</li>
 *   <li>Complexity: 1 + one per if/for/for-each/while/do/switch/catch/conditional
 *       expression + one per {@code &&}/{@code ||} operator</li>
 * </ul>
 *
 * <p>If JavaParser reports problems, the file is treated as unparseable and yields
 * {@link StructuralFacts#unparsed()}.
 */
public class JavaLanguageHandler extends AbstractLanguageHandler {

    private static final String HANDLER_ID = "java";

    /**
     * Shared, read-only parser configuration. A new {@link JavaParser} is created per
     * parse because parser instances keep per-parse state.
     */
    private static final ParserConfiguration CONFIGURATION = new ParserConfiguration()
        .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    @Override
    public String getId() {
        return HANDLER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Java Handler";
    }

    @Override
    public Set<String> getLanguages() {
        return Set.of("Java");
    }

    @Override
    public StructuralFacts analyze(FileRecord file) {
        Optional<CompilationUnit> cu = parse(file.content());
        if (cu.isEmpty()) {
            log.warn("Unable to parse Java file {}: structural facts unavailable", file.path());
            return StructuralFacts.unparsed();
        }
        return new StructuralFacts(components(cu.get()), dependencies(cu.get()), complexity(cu.get()));
    }

    @Override
    protected boolean isParseable(String content) {
        return parse(content).isPresent();
    }

    @Override
    public List<ComponentRecord> extractComponents(String content) {
        return parse(content).map(this::components).orElse(List.of());
    }

    @Override
    public List<String> extractDependencies(String content) {
        return parse(content).map(this::dependencies).orElse(List.of());
    }

    @Override
    protected double estimateComplexity(String content) {
        return parse(content).map(this::complexity).orElse(0.0);
    }

    /**
     * Parses Java source into a CompilationUnit AST.
     *
     * @param content Java source
     * @return CompilationUnit if parsing succeeded, empty if it reported problems
     */
    protected Optional<CompilationUnit> parse(String content) {
        ParseResult<CompilationUnit> result = new JavaParser(CONFIGURATION).parse(content);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult();
        }
        result.getProblems().forEach(problem -> log.debug("  - {}", problem.getVerboseMessage()));
        return Optional.empty();
    }

    private List<ComponentRecord> components(CompilationUnit cu) {
        List<ComponentRecord> components = new ArrayList<>();
        cu.walk(node -> {
            if (node instanceof TypeDeclaration<?> type) {
                components.add(new ComponentRecord(type.getNameAsString(), ComponentKind.CLASS, lineSpan(node)));
            } else if (node instanceof MethodDeclaration method) {
                components.add(new ComponentRecord(method.getNameAsString(), ComponentKind.METHOD, lineSpan(node)));
            } else if (node instanceof ConstructorDeclaration constructor) {
                components.add(new ComponentRecord(constructor.getNameAsString(), ComponentKind.METHOD, lineSpan(node)));
            }
        });
        return components;
    }

    private List<String> dependencies(CompilationUnit cu) {
        List<String> imports = new ArrayList<>();
        for (ImportDeclaration declaration : cu.getImports()) {
            String name = declaration.getNameAsString();
            imports.add(declaration.isAsterisk() ? name + ".*" : name);
        }
        return distinct(imports);
    }

    private double complexity(CompilationUnit cu) {
        int[] complexity = {BASE_COMPLEXITY};
        cu.walk(node -> complexity[0] += decisionPoints(node));
        return complexity[0];
    }

    private int decisionPoints(Node node) {
        if (node instanceof IfStmt
                || node instanceof ForStmt
                || node instanceof ForEachStmt
                || node instanceof WhileStmt
                || node instanceof DoStmt
                || node instanceof SwitchStmt
                || node instanceof SwitchExpr
                || node instanceof CatchClause
                || node instanceof ConditionalExpr) {
            return 1;
        }
        if (node instanceof BinaryExpr binary) {
            BinaryExpr.Operator operator = binary.getOperator();
            return operator == BinaryExpr.Operator.AND || operator == BinaryExpr.Operator.OR ? 1 : 0;
        }
        return 0;
    }

    private int lineSpan(Node node) {
        return node.getRange()
            .map(range -> range.end.line - range.begin.line + 1)
            .orElse(0);
    }
}
