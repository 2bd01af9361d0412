package com.releasegate.core.language.impl.java;

import com.releasegate.core.language.LanguageHandler;
import com.releasegate.core.language.LanguageHandlerTestBase;
import com.releasegate.core.model.ComponentKind;
import com.releasegate.core.model.StructuralFacts;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link JavaLanguageHandler}.
 */
class JavaLanguageHandlerTest extends LanguageHandlerTestBase {

    private final JavaLanguageHandler handler = new JavaLanguageHandler();

    @Override
    protected LanguageHandler handler() {
        return handler;
    }

    @Override
    protected String language() {
        return "Java";
    }

    @Test
    void analyze_serviceClass_extractsTypesMethodsImportsAndComplexity() {
        // Given: class with constructor, method, branches and a ternary
        String content = """
            package com.example;

            import java.util.List;
            import java.util.concurrent.*;

            public class OrderService {
                private final List<String> orders;

                public OrderService(List<String> orders) {
                    this.orders = orders;
                }

                public int count(boolean active) {
                    if (active && !orders.isEmpty()) {
                        return orders.size();
                    }
                    for (String order : orders) {
                        System.out.println(order);
                    }
                    return active ? 1 : 0;
                }
            }
            """;

        // When
        StructuralFacts facts = analyze("src/main/java/com/example/OrderService.java", content);

        // Then: 1 + if + && + for-each + ternary
        assertThat(facts.complexity()).isEqualTo(5.0);
        assertThat(names(facts.components())).containsExactly("OrderService", "OrderService", "count");
        assertThat(kinds(facts.components()))
            .containsExactly(ComponentKind.CLASS, ComponentKind.METHOD, ComponentKind.METHOD);
        assertThat(facts.components().get(2).lines()).isEqualTo(9);
        assertThat(facts.dependencies()).containsExactly("java.util.List", "java.util.concurrent.*");
    }

    @Test
    void analyze_emptyClass_hasBaselineComplexity() {
        StructuralFacts facts = analyze("Empty.java", "class Empty {}");

        assertThat(facts.complexity()).isEqualTo(1.0);
        assertThat(names(facts.components())).containsExactly("Empty");
    }

    @Test
    void analyze_switchWhileCatchAndOr_countsEachDecisionPoint() {
        String content = """
            class Worker {
                void run(int mode, boolean a, boolean b, boolean c) {
                    switch (mode) {
                        case 1 -> System.out.println("one");
                        default -> System.out.println("other");
                    }
                    while (a || b || c) {
                        a = false;
                    }
                    try {
                        Thread.sleep(1);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
            """;

        // 1 + switch + while + two || + catch
        assertThat(analyze("Worker.java", content).complexity()).isEqualTo(6.0);
    }

    @Test
    void analyze_commentsAndStrings_doNotCount() {
        String content = """
            class Quiet {
                // if (x) { for (;;) {} }
                String text = "if (a && b) while (true)";
            }
            """;

        assertThat(analyze("Quiet.java", content).complexity()).isEqualTo(1.0);
    }

    @Test
    void analyze_syntaxError_returnsUnparsed() {
        StructuralFacts facts = analyze("Broken.java", "public class Broken { void m( { }");

        assertThat(facts).isEqualTo(StructuralFacts.unparsed());
        assertThat(facts.complexity()).isZero();
    }

    @Test
    void analyze_nestedAndRecordTypes_areComponents() {
        String content = """
            public class Outer {
                record Point(int x, int y) {}
                enum Color { RED, GREEN }
                interface Shape { double area(); }
            }
            """;

        StructuralFacts facts = analyze("Outer.java", content);

        assertThat(names(facts.components())).containsExactly("Outer", "Point", "Color", "Shape", "area");
    }
}
