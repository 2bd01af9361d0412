package com.releasegate.core.language;

import com.releasegate.core.model.ComponentRecord;
import com.releasegate.core.model.FileRecord;
import com.releasegate.core.model.StructuralFacts;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FallbackExtractor}.
 */
class FallbackExtractorTest {

    private final FallbackExtractor extractor = new FallbackExtractor();

    @Test
    void extract_genericShapes_reportsFunctionsWithoutComplexity() {
        String content = """
            fn main() {}
            def helper(x):
            function run() {
                if (x) {
                } else if (y) {
                }
            }
            int compute(int a) {
            }
            """;

        StructuralFacts facts = extractor.extract(FileRecord.of("src/main.rs", "Rust", content));

        assertThat(facts.components()).extracting(ComponentRecord::name)
            .containsExactly("helper", "run", "main", "run", "compute");
        assertThat(facts.dependencies()).isEmpty();
        assertThat(facts.complexity()).isZero();
        assertThat(facts.hasComplexitySample()).isFalse();
    }

    @Test
    void extract_manyFunctions_capsComponentList() {
        String content = IntStream.range(0, 25)
            .mapToObj(i -> "def f" + i + "():")
            .collect(Collectors.joining("\n"));

        StructuralFacts facts = extractor.extract(FileRecord.of("lib.rb", "Ruby", content));

        assertThat(facts.components()).hasSize(FallbackExtractor.MAX_COMPONENTS);
        assertThat(facts.components().get(0).name()).isEqualTo("f0");
    }

    @Test
    void extract_emptyContent_returnsEmptyFacts() {
        StructuralFacts facts = extractor.extract(FileRecord.of("empty.sh", "Shell", ""));

        assertThat(facts.components()).isEmpty();
        assertThat(facts.complexity()).isZero();
    }
}
