package com.releasegate.core.language.base;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SourceSanitizer}.
 */
class SourceSanitizerTest {

    @Test
    void sanitize_lineComment_blankedUpToNewline() {
        String source = "int a; // if (x)\nint b;";

        SourceSanitizer.Result result = SourceSanitizer.sanitize(source, SourceSanitizer.C_LIKE);

        assertThat(result.code()).isEqualTo("int a;          \nint b;");
        assertThat(result.code()).hasSameSizeAs(source);
        assertThat(result.terminated()).isTrue();
    }

    @Test
    void sanitize_stringContents_blankedDelimitersKept() {
        SourceSanitizer.Result result = SourceSanitizer.sanitize("s = \"a // b\";", SourceSanitizer.C_LIKE);

        assertThat(result.code()).isEqualTo("s = \"      \";");
    }

    @Test
    void sanitize_escapedQuote_staysInsideString() {
        SourceSanitizer.Result result = SourceSanitizer.sanitize("\"a\\\"b\" + x", SourceSanitizer.C_LIKE);

        assertThat(result.code()).isEqualTo("\"    \" + x");
        assertThat(result.terminated()).isTrue();
    }

    @Test
    void sanitize_blockComment_keepsNewlines() {
        String source = "a /* if\n while */ b";

        SourceSanitizer.Result result = SourceSanitizer.sanitize(source, SourceSanitizer.C_LIKE);

        assertThat(result.code()).isEqualTo("a      \n          b");
    }

    @Test
    void sanitize_unterminatedBlockComment_reportsNotTerminated() {
        assertThat(SourceSanitizer.sanitize("a /* open", SourceSanitizer.C_LIKE).terminated()).isFalse();
    }

    @Test
    void sanitize_pythonTripleQuotedString_spansLines() {
        String source = "x = '''if a:\n  pass'''\ny = 1";

        SourceSanitizer.Result result = SourceSanitizer.sanitize(source, SourceSanitizer.PYTHON);

        assertThat(result.code()).isEqualTo("x = '''     \n      '''\ny = 1");
        assertThat(result.terminated()).isTrue();
    }

    @Test
    void sanitize_pythonHashComment_blanked() {
        SourceSanitizer.Result result = SourceSanitizer.sanitize("a = 1  # if b", SourceSanitizer.PYTHON);

        assertThat(result.code()).isEqualTo("a = 1        ");
    }

    @Test
    void sanitize_singleLineStringBrokenByNewline_reportsNotTerminated() {
        SourceSanitizer.Result result = SourceSanitizer.sanitize("s = 'abc\nt = 1", SourceSanitizer.PYTHON);

        assertThat(result.terminated()).isFalse();
        assertThat(result.code()).endsWith("\nt = 1");
    }

    @Test
    void sanitize_templateLiteral_mayContainNewlines() {
        SourceSanitizer.Result result = SourceSanitizer.sanitize("`a\nb` + c", SourceSanitizer.JAVASCRIPT);

        assertThat(result.code()).isEqualTo("` \n ` + c");
        assertThat(result.terminated()).isTrue();
    }
}
