package com.releasegate.core.language.base;

/**
 * Blanks out comments and string literal contents so that pattern matching only sees code.
 *
 * <p>The sanitized text has exactly the same length as the input and keeps every newline,
 * so match offsets and line numbers map back onto the original content. String delimiters
 * are kept, their contents replaced by spaces.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * SourceSanitizer.Result result = SourceSanitizer.sanitize(content, SourceSanitizer.C_LIKE);
 * int ifs = countMatches(IF_PATTERN, result.code());
 * }</pre>
 */
public final class SourceSanitizer {

    /**
     * Lexical rules for comments and strings of a language family.
     *
     * @param lineComment line comment prefix, or null
     * @param blockComments whether C-style block comments exist
     * @param quotes characters that open a string or character literal
     * @param multilineQuotes subset of {@code quotes} whose literals may span lines
     * @param tripleQuotes whether tripled quotes open a multi-line string (Python)
     */
    public record Syntax(
        String lineComment,
        boolean blockComments,
        String quotes,
        String multilineQuotes,
        boolean tripleQuotes
    ) {}

    public static final Syntax C_LIKE = new Syntax("//", true, "\"'", "", false);
    public static final Syntax JAVASCRIPT = new Syntax("//", true, "\"'`", "`", false);
    public static final Syntax GO = new Syntax("//", true, "\"'`", "`", false);
    public static final Syntax PYTHON = new Syntax("#", false, "\"'", "", true);

    /**
     * Sanitized source.
     *
     * @param code source with comments and string contents blanked
     * @param terminated false if a string literal or block comment was left open
     */
    public record Result(String code, boolean terminated) {}

    private SourceSanitizer() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Sanitizes source text.
     *
     * @param source source text
     * @param syntax lexical rules
     * @return sanitized text and termination flag
     */
    public static Result sanitize(String source, Syntax syntax) {
        int n = source.length();
        StringBuilder out = new StringBuilder(n);
        boolean terminated = true;
        int i = 0;

        while (i < n) {
            char c = source.charAt(i);

            if (syntax.lineComment() != null && source.startsWith(syntax.lineComment(), i)) {
                while (i < n && source.charAt(i) != '\n') {
                    out.append(' ');
                    i++;
                }
                continue;
            }

            if (syntax.blockComments() && source.startsWith("/*", i)) {
                int end = source.indexOf("*/", i + 2);
                int stop = end < 0 ? n : end + 2;
                if (end < 0) {
                    terminated = false;
                }
                blank(source, i, stop, out);
                i = stop;
                continue;
            }

            if (syntax.quotes().indexOf(c) >= 0) {
                if (syntax.tripleQuotes() && i + 2 < n
                        && source.charAt(i + 1) == c && source.charAt(i + 2) == c) {
                    String delimiter = String.valueOf(new char[] {c, c, c});
                    int end = findTripleClose(source, i + 3, delimiter);
                    out.append(delimiter);
                    if (end < 0) {
                        terminated = false;
                        blank(source, i + 3, n, out);
                        i = n;
                    } else {
                        blank(source, i + 3, end, out);
                        out.append(delimiter);
                        i = end + 3;
                    }
                    continue;
                }

                boolean multiline = syntax.multilineQuotes().indexOf(c) >= 0;
                out.append(c);
                i++;
                while (i < n) {
                    char d = source.charAt(i);
                    if (d == '\\' && i + 1 < n) {
                        blank(source, i, i + 2, out);
                        i += 2;
                        continue;
                    }
                    if (d == c || (d == '\n' && !multiline)) {
                        break;
                    }
                    out.append(d == '\n' ? '\n' : ' ');
                    i++;
                }
                if (i < n && source.charAt(i) == c) {
                    out.append(c);
                    i++;
                } else {
                    terminated = false;
                }
                continue;
            }

            out.append(c);
            i++;
        }

        return new Result(out.toString(), terminated);
    }

    private static int findTripleClose(String source, int from, String delimiter) {
        int i = from;
        while (i < source.length()) {
            if (source.charAt(i) == '\\') {
                i += 2;
                continue;
            }
            if (source.startsWith(delimiter, i)) {
                return i;
            }
            i++;
        }
        return -1;
    }

    private static void blank(String source, int from, int to, StringBuilder out) {
        int end = Math.min(to, source.length());
        for (int i = from; i < end; i++) {
            out.append(source.charAt(i) == '\n' ? '\n' : ' ');
        }
    }
}
