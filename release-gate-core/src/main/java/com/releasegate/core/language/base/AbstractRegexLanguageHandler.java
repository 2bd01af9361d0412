package com.releasegate.core.language.base;

import com.releasegate.core.model.ComponentKind;
import com.releasegate.core.model.ComponentRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for handlers that analyze source code using regular expressions.
 *
 * <p>This class is optimized for text-based pattern matching and provides:
 * <ul>
 *   <li>Sanitization of comments and string literals before matching</li>
 *   <li>Decision-point counting over sanitized code</li>
 *   <li>Line-number and brace-span utilities for component line counts</li>
 *   <li>Source-ordered component collection</li>
 * </ul>
 *
 * <h3>When to Use This Base Class</h3>
 * <p>Use AbstractRegexLanguageHandler when:</p>
 * <ul>
 *   <li>The language has no parser available on the JVM (Python, JavaScript, C/C++, Go)</li>
 *   <li>Pattern-level structure (declarations, imports) is all that is needed</li>
 * </ul>
 *
 * @see AbstractLanguageHandler
 */
public abstract class AbstractRegexLanguageHandler extends AbstractLanguageHandler {

    protected AbstractRegexLanguageHandler() {
        super();
    }

    /**
     * Lexical rules used to blank comments and strings for this language.
     *
     * @return sanitizer syntax
     */
    protected abstract SourceSanitizer.Syntax syntax();

    /**
     * Returns the content with comments and string contents blanked.
     *
     * @param content source text
     * @return sanitized code of the same length
     */
    protected String code(String content) {
        return SourceSanitizer.sanitize(content, syntax()).code();
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Counts all matches of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return number of matches
     */
    protected int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * Sums the matches of several patterns on top of the baseline complexity.
     *
     * @param code sanitized code
     * @param decisionPoints patterns that each mark one decision point
     * @return baseline plus number of decision points
     */
    protected double countDecisionPoints(String code, List<Pattern> decisionPoints) {
        int complexity = BASE_COMPLEXITY;
        for (Pattern pattern : decisionPoints) {
            complexity += countMatches(pattern, code);
        }
        return complexity;
    }

    /**
     * Collects every match of a pattern as a component found at the match offset.
     *
     * @param pattern pattern whose group 1 is the component name
     * @param code sanitized code
     * @param kind component kind
     * @param found collector of components with their offsets
     */
    protected void collect(Pattern pattern, String code, ComponentKind kind, List<Located> found) {
        Matcher matcher = pattern.matcher(code);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (isControlKeyword(name)) {
                continue;
            }
            found.add(new Located(matcher.start(1), new ComponentRecord(name, kind, spanFrom(code, matcher))));
        }
    }

    /**
     * Computes the line span of a component whose match ends at or before its body.
     *
     * <p><b>Default Implementation:</b> Brace matching from the first opening brace at or after
     * the match end, looking no further than the next line. Returns 0 when no body is found.
     *
     * @param code sanitized code
     * @param matcher match of the component declaration
     * @return line span, 0 when unknown
     */
    protected int spanFrom(String code, Matcher matcher) {
        int open = -1;
        int newlines = 0;
        for (int i = Math.max(matcher.end() - 1, 0); i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '{') {
                open = i;
                break;
            }
            if (c == ';' || c == '}' || (c == '\n' && ++newlines > 1)) {
                break;
            }
        }
        if (open < 0) {
            return 0;
        }
        int close = matchingBrace(code, open);
        if (close < 0) {
            return 0;
        }
        return lineOf(code, close) - lineOf(code, matcher.start()) + 1;
    }

    /**
     * Finds the closing brace for the brace at {@code open}.
     *
     * @param code sanitized code
     * @param open index of an opening brace
     * @return index of the matching closing brace, or -1
     */
    protected int matchingBrace(String code, int open) {
        int depth = 0;
        for (int i = open; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Returns the 1-based line number of an offset.
     *
     * @param text text
     * @param offset character offset
     * @return line number
     */
    protected int lineOf(String text, int offset) {
        int line = 1;
        int end = Math.min(offset, text.length());
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Sorts located components by source offset, dropping duplicates at the same offset.
     *
     * @param found located components
     * @return components in source order
     */
    protected List<ComponentRecord> inSourceOrder(List<Located> found) {
        List<Located> sorted = new ArrayList<>(found);
        sorted.sort(Comparator.comparingInt(Located::offset));
        List<ComponentRecord> components = new ArrayList<>();
        int lastOffset = -1;
        for (Located located : sorted) {
            if (located.offset() != lastOffset) {
                components.add(located.component());
                lastOffset = located.offset();
            }
        }
        return components;
    }

    /**
     * Reads the original text of a group matched on sanitized code.
     *
     * <p>Sanitized code keeps string delimiters but blanks their contents; since offsets
     * are preserved, the literal can be read back from the raw content.
     *
     * @param content raw source text
     * @param matcher matcher run on the sanitized code
     * @param group group spanning the literal contents
     * @return literal contents
     */
    protected String literal(String content, Matcher matcher, int group) {
        return content.substring(matcher.start(group), matcher.end(group));
    }

    /**
     * A component together with the offset its name was found at.
     *
     * @param offset offset of the component name
     * @param component component
     */
    protected record Located(int offset, ComponentRecord component) {}
}
