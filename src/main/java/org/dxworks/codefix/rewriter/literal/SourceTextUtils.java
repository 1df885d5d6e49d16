package org.dxworks.codefix.rewriter.literal;

import java.util.ArrayList;
import java.util.List;

/**
 * String- and comment-aware helpers over raw source text.
 * Understands double-quoted and single-quoted literals with backslash escapes,
 * back-quoted raw strings, line comments and block comments.
 */
public final class SourceTextUtils {

    private SourceTextUtils() {
        // utility class
    }

    /**
     * If a string, rune, raw string or comment starts at {@code i}, returns the index just past it
     * (or the text length when it never closes). Otherwise returns {@code i}.
     * Line comments stop before their terminating newline.
     */
    public static int skipLiteralOrComment(String text, int i) {
        if (i >= text.length()) {
            return i;
        }
        char c = text.charAt(i);
        if (c == '"' || c == '\'') {
            return skipQuoted(text, i, c);
        }
        if (c == '`') {
            int close = text.indexOf('`', i + 1);
            return close < 0 ? text.length() : close + 1;
        }
        if (c == '/' && i + 1 < text.length()) {
            char next = text.charAt(i + 1);
            if (next == '/') {
                int nl = text.indexOf('\n', i + 2);
                return nl < 0 ? text.length() : nl;
            }
            if (next == '*') {
                int close = text.indexOf("*/", i + 2);
                return close < 0 ? text.length() : close + 2;
            }
        }
        return i;
    }

    // Quoted literals cannot span lines, so an unclosed one ends at the newline.
    private static int skipQuoted(String text, int i, char quote) {
        int j = i + 1;
        while (j < text.length()) {
            char c = text.charAt(j);
            if (c == '\\') {
                j += 2;
                continue;
            }
            if (c == quote) {
                return j + 1;
            }
            if (c == '\n') {
                return j;
            }
            j++;
        }
        return text.length();
    }

    public static boolean isComment(String text, int i) {
        return i + 1 < text.length() && text.charAt(i) == '/'
                && (text.charAt(i + 1) == '/' || text.charAt(i + 1) == '*');
    }

    public static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * Returns the index of the '}' closing the '{' at {@code openIdx}, or -1 when the buffer ends first.
     */
    public static int findMatchingBrace(String text, int openIdx) {
        if (text == null || openIdx < 0 || openIdx >= text.length() || text.charAt(openIdx) != '{') {
            return -1;
        }
        int depth = 0;
        int i = openIdx;
        while (i < text.length()) {
            int skipped = skipLiteralOrComment(text, i);
            if (skipped != i) {
                i = skipped;
                continue;
            }
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Splits {@code text[from, to)} on separators that are outside strings, comments and
     * any (), [] or {} pair. Segments are returned as absolute offsets, including empty ones.
     */
    public static List<Span> splitTopLevel(String text, int from, int to, char separator) {
        List<Span> parts = new ArrayList<>();
        int depth = 0;
        int segmentStart = from;
        int i = from;
        while (i < to) {
            int skipped = skipLiteralOrComment(text, i);
            if (skipped != i) {
                i = Math.min(skipped, to);
                continue;
            }
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(new Span(segmentStart, i));
                segmentStart = i + 1;
            }
            i++;
        }
        parts.add(new Span(segmentStart, to));
        return parts;
    }

    /**
     * First top-level occurrence of {@code target} in {@code text[from, to)}, or -1.
     */
    public static int indexOfTopLevel(String text, int from, int to, char target) {
        int depth = 0;
        int i = from;
        while (i < to) {
            int skipped = skipLiteralOrComment(text, i);
            if (skipped != i) {
                i = skipped;
                continue;
            }
            char c = text.charAt(i);
            if (c == target && depth == 0) {
                return i;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            }
            i++;
        }
        return -1;
    }

    /**
     * Removes comments, keeping string contents and the newline that ends a line comment.
     */
    public static String stripComments(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            int skipped = skipLiteralOrComment(text, i);
            if (skipped == i) {
                sb.append(text.charAt(i));
                i++;
            } else {
                if (!isComment(text, i)) {
                    sb.append(text, i, skipped);
                }
                i = skipped;
            }
        }
        return sb.toString();
    }

    /**
     * Collapses every line break, together with the whitespace around it, into one space.
     * Line breaks inside string literals are kept.
     */
    public static String collapseLineBreaks(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            int skipped = skipLiteralOrComment(text, i);
            if (skipped != i) {
                sb.append(text, i, skipped);
                i = skipped;
                continue;
            }
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                while (sb.length() > 0 && isBlank(sb.charAt(sb.length() - 1))) {
                    sb.setLength(sb.length() - 1);
                }
                while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                sb.append(' ');
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }

    /**
     * Narrows {@code [from, to)} to exclude leading and trailing whitespace.
     */
    public static Span trim(String text, int from, int to) {
        int start = from;
        int end = to;
        while (start < end && Character.isWhitespace(text.charAt(start))) start++;
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
        return new Span(start, end);
    }

    public static int lineStart(String text, int offset) {
        int nl = text.lastIndexOf('\n', offset - 1);
        return nl + 1;
    }

    public static int lineEnd(String text, int offset) {
        int nl = text.indexOf('\n', offset);
        if (nl < 0) return text.length();
        return nl > 0 && text.charAt(nl - 1) == '\r' ? nl - 1 : nl;
    }

    public static String indentationAt(String text, int offset) {
        int start = lineStart(text, offset);
        int end = start;
        while (end < text.length() && isBlank(text.charAt(end))) end++;
        return text.substring(start, end);
    }

    /** 1-based line number of {@code offset}. */
    public static int lineNumber(String text, int offset) {
        int line = 1;
        int limit = Math.min(offset, text.length());
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }

    public static String lineSeparatorOf(String text) {
        return text.contains("\r\n") ? "\r\n" : "\n";
    }
}
