package org.dxworks.codefix.rewriter.literal;

import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that keep repeated runs from rewriting twice: whether a buffer still holds candidate
 * literals, and whether the helpers a rewrite relies on are already declared.
 */
public final class IdempotenceGuard {

    private static final Pattern IMPORT_BLOCK = Pattern.compile("(?m)^import\\s*\\(");
    private static final Pattern IMPORT_LINE = Pattern.compile("(?m)^import\\s+[^(\\s].*$");
    private static final Pattern PACKAGE_CLAUSE = Pattern.compile("(?m)^package\\s+\\w+.*$");

    private IdempotenceGuard() {
    }

    /**
     * True when any scanner finds a marker. An unterminated literal still counts as a candidate
     * so that it gets reported.
     */
    public static boolean hasCandidates(String buffer, List<TokenScanner> scanners) {
        for (TokenScanner scanner : scanners) {
            try {
                if (scanner.scan(buffer, 0).isPresent()) {
                    return true;
                }
            } catch (UnterminatedLiteralException e) {
                return true;
            }
        }
        return false;
    }

    public static boolean needsHelperDeclaration(String buffer, String helperName) {
        Pattern declared = Pattern.compile("(?m)^func\\s+" + Pattern.quote(helperName) + "\\s*\\(");
        return !declared.matcher(buffer).find();
    }

    public static boolean needsHelperDeclaration(String buffer, Collection<String> helperNames) {
        return helperNames.stream().anyMatch(name -> needsHelperDeclaration(buffer, name));
    }

    /**
     * Offset just after the last top-level import declaration, else after the package clause, else 0.
     */
    public static int declarationAnchor(String buffer) {
        int anchor = -1;

        Matcher block = IMPORT_BLOCK.matcher(buffer);
        while (block.find()) {
            int open = block.end() - 1;
            int close = findMatchingParen(buffer, open);
            if (close >= 0) {
                anchor = Math.max(anchor, SourceTextUtils.lineEnd(buffer, close));
            }
        }

        Matcher line = IMPORT_LINE.matcher(buffer);
        while (line.find()) {
            anchor = Math.max(anchor, SourceTextUtils.lineEnd(buffer, line.start()));
        }
        if (anchor >= 0) {
            return anchor;
        }

        Matcher pkg = PACKAGE_CLAUSE.matcher(buffer);
        if (pkg.find()) {
            return SourceTextUtils.lineEnd(buffer, pkg.start());
        }
        return 0;
    }

    /**
     * Inserts the given declarations, separated by blank lines, at {@link #declarationAnchor}.
     */
    public static String insertHelperDeclarations(String buffer, List<String> declarations) {
        if (declarations.isEmpty()) {
            return buffer;
        }
        String nl = SourceTextUtils.lineSeparatorOf(buffer);
        int anchor = declarationAnchor(buffer);

        StringBuilder block = new StringBuilder();
        for (String declaration : declarations) {
            block.append(nl).append(nl).append(declaration.strip().replace("\r\n", "\n").replace("\n", nl));
        }
        if (anchor == 0) {
            block.delete(0, 2 * nl.length());
            block.append(nl).append(nl);
        }
        return buffer.substring(0, anchor) + block + buffer.substring(anchor);
    }

    private static int findMatchingParen(String text, int openIdx) {
        int depth = 0;
        int i = openIdx;
        while (i < text.length()) {
            int skipped = SourceTextUtils.skipLiteralOrComment(text, i);
            if (skipped != i) {
                i = skipped;
                continue;
            }
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }
}
