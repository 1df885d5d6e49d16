package org.dxworks.codefix.rewriter.literal;

import org.dxworks.codefix.model.Diagnostic;
import org.dxworks.codefix.model.DiagnosticKind;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Rewrites every construction expression of one {@link LiteralType} in a buffer.
 * <p>
 * Literals that are left alone (malformed, unmatched, unsupported context) are descended into so
 * that nested candidates are still visited. A rewritten literal is skipped as a whole; literals
 * nested in its values surface in the next pass.
 */
public final class LiteralRewriter {

    private static final String CONTINUATION_CHARS = "(,[=+-*/&|.%^<>!:";

    private final LiteralType type;
    private final TokenScanner scanner;
    private final FieldExtractor extractor = new FieldExtractor();
    private final RewritePolicy policy = new RewritePolicy();
    private final LiteralEmitter emitter;

    public LiteralRewriter(LiteralType type) {
        this.type = Objects.requireNonNull(type, "type");
        this.scanner = new TokenScanner(type.getMarker());
        this.emitter = new LiteralEmitter(type.getMarker());
    }

    public LiteralType getType() {
        return type;
    }

    public TokenScanner getScanner() {
        return scanner;
    }

    public PassResult rewritePass(String buffer) {
        List<Rewrite> rewrites = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<String> helpersUsed = new LinkedHashSet<>();
        Deque<Integer> enclosingEnds = new ArrayDeque<>();
        int rewritten = 0;
        int cursor = 0;
        int consumed = 0;

        while (true) {
            Optional<Span> found;
            try {
                found = scanner.scan(buffer, cursor);
            } catch (UnterminatedLiteralException e) {
                diagnostics.add(diagnostic(DiagnosticKind.UNTERMINATED_LITERAL, buffer, e.getMarkerStart(), e.getMessage()));
                break;
            }
            if (found.isEmpty()) {
                break;
            }

            Span span = found.get();
            while (!enclosingEnds.isEmpty() && enclosingEnds.peek() <= span.getStart()) {
                enclosingEnds.pop();
            }
            boolean nested = !enclosingEnds.isEmpty();
            int bodyStart = span.getStart() + type.getMarker().length() + 1;

            List<Field> fields;
            try {
                fields = extractor.extract(buffer, span);
            } catch (MalformedLiteralException e) {
                diagnostics.add(diagnostic(DiagnosticKind.MALFORMED_LITERAL, buffer, span.getStart(), e.getMessage()));
                enclosingEnds.push(span.getEnd());
                cursor = bodyStart;
                continue;
            }

            RewriteDecision decision = policy.decide(fields, type.getRules());
            if (!decision.isRewrite()) {
                if (decision.getReason() == RewriteDecision.Reason.NO_MATCHING_RULE) {
                    diagnostics.add(diagnostic(DiagnosticKind.NO_MATCHING_RULE, buffer, span.getStart(),
                            "No rule for " + type.getMarker() + " with fields " + fieldNames(fields)));
                }
                enclosingEnds.push(span.getEnd());
                cursor = bodyStart;
                continue;
            }

            EmitContext context = EmitContext.detect(buffer, span, type.getReceiver());
            if (context.isDeclaration() || decision.getExtraFields().isEmpty()) {
                rewrites.add(new Rewrite(span, emitter.render(context, decision)));
            } else if (context.hasReceiver() && !nested && canHoist(buffer, span, consumed)) {
                int lineStart = SourceTextUtils.lineStart(buffer, span.getStart());
                rewrites.add(new Rewrite(new Span(lineStart, lineStart), emitter.renderHoisted(context, decision)));
                rewrites.add(new Rewrite(span, context.getReceiver()));
            } else {
                diagnostics.add(diagnostic(DiagnosticKind.UNSUPPORTED_CONTEXT, buffer, span.getStart(),
                        "Cannot place assignments for " + fieldNames(decision.getExtraFields())
                                + " of an inline " + type.getMarker() + " literal"));
                enclosingEnds.push(span.getEnd());
                cursor = bodyStart;
                continue;
            }

            if (decision.getRule().isHelperCall()) {
                helpersUsed.add(decision.getRule().getHelper());
            }
            rewritten++;
            consumed = span.getEnd();
            cursor = span.getEnd();
        }

        String text = rewrites.isEmpty() ? buffer : Rewrite.apply(buffer, rewrites);
        return new PassResult(text, rewritten, diagnostics, helpersUsed);
    }

    /**
     * Hoisting inserts whole statements above the literal's line, so that line has to start a
     * statement in the same block and must not share text with an earlier rewrite.
     */
    private static boolean canHoist(String buffer, Span span, int consumed) {
        int lineStart = SourceTextUtils.lineStart(buffer, span.getStart());
        if (lineStart < consumed) {
            return false;
        }
        if (continuesEnclosingConstruct(SourceTextUtils.stripComments(
                buffer.substring(lineStart, span.getStart())).strip())) {
            return false;
        }
        String previous = previousCodeLine(buffer, lineStart);
        if (previous.isEmpty()) {
            return true;
        }
        char last = previous.charAt(previous.length() - 1);
        if (last == '{') {
            // block opener "if x {" versus composite literal "T{"
            return previous.length() == 1 || Character.isWhitespace(previous.charAt(previous.length() - 2));
        }
        if (last == ':') {
            return previous.startsWith("case ") || previous.equals("default:");
        }
        return CONTINUATION_CHARS.indexOf(last) < 0;
    }

    // line continues a construct opened above it: "} else if", "}, &T{...})", "case x:"
    private static boolean continuesEnclosingConstruct(String linePrefix) {
        if (linePrefix.isEmpty()) {
            return false;
        }
        char first = linePrefix.charAt(0);
        if (first == '}' || first == ')' || first == ']') {
            return true;
        }
        return startsWithKeyword(linePrefix, "else")
                || startsWithKeyword(linePrefix, "case")
                || startsWithKeyword(linePrefix, "default");
    }

    private static boolean startsWithKeyword(String text, String keyword) {
        return text.startsWith(keyword)
                && (text.length() == keyword.length() || !SourceTextUtils.isIdentifierChar(text.charAt(keyword.length())));
    }

    private static String previousCodeLine(String buffer, int lineStart) {
        int end = lineStart;
        while (end > 0) {
            int start = SourceTextUtils.lineStart(buffer, end - 1);
            String line = SourceTextUtils.stripComments(buffer.substring(start, end)).strip();
            if (!line.isEmpty()) {
                return line;
            }
            end = start;
        }
        return "";
    }

    private static String fieldNames(List<Field> fields) {
        return fields.stream().map(Field::getName).collect(Collectors.joining(", ", "[", "]"));
    }

    private static Diagnostic diagnostic(DiagnosticKind kind, String buffer, int offset, String message) {
        return new Diagnostic(kind, SourceTextUtils.lineNumber(buffer, offset), message);
    }
}
