package org.dxworks.codefix.rewriter;

import org.dxworks.codefix.CodefixConfig;
import org.dxworks.codefix.Language;
import org.dxworks.codefix.model.Diagnostic;
import org.dxworks.codefix.model.DiagnosticKind;
import org.dxworks.codefix.rewriter.literal.*;
import org.dxworks.codefix.rewriter.substitution.SubstitutionPass;
import org.dxworks.codefix.rewriter.substitution.TokenSubstitution;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Per-file pipeline: literal rewriting to a fixed point, helper insertion, then token substitutions.
 * <p>
 * The engine holds only read-only configuration and is safe to share between worker threads.
 */
public class RewriteEngine {

    private final Map<Language, List<LiteralRewriter>> rewritersByLanguage;
    private final SubstitutionPass substitutionPass;
    private final int maxPasses;

    public RewriteEngine(CodefixConfig config) {
        this(config.getLiteralTypes(), config.getSubstitutions(), config.getMaxPasses());
    }

    public RewriteEngine(List<LiteralType> literalTypes, List<TokenSubstitution> substitutions, int maxPasses) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be positive: " + maxPasses);
        }
        Map<Language, List<LiteralRewriter>> byLanguage = new EnumMap<>(Language.class);
        for (LiteralType type : literalTypes) {
            byLanguage.computeIfAbsent(type.getLanguage(), l -> new ArrayList<>()).add(new LiteralRewriter(type));
        }
        this.rewritersByLanguage = byLanguage;
        this.substitutionPass = new SubstitutionPass(substitutions);
        this.maxPasses = maxPasses;
    }

    public FileOutcome rewrite(String filePath, Language language, String source) {
        List<LiteralRewriter> rewriters = rewritersByLanguage.getOrDefault(language, List.of());
        String text = source;
        int literalRewrites = 0;
        List<Diagnostic> diagnostics = List.of();
        List<String> insertedHelpers = new ArrayList<>();

        if (!rewriters.isEmpty() && IdempotenceGuard.hasCandidates(text, scanners(rewriters))) {
            LoopResult loop = rewriteToFixedPoint(text, rewriters);
            text = loop.text;
            literalRewrites += loop.rewrites;
            diagnostics = loop.diagnostics;

            Map<String, String> missing = missingHelperDeclarations(text, rewriters, loop.helpersUsed);
            if (!missing.isEmpty()) {
                text = IdempotenceGuard.insertHelperDeclarations(text, new ArrayList<>(missing.values()));
                insertedHelpers.addAll(missing.keySet());

                // inserted helper bodies may hold literals of their own
                LoopResult again = rewriteToFixedPoint(text, rewriters);
                text = again.text;
                literalRewrites += again.rewrites;
                diagnostics = again.diagnostics;
            }
        }

        int substitutions = 0;
        if (!substitutionPass.isEmpty()) {
            SubstitutionPass.Result result = substitutionPass.apply(text, language);
            text = result.getText();
            substitutions = result.getCount();
        }

        return new FileOutcome(filePath, language, source, text, literalRewrites, substitutions,
                insertedHelpers, diagnostics);
    }

    public boolean handles(Language language) {
        return rewritersByLanguage.containsKey(language) || !substitutionPass.isEmpty();
    }

    private LoopResult rewriteToFixedPoint(String source, List<LiteralRewriter> rewriters) {
        String text = source;
        int total = 0;
        Set<String> helpersUsed = new LinkedHashSet<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (int pass = 1; pass <= maxPasses; pass++) {
            int passRewrites = 0;
            diagnostics = new ArrayList<>();
            for (LiteralRewriter rewriter : rewriters) {
                PassResult result = rewriter.rewritePass(text);
                text = result.getText();
                passRewrites += result.getRewriteCount();
                diagnostics.addAll(result.getDiagnostics());
                helpersUsed.addAll(result.getHelpersUsed());
            }
            if (passRewrites == 0) {
                return new LoopResult(text, total, helpersUsed, diagnostics);
            }
            total += passRewrites;
        }

        diagnostics.add(new Diagnostic(DiagnosticKind.PASS_LIMIT_REACHED, 0,
                "Rewriting did not settle after " + maxPasses + " passes"));
        return new LoopResult(text, total, helpersUsed, diagnostics);
    }

    private static Map<String, String> missingHelperDeclarations(String text, List<LiteralRewriter> rewriters,
                                                                 Set<String> helpersUsed) {
        Map<String, String> missing = new LinkedHashMap<>();
        for (LiteralRewriter rewriter : rewriters) {
            for (Map.Entry<String, String> e : rewriter.getType().getHelperDeclarations().entrySet()) {
                String helper = e.getKey();
                if (helpersUsed.contains(helper)
                        && !missing.containsKey(helper)
                        && IdempotenceGuard.needsHelperDeclaration(text, helper)) {
                    missing.put(helper, e.getValue());
                }
            }
        }
        return missing;
    }

    private static List<TokenScanner> scanners(List<LiteralRewriter> rewriters) {
        return rewriters.stream().map(LiteralRewriter::getScanner).collect(Collectors.toList());
    }

    private static final class LoopResult {
        final String text;
        final int rewrites;
        final Set<String> helpersUsed;
        final List<Diagnostic> diagnostics;

        LoopResult(String text, int rewrites, Set<String> helpersUsed, List<Diagnostic> diagnostics) {
            this.text = text;
            this.rewrites = rewrites;
            this.helpersUsed = helpersUsed;
            this.diagnostics = diagnostics;
        }
    }
}
