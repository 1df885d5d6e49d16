package org.dxworks.codefix.rewriter.literal;

import org.dxworks.codefix.Language;
import org.dxworks.codefix.model.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class LiteralRewriterTest {

    private static final RewriteRule NEW_WIDGET = RewriteRule.of("newWidget", "Name", "Size");

    private final LiteralRewriter rewriter = new LiteralRewriter(LiteralType.of("&Widget", NEW_WIDGET));
    private final LiteralRewriter hoisting = new LiteralRewriter(
            new LiteralType("&Widget", Language.GO, "widget", List.of(NEW_WIDGET), Map.of()));

    @Test
    void rewritePass_DeclarationExactFields() {
        PassResult result = rewriter.rewritePass("\tw := &Widget{Name: \"a\", Size: 3}\n");

        assertEquals("\tw := newWidget(\"a\", 3)\n", result.getText());
        assertEquals(1, result.getRewriteCount());
        assertEquals(Set.of("newWidget"), result.getHelpersUsed());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    void rewritePass_DeclarationWithExtraFields() {
        String source = "func f() {\n"
                + "\tw := &Widget{\n"
                + "\t\tName:  \"a\",\n"
                + "\t\tSize:  3,\n"
                + "\t\tColor: \"red\", // primary\n"
                + "\t}\n"
                + "\tuse(w)\n"
                + "}\n";

        PassResult result = rewriter.rewritePass(source);

        assertEquals("func f() {\n"
                + "\tw := newWidget(\"a\", 3)\n"
                + "\tw.Color = \"red\"\n"
                + "\tuse(w)\n"
                + "}\n", result.getText());
    }

    @Test
    void rewritePass_FieldAssignmentKeepsTarget() {
        PassResult result = rewriter.rewritePass("\ts.child = &Widget{Name: \"a\", Size: 3, Color: \"red\"}\n");

        assertEquals("\ts.child = newWidget(\"a\", 3)\n\ts.child.Color = \"red\"\n", result.getText());
    }

    @Test
    void rewritePass_InlineExactFields() {
        PassResult result = rewriter.rewritePass("\tregister(&Widget{Name: \"a\", Size: 3})\n");

        assertEquals("\tregister(newWidget(\"a\", 3))\n", result.getText());
    }

    @Test
    void rewritePass_NoMatchingRuleLeavesTextAndReports() {
        String source = "package p\n\nvar w = &Widget{Name: \"a\"}\n";

        PassResult result = rewriter.rewritePass(source);

        assertEquals(source, result.getText());
        assertEquals(0, result.getRewriteCount());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticKind.NO_MATCHING_RULE, result.getDiagnostics().get(0).kind);
        assertEquals(3, result.getDiagnostics().get(0).line);
    }

    @Test
    void rewritePass_InlineWithExtrasIsHoisted() {
        String source = "func f() {\n"
                + "\tregister(&Widget{Name: \"a\", Size: 3, Color: \"red\"})\n"
                + "}\n";

        PassResult result = hoisting.rewritePass(source);

        assertEquals("func f() {\n"
                + "\twidget := newWidget(\"a\", 3)\n"
                + "\twidget.Color = \"red\"\n"
                + "\tregister(widget)\n"
                + "}\n", result.getText());
    }

    @Test
    void rewritePass_InlineWithExtrasWithoutReceiverIsReported() {
        String source = "func f() {\n\tregister(&Widget{Name: \"a\", Size: 3, Color: \"red\"})\n}\n";

        PassResult result = rewriter.rewritePass(source);

        assertEquals(source, result.getText());
        assertEquals(DiagnosticKind.UNSUPPORTED_CONTEXT, result.getDiagnostics().get(0).kind);
    }

    @Test
    void rewritePass_NoHoistingIntoContinuedExpression() {
        String source = "func f() {\n"
                + "\tregister(ctx,\n"
                + "\t\t&Widget{Name: \"a\", Size: 3, Color: \"red\"})\n"
                + "}\n";

        PassResult result = hoisting.rewritePass(source);

        assertEquals(source, result.getText());
        assertEquals(DiagnosticKind.UNSUPPORTED_CONTEXT, result.getDiagnostics().get(0).kind);
    }

    @Test
    void rewritePass_NoHoistingFromElseIfLine() {
        String source = "func f() {\n"
                + "\tif a {\n"
                + "\t\tx()\n"
                + "\t} else if err := add(&Widget{Name: \"a\", Size: 3, Color: \"red\"}); err != nil {\n"
                + "\t\ty()\n"
                + "\t}\n"
                + "}\n";

        PassResult result = hoisting.rewritePass(source);

        assertEquals(source, result.getText());
        assertEquals(0, result.getRewriteCount());
        assertEquals(DiagnosticKind.UNSUPPORTED_CONTEXT, result.getDiagnostics().get(0).kind);
        assertEquals(4, result.getDiagnostics().get(0).line);
    }

    @Test
    void rewritePass_NoHoistingAfterClosingClosureArgument() {
        String source = "func f() {\n"
                + "\trun(func() {\n"
                + "\t\tx()\n"
                + "\t}, &Widget{Name: \"a\", Size: 3, Color: \"red\"})\n"
                + "}\n";

        PassResult result = hoisting.rewritePass(source);

        assertEquals(source, result.getText());
        assertEquals(DiagnosticKind.UNSUPPORTED_CONTEXT, result.getDiagnostics().get(0).kind);
    }

    @Test
    void rewritePass_NoHoistingFromCaseLine() {
        String source = "switch k {\n"
                + "case pick(&Widget{Name: \"a\", Size: 3, Color: \"red\"}):\n"
                + "\tx()\n"
                + "}\n";

        PassResult result = hoisting.rewritePass(source);

        assertEquals(source, result.getText());
        assertEquals(DiagnosticKind.UNSUPPORTED_CONTEXT, result.getDiagnostics().get(0).kind);
    }

    @Test
    void rewritePass_ElseIfWithoutExtraFieldsStillRewritten() {
        String source = "\t} else if err := add(&Widget{Name: \"a\", Size: 3}); err != nil {\n";

        PassResult result = hoisting.rewritePass(source);

        assertEquals("\t} else if err := add(newWidget(\"a\", 3)); err != nil {\n", result.getText());
    }

    @Test
    void rewritePass_AssignmentRuleMovesEveryField() {
        LiteralRewriter assignments = new LiteralRewriter(new LiteralType("&storage.MetricsSnapshot", Language.GO,
                "storageSnapshot", List.of(RewriteRule.assignments()), Map.of()));
        String source = "\t\tstorageSnapshot := &storage.MetricsSnapshot{\n"
                + "\t\t\tSerial:    serial,\n"
                + "\t\t\tPageCount: pages, // total\n"
                + "\t\t}\n"
                + "\t\tsave(storageSnapshot)\n";

        PassResult first = assignments.rewritePass(source);
        PassResult second = assignments.rewritePass(first.getText());

        assertEquals("\t\tstorageSnapshot := &storage.MetricsSnapshot{}\n"
                + "\t\tstorageSnapshot.Serial = serial\n"
                + "\t\tstorageSnapshot.PageCount = pages\n"
                + "\t\tsave(storageSnapshot)\n", first.getText());
        assertTrue(first.getHelpersUsed().isEmpty());
        assertEquals(first.getText(), second.getText());
        assertEquals(0, second.getRewriteCount());
    }

    @Test
    void rewritePass_AssignmentRuleHoistsInlineLiteral() {
        LiteralRewriter assignments = new LiteralRewriter(new LiteralType("&storage.MetricsSnapshot", Language.GO,
                "storageSnapshot", List.of(RewriteRule.assignments()), Map.of()));
        String source = "func f() {\n\tsave(&storage.MetricsSnapshot{Serial: s})\n}\n";

        PassResult result = assignments.rewritePass(source);

        assertEquals("func f() {\n"
                + "\tstorageSnapshot := &storage.MetricsSnapshot{}\n"
                + "\tstorageSnapshot.Serial = s\n"
                + "\tsave(storageSnapshot)\n"
                + "}\n", result.getText());
    }

    @Test
    void rewritePass_MalformedLiteralReported() {
        String source = "w := &Widget{\"a\", 3}\n";

        PassResult result = rewriter.rewritePass(source);

        assertEquals(source, result.getText());
        assertEquals(DiagnosticKind.MALFORMED_LITERAL, result.getDiagnostics().get(0).kind);
    }

    @Test
    void rewritePass_UnterminatedLiteralStopsScan() {
        String source = "a := &Widget{Name: \"a\", Size: 1}\nb := &Widget{Name: \"b\",\n";

        PassResult result = rewriter.rewritePass(source);

        assertEquals("a := newWidget(\"a\", 1)\nb := &Widget{Name: \"b\",\n", result.getText());
        assertEquals(DiagnosticKind.UNTERMINATED_LITERAL, result.getDiagnostics().get(0).kind);
        assertEquals(2, result.getDiagnostics().get(0).line);
    }

    @Test
    void rewritePass_EmptyLiteralUntouched() {
        String source = "w := &Widget{}\n";

        PassResult result = rewriter.rewritePass(source);

        assertEquals(source, result.getText());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    void rewritePass_DescendsIntoUnmatchedLiteral() {
        String source = "w := &Widget{Name: \"outer\", Child: &Widget{Name: \"inner\", Size: 2}}\n";

        PassResult result = rewriter.rewritePass(source);

        assertEquals("w := &Widget{Name: \"outer\", Child: newWidget(\"inner\", 2)}\n", result.getText());
        assertEquals(DiagnosticKind.NO_MATCHING_RULE, result.getDiagnostics().get(0).kind);
    }

    @Test
    void rewritePass_StringsAndCommentsUntouched() {
        String source = "// w := &Widget{Name: \"a\", Size: 3}\ns := \"&Widget{Name: \\\"a\\\", Size: 3}\"\n";

        PassResult result = rewriter.rewritePass(source);

        assertEquals(source, result.getText());
        assertEquals(0, result.getRewriteCount());
    }
}
