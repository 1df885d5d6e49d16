package org.dxworks.codefix.rewriter.literal;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FieldExtractorTest {

    private final TokenScanner scanner = new TokenScanner("&Widget");
    private final FieldExtractor extractor = new FieldExtractor();

    @Test
    void extract_InlineWithTrailingComma() throws Exception {
        List<Field> fields = extract("&Widget{ Name: \"a\", Size: 3, }");

        assertEquals(2, fields.size());
        assertEquals("Name", fields.get(0).getName());
        assertEquals("\"a\"", fields.get(0).getRawValue());
        assertEquals("Size", fields.get(1).getName());
        assertEquals("3", fields.get(1).getRawValue());
    }

    @Test
    void extract_NestedLiteralValueKeptIntact() throws Exception {
        List<Field> fields = extract("&Widget{ Name: \"a\", Meta: map[string]int{\"x\": 1} }");

        assertEquals("Meta", fields.get(1).getName());
        assertEquals("map[string]int{\"x\": 1}", fields.get(1).getRawValue());
    }

    @Test
    void extract_MultiLineKeepsLineBreaksInValue() throws Exception {
        String buffer = "&Widget{\n"
                + "\tName: \"a\",\n"
                + "\tTags: []string{\n"
                + "\t\t\"x\",\n"
                + "\t\t\"y\",\n"
                + "\t},\n"
                + "}";
        List<Field> fields = extract(buffer);

        assertEquals(2, fields.size());
        assertEquals("[]string{\n\t\t\"x\",\n\t\t\"y\",\n\t}", fields.get(1).getRawValue());
    }

    @Test
    void extract_ValueSpanPointsIntoBuffer() throws Exception {
        String buffer = "x := &Widget{Name:   \"a\"  , Size: f(1, 2)}";
        Span span = scanner.scan(buffer, 0).orElseThrow();
        List<Field> fields = extractor.extract(buffer, span);

        assertEquals("\"a\"", fields.get(0).getValueSpan().text(buffer));
        assertEquals("f(1, 2)", fields.get(1).getValueSpan().text(buffer));
    }

    @Test
    void extract_CommentsAreDropped() throws Exception {
        String buffer = "&Widget{\n"
                + "\t// identity\n"
                + "\tName: \"a\", // primary\n"
                + "\tSize: 3, /* units */\n"
                + "}";
        List<Field> fields = extract(buffer);

        assertEquals(2, fields.size());
        assertEquals("\"a\"", fields.get(0).getRawValue());
        assertEquals("3", fields.get(1).getRawValue());
    }

    @Test
    void extract_ColonsInsideStringsAndCallsIgnored() throws Exception {
        List<Field> fields = extract("&Widget{URL: \"http://x:80\", Slice: items[1:2]}");

        assertEquals("\"http://x:80\"", fields.get(0).getRawValue());
        assertEquals("items[1:2]", fields.get(1).getRawValue());
    }

    @Test
    void extract_EmptyLiteralHasNoFields() throws Exception {
        assertTrue(extract("&Widget{}").isEmpty());
        assertTrue(extract("&Widget{\n}").isEmpty());
    }

    @Test
    void extract_PositionalLiteralIsMalformed() {
        MalformedLiteralException e = assertThrows(MalformedLiteralException.class,
                () -> extract("&Widget{\"a\", 3}"));
        assertTrue(e.getMessage().contains("Missing ':'"));
    }

    @Test
    void extract_DuplicateFieldIsMalformed() {
        MalformedLiteralException e = assertThrows(MalformedLiteralException.class,
                () -> extract("&Widget{Name: \"a\", Name: \"b\"}"));
        assertTrue(e.getMessage().contains("Duplicate field 'Name'"));
    }

    @Test
    void extract_MissingValueIsMalformed() {
        assertThrows(MalformedLiteralException.class, () -> extract("&Widget{Name: }"));
    }

    @Test
    void extract_NonIdentifierNameIsMalformed() {
        assertThrows(MalformedLiteralException.class, () -> extract("&Widget{\"key\": 1}"));
    }

    private List<Field> extract(String buffer) throws Exception {
        Span span = scanner.scan(buffer, 0).orElseThrow();
        return extractor.extract(buffer, span);
    }
}
