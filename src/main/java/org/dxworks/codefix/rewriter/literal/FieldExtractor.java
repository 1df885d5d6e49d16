package org.dxworks.codefix.rewriter.literal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Splits the body of a construction expression into its ordered {@code name: value} fields.
 */
public final class FieldExtractor {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public List<Field> extract(String buffer, Span span) throws MalformedLiteralException {
        int open = buffer.indexOf('{', span.getStart());
        if (open < 0 || open >= span.getEnd() || buffer.charAt(span.getEnd() - 1) != '}') {
            throw new MalformedLiteralException(span, "Span is not a braced literal: " + span);
        }

        Map<String, Field> fields = new LinkedHashMap<>();
        for (Span segment : SourceTextUtils.splitTopLevel(buffer, open + 1, span.getEnd() - 1, ',')) {
            String text = segment.text(buffer);
            if (SourceTextUtils.stripComments(text).isBlank()) {
                continue;
            }

            int colon = SourceTextUtils.indexOfTopLevel(buffer, segment.getStart(), segment.getEnd(), ':');
            if (colon < 0) {
                throw new MalformedLiteralException(span,
                        "Missing ':' in field '" + oneLine(text) + "'");
            }

            String name = SourceTextUtils.stripComments(buffer.substring(segment.getStart(), colon)).trim();
            if (!IDENTIFIER.matcher(name).matches()) {
                throw new MalformedLiteralException(span, "Invalid field name '" + oneLine(name) + "'");
            }

            Span valueSpan = SourceTextUtils.trim(buffer, colon + 1, segment.getEnd());
            String rawValue = SourceTextUtils.stripComments(valueSpan.text(buffer)).strip();
            if (rawValue.isEmpty()) {
                throw new MalformedLiteralException(span, "Field '" + name + "' has no value");
            }
            if (fields.containsKey(name)) {
                throw new MalformedLiteralException(span, "Duplicate field '" + name + "'");
            }
            fields.put(name, new Field(name, rawValue, valueSpan));
        }
        return new ArrayList<>(fields.values());
    }

    private static String oneLine(String text) {
        return text.strip().replaceAll("\\s+", " ");
    }
}
