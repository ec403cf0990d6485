package org.psyforge.compiler.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The original metadata text together with the spans of its editable values. Rendering splices
 * replacement values into the spans and keeps every other character as it was.
 */
final class SourceTemplate {

    /**
     * A half-open character range of the original text.
     */
    record Span(int start, int end) {
    }

    private final String text;
    private final Map<String, Span> spans;

    SourceTemplate(String text, Map<String, Span> spans) {
        this.text = text;
        this.spans = Collections.unmodifiableMap(new LinkedHashMap<>(spans));
    }

    String text() {
        return text;
    }

    boolean hasSpan(String key) {
        return spans.containsKey(key);
    }

    /**
     * @param replacements New values by span key. Spans without a replacement keep their original text.
     * @return The rendered text.
     */
    String render(Map<String, String> replacements) {
        List<Map.Entry<String, Span>> ordered = new ArrayList<>(spans.entrySet());
        ordered.sort((a, b) -> Integer.compare(a.getValue().start(), b.getValue().start()));
        StringBuilder sb = new StringBuilder(text.length());
        int position = 0;
        for (Map.Entry<String, Span> entry : ordered) {
            Span span = entry.getValue();
            sb.append(text, position, span.start());
            String replacement = replacements.get(entry.getKey());
            sb.append(replacement != null ? replacement : text.substring(span.start(), span.end()));
            position = span.end();
        }
        sb.append(text.substring(position));
        return sb.toString();
    }
}
