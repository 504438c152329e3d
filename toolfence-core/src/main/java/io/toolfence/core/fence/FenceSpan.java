package io.toolfence.core.fence;

/**
 * Offsets of one complete fence inside a text. {@code start..end} covers both delimiters,
 * {@code bodyStart..bodyEnd} only the payload between them.
 */
public record FenceSpan(int start, int bodyStart, int bodyEnd, int end) {

    public String block(String text) {
        return text.substring(start, end);
    }

    public String body(String text) {
        return text.substring(bodyStart, bodyEnd);
    }
}
