package io.toolfence.core.fence;

import java.util.Objects;

/**
 * Cursor-based matcher for fence markers. Instances hold no matching state between calls, so a
 * single scanner can be shared by any number of detectors and parsers.
 */
public final class FenceScanner {
    static final String FENCE = "```";
    static final String TOOL_PREFIX = "tool";

    private static final int NO_MATCH = -1;
    private static final int PARTIAL = -2;

    private final FenceTag tag;

    private FenceScanner(FenceTag tag) {
        this.tag = Objects.requireNonNull(tag, "tag must not be null");
    }

    public static FenceScanner forTag(FenceTag tag) {
        return new FenceScanner(tag);
    }

    public FenceTag tag() {
        return tag;
    }

    /**
     * Length of the longest opener variant, e.g. 12 for {@code ```tool_call}. A tail that may still
     * grow into an opener is always shorter than this.
     */
    public int longestOpenerLength() {
        return FENCE.length() + TOOL_PREFIX.length() + 1 + tag.keyword().length();
    }

    /**
     * Finds the first full opener at or after {@code from}.
     *
     * @return the opener offsets, or {@code null}
     */
    public Opener findOpener(String text, int from) {
        int cursor = Math.max(0, from);
        while (cursor < text.length()) {
            int candidate = text.indexOf(FENCE, cursor);
            if (candidate < 0) {
                return null;
            }
            int end = matchOpenerAt(text, candidate);
            if (end >= 0) {
                return new Opener(candidate, end);
            }
            cursor = candidate + 1;
        }
        return null;
    }

    public int findCloser(String text, int from) {
        return text.indexOf(FENCE, Math.max(0, from));
    }

    /**
     * Finds the first complete opener-to-closer span at or after {@code from}.
     */
    public FenceSpan findFence(String text, int from) {
        Opener opener = findOpener(text, from);
        if (opener == null) {
            return null;
        }
        int closer = findCloser(text, opener.end());
        if (closer < 0) {
            return null;
        }
        return new FenceSpan(opener.start(), opener.end(), closer, closer + FENCE.length());
    }

    /**
     * Text of the first complete fence in {@code text}, delimiters included, or {@code null}.
     */
    public String extractBlock(String text) {
        if (text == null) {
            return null;
        }
        FenceSpan span = findFence(text, 0);
        return span == null ? null : span.block(text);
    }

    /**
     * End offset of an opener that starts exactly at {@code at}, or -1.
     */
    public int openerEndAt(String text, int at) {
        int end = matchOpenerAt(text, at);
        return end >= 0 ? end : NO_MATCH;
    }

    /**
     * Index of the earliest suffix of {@code text} that is an incomplete opener, or
     * {@code text.length()} when no suffix could still become one.
     */
    public int partialOpenerStart(String text) {
        int from = Math.max(0, text.length() - (longestOpenerLength() - 1));
        for (int i = from; i < text.length(); i++) {
            if (text.charAt(i) == '`' && matchOpenerAt(text, i) == PARTIAL) {
                return i;
            }
        }
        return text.length();
    }

    public record Opener(int start, int end) {
    }

    private int matchOpenerAt(String text, int at) {
        int cursor = at;
        for (int i = 0; i < FENCE.length(); i++) {
            if (cursor >= text.length()) {
                return PARTIAL;
            }
            if (text.charAt(cursor) != '`') {
                return NO_MATCH;
            }
            cursor++;
        }
        cursor = matchWord(text, cursor, TOOL_PREFIX);
        if (cursor < 0) {
            return cursor;
        }
        if (cursor >= text.length()) {
            return PARTIAL;
        }
        char separator = text.charAt(cursor);
        if (separator == '_' || separator == '-') {
            cursor++;
        }
        return matchWord(text, cursor, tag.keyword());
    }

    private static int matchWord(String text, int at, String word) {
        int cursor = at;
        for (int i = 0; i < word.length(); i++) {
            if (cursor >= text.length()) {
                return PARTIAL;
            }
            if (Character.toLowerCase(text.charAt(cursor)) != word.charAt(i)) {
                return NO_MATCH;
            }
            cursor++;
        }
        return cursor;
    }
}
