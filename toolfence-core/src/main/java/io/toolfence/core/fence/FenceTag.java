package io.toolfence.core.fence;

/**
 * Semantic tag following the backticks of a fence opener. Openers are written as
 * {@code ```tool_<keyword>} and read back case-insensitively with {@code _}, {@code -} or no
 * separator.
 */
public enum FenceTag {
    TOOL_CALL("call"),
    TOOL_RESULT("result");

    private final String keyword;

    FenceTag(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public String opener() {
        return FenceScanner.FENCE + FenceScanner.TOOL_PREFIX + "_" + keyword;
    }
}
