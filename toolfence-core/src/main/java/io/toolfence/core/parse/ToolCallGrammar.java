package io.toolfence.core.parse;

/**
 * Set of syntaxes the parser accepts for tool calls in model text.
 */
public enum ToolCallGrammar {
    /** Only {@code ```tool_call} fences holding JSON. */
    JSON(false),
    /** Fences, {@code <tool_call>} tags and {@code [name(key="value")]} call literals. */
    EXTENDED(true);

    private final boolean acceptsTagsAndLiterals;

    ToolCallGrammar(boolean acceptsTagsAndLiterals) {
        this.acceptsTagsAndLiterals = acceptsTagsAndLiterals;
    }

    public boolean acceptsTagsAndLiterals() {
        return acceptsTagsAndLiterals;
    }
}
