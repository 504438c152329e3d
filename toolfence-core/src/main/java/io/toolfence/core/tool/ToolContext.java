package io.toolfence.core.tool;

import java.nio.file.Path;

public record ToolContext(Path workspace, String toolCallId) {

    public ToolContext(Path workspace) {
        this(workspace, null);
    }
}
