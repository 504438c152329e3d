package io.toolfence.core.tool.impl;

import io.toolfence.core.tool.ToolContext;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Confines tool paths to the workspace of the current call.
 */
public final class WorkspaceGuard {

    public Path resolve(ToolContext context, String rawPath) {
        if (context == null || context.workspace() == null) {
            throw new IllegalArgumentException("Workspace is not configured");
        }
        return resolve(context.workspace(), rawPath);
    }

    public Path resolve(Path workspace, String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        Path root = root(workspace);
        Path requested;
        try {
            requested = Path.of(rawPath.trim());
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path: " + rawPath, e);
        }

        Path resolved = (requested.isAbsolute() ? requested : root.resolve(requested)).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes workspace: " + rawPath);
        }
        return resolved;
    }

    /**
     * Workspace-relative form of {@code resolved} with forward slashes, as shown to the model.
     */
    public String display(Path workspace, Path resolved) {
        String relative = root(workspace).relativize(resolved).toString().replace('\\', '/');
        return relative.isEmpty() ? "." : relative;
    }

    private static Path root(Path workspace) {
        return workspace.toAbsolutePath().normalize();
    }
}
