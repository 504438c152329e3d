package io.toolfence.core.tool.impl;

import io.toolfence.core.tool.Tool;
import io.toolfence.core.tool.ToolContext;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sample tool for the {@code run} command: reads, writes and lists files under the workspace.
 */
public final class FilesystemTool implements Tool {
    private final WorkspaceGuard guard = new WorkspaceGuard();

    @Override
    public String name() {
        return "filesystem";
    }

    @Override
    public String description() {
        return "Read, write, or list files in the workspace";
    }

    @Override
    public Map<String, Object> schema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("action", property("string", "read, write or list", List.of("read", "write", "list")));
        properties.put("path", property("string", "Path relative to the workspace", null));
        properties.put("content", property("string", "Text to write, only for write", null));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", List.of("action", "path"));
        return schema;
    }

    private static Map<String, Object> property(String type, String description, List<String> allowed) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", type);
        property.put("description", description);
        if (allowed != null) {
            property.put("enum", allowed);
        }
        return property;
    }

    @Override
    public Object execute(Map<String, Object> input, ToolContext context) {
        String action = String.valueOf(input.getOrDefault("action", "")).trim();
        String pathArg = String.valueOf(input.getOrDefault("path", "")).trim();
        if (action.isBlank() || pathArg.isBlank()) {
            throw new IllegalArgumentException("action and path are required");
        }

        Path target = guard.resolve(context, pathArg);
        try {
            return switch (action) {
                case "read" -> readFile(target);
                case "write" -> writeFile(
                    target,
                    guard.display(context.workspace(), target),
                    String.valueOf(input.getOrDefault("content", ""))
                );
                case "list" -> listDirectory(target);
                default -> throw new IllegalArgumentException("unsupported action: " + action);
            };
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String readFile(Path target) throws IOException {
        if (!Files.exists(target)) {
            throw new IllegalArgumentException("file not found: " + target.getFileName());
        }
        if (Files.isDirectory(target)) {
            throw new IllegalArgumentException("path is a directory: " + target.getFileName());
        }
        return Files.readString(target, StandardCharsets.UTF_8);
    }

    private Map<String, Object> writeFile(Path target, String displayPath, String content) throws IOException {
        Files.createDirectories(target.getParent());
        Files.writeString(target, content, StandardCharsets.UTF_8);
        Map<String, Object> written = new LinkedHashMap<>();
        written.put("path", displayPath);
        written.put("bytes", content.getBytes(StandardCharsets.UTF_8).length);
        return written;
    }

    private List<Map<String, String>> listDirectory(Path target) throws IOException {
        if (!Files.exists(target)) {
            throw new IllegalArgumentException("path not found: " + target.getFileName());
        }
        if (!Files.isDirectory(target)) {
            throw new IllegalArgumentException("path is not a directory: " + target.getFileName());
        }

        try (var stream = Files.list(target)) {
            return stream
                .sorted(Comparator.comparing(Path::toString))
                .map(path -> Map.of(
                    "type", Files.isDirectory(path) ? "dir" : "file",
                    "name", target.relativize(path).toString()
                ))
                .toList();
        }
    }
}
