package io.toolfence.cli;

import io.toolfence.core.config.ConfigPaths;
import io.toolfence.core.config.ConfigService;
import io.toolfence.core.config.model.ToolFenceConfig;
import io.toolfence.core.tool.ToolRegistry;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    TextModelFactory modelFactory,
    ToolRegistry toolRegistry
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, TextModelFactory.openAiCompatible(), new ToolRegistry());
    }

    public ToolFenceConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }

    public Path resolveWorkspace(String rawPath) {
        return ConfigPaths.forConfigFile(configPath).resolveWorkspace(rawPath);
    }
}
