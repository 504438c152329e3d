package io.toolfence.cli;

import io.toolfence.core.config.model.ToolFenceConfig;
import io.toolfence.core.tool.Tool;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show protocol and configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ToolFenceConfig config = context.loadConfig();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + context.resolveWorkspace(config.loop().workspace()));
            System.out.println("Grammar: " + config.protocol().grammar());
            System.out.println("Parallel tool calls: " + config.protocol().allowParallelToolCalls());
            System.out.println("Model: " + config.loop().model());
            System.out.println("Max tool iterations: " + config.loop().maxToolIterations());
            System.out.println("Provider configured: " + config.provider().configured());
            System.out.println("Tools: " + context.toolRegistry().all().stream()
                .map(Tool::name)
                .collect(Collectors.joining(", ")));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
