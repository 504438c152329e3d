package io.toolfence.app;

import io.toolfence.cli.CliContext;
import io.toolfence.cli.FormatCommand;
import io.toolfence.cli.ParseCommand;
import io.toolfence.cli.PromptCommand;
import io.toolfence.cli.RunCommand;
import io.toolfence.cli.ScanCommand;
import io.toolfence.cli.StatusCommand;
import io.toolfence.cli.TextModelFactory;
import io.toolfence.cli.ToolFenceCliCommand;
import io.toolfence.core.config.ConfigPaths;
import io.toolfence.core.config.ConfigService;
import io.toolfence.core.tool.ToolRegistry;
import io.toolfence.core.tool.impl.FilesystemTool;
import picocli.CommandLine;

public final class ToolFenceApplication {

    private ToolFenceApplication() {
    }

    public static void main(String[] args) {
        ToolRegistry toolRegistry = new ToolRegistry();
        toolRegistry.register(new FilesystemTool());

        CliContext context = new CliContext(
            new ConfigService(),
            ConfigPaths.fromEnvironment().configFile(),
            TextModelFactory.openAiCompatible(),
            toolRegistry
        );

        CommandLine commandLine = new CommandLine(new ToolFenceCliCommand());
        commandLine.addSubcommand("prompt", new PromptCommand(context));
        commandLine.addSubcommand("parse", new ParseCommand(context));
        commandLine.addSubcommand("scan", new ScanCommand());
        commandLine.addSubcommand("format", new FormatCommand());
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
