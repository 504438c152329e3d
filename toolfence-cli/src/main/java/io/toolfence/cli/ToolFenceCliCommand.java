package io.toolfence.cli;

import picocli.CommandLine.Command;

@Command(
    name = "toolfence",
    mixinStandardHelpOptions = true,
    description = "Text-embedded tool calling for models without native tool support"
)
public final class ToolFenceCliCommand implements Runnable {

    @Override
    public void run() {
        // usage is printed by picocli when no subcommand is given
    }
}
