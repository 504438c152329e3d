package io.toolfence.cli;

import io.toolfence.core.agent.LoopResult;
import io.toolfence.core.agent.LoopSettings;
import io.toolfence.core.agent.TextToolLoop;
import io.toolfence.core.config.model.ToolFenceConfig;
import io.toolfence.core.model.ParsedToolCall;
import io.toolfence.core.parse.ToolCallGrammar;
import io.toolfence.core.parse.ToolCallParser;
import io.toolfence.core.stream.StreamListener;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "run", description = "Run a prompt through the text tool loop")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Prompt to send")
    String prompt;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"-g", "--grammar"}, description = "Grammar override, JSON or EXTENDED")
    ToolCallGrammar grammar;

    @Option(names = {"-v", "--verbose"}, description = "Print tool calls to stderr as they are recovered")
    boolean verbose;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ToolFenceConfig config = context.loadConfig();
            LoopSettings settings = new LoopSettings(
                config.loop().systemPrompt(),
                model != null ? model : config.loop().model(),
                config.loop().maxToolIterations(),
                config.protocol().promptOptions()
            );
            ToolCallParser parser = new ToolCallParser(grammar != null ? grammar : config.protocol().grammar());
            TextToolLoop loop = new TextToolLoop(
                context.modelFactory().create(config.provider()),
                context.toolRegistry(),
                parser
            );

            Path workspace = context.resolveWorkspace(config.loop().workspace());
            LoopResult result = loop.run(prompt, settings, workspace, verbose ? new CallEcho() : StreamListener.noop());
            System.out.println(result.content());
            return 0;
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }

    private static final class CallEcho implements StreamListener {
        @Override
        public void onToolCall(ParsedToolCall call) {
            System.err.println("-> " + call.toolName() + " " + call.args());
        }
    }
}
