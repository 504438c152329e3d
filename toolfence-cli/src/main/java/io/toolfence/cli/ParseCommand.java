package io.toolfence.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolfence.core.model.ParsedResponse;
import io.toolfence.core.model.ParsedToolCall;
import io.toolfence.core.parse.ToolCallGrammar;
import io.toolfence.core.parse.ToolCallParser;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "parse", description = "Extract tool calls from a complete model response")
public final class ParseCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Response file, standard input when omitted")
    Path input;

    @Option(names = {"-g", "--grammar"}, description = "JSON or EXTENDED, defaults to the configured grammar")
    ToolCallGrammar grammar;

    public ParseCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ToolCallGrammar effective = grammar != null ? grammar : context.loadConfig().protocol().grammar();
            ParsedResponse parsed = new ToolCallParser(effective).parse(CommandInput.read(input, System.in));
            System.out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(parsed)));
            return 0;
        } catch (Exception e) {
            System.err.println("Parse command failed: " + e.getMessage());
            return 1;
        }
    }

    private ObjectNode toJson(ParsedResponse parsed) {
        ObjectNode root = JSON.createObjectNode();
        ArrayNode calls = root.putArray("toolCalls");
        for (ParsedToolCall call : parsed.toolCalls()) {
            ObjectNode node = calls.addObject();
            node.put("id", call.toolCallId());
            node.put("name", call.toolName());
            node.set("arguments", call.args());
        }
        root.put("textContent", parsed.textContent());
        return root;
    }
}
