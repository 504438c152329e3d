package io.toolfence.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolfence.core.format.ToolResultFormatter;
import io.toolfence.core.model.ToolResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "format", description = "Render executed tool results as a tool_result fence")
public final class FormatCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Parameters(index = "0", arity = "1", description = "JSON file holding an array of results")
    Path resultsFile;

    @Override
    public Integer call() {
        try {
            JsonNode root = JSON.readTree(Files.readString(resultsFile));
            System.out.println(new ToolResultFormatter(JSON).format(readResults(root)));
            return 0;
        } catch (Exception e) {
            System.err.println("Format command failed: " + e.getMessage());
            return 1;
        }
    }

    private List<ToolResult> readResults(JsonNode root) {
        List<ToolResult> results = new ArrayList<>();
        for (JsonNode node : root.isArray() ? root : JSON.createArrayNode().add(root)) {
            String name = node.path("name").asText("");
            if (name.isBlank()) {
                throw new IllegalArgumentException("every result needs a name");
            }
            JsonNode id = node.get("id");
            results.add(new ToolResult(
                id == null || id.isNull() ? null : id.asText(),
                name,
                node.get("result"),
                node.path("error").asBoolean(false)
            ));
        }
        return results;
    }
}
