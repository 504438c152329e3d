package io.toolfence.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolfence.core.fence.FenceDetection;
import io.toolfence.core.fence.FenceTag;
import io.toolfence.core.fence.StreamingFenceDetector;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Replays a response through the fence detector in fixed-size chunks and prints one JSON event
 * per line: {@code text} for released prose, {@code fence} for a complete fence, and a final
 * {@code flush} for whatever was still buffered.
 */
@Command(name = "scan", description = "Replay a response through the streaming fence detector")
public final class ScanCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Parameters(index = "0", arity = "0..1", description = "Response file, standard input when omitted")
    Path input;

    @Option(names = {"-c", "--chunk-size"}, defaultValue = "8", description = "Characters per simulated chunk")
    int chunkSize;

    @Option(names = "--tag", defaultValue = "TOOL_CALL", description = "TOOL_CALL or TOOL_RESULT")
    FenceTag tag;

    @Override
    public Integer call() {
        try {
            if (chunkSize < 1) {
                throw new IllegalArgumentException("chunk size must be positive");
            }
            String text = CommandInput.read(input, System.in);
            StreamingFenceDetector detector = new StreamingFenceDetector(tag);
            for (int i = 0; i < text.length(); i += chunkSize) {
                detector.addChunk(text.substring(i, Math.min(text.length(), i + chunkSize)));
                drain(detector);
            }
            print("flush", detector.flush());
            return 0;
        } catch (Exception e) {
            System.err.println("Scan command failed: " + e.getMessage());
            return 1;
        }
    }

    private void drain(StreamingFenceDetector detector) throws JsonProcessingException {
        while (true) {
            FenceDetection detection = detector.detectFence();
            print("text", detection.prefixText());
            if (!detection.hasFence()) {
                return;
            }
            print("fence", detection.fence());
        }
    }

    private void print(String type, String value) throws JsonProcessingException {
        if (value == null || value.isEmpty()) {
            return;
        }
        ObjectNode event = JSON.createObjectNode();
        event.put("type", type);
        event.put("value", value);
        System.out.println(JSON.writeValueAsString(event));
    }
}
