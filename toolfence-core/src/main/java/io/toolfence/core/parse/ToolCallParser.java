package io.toolfence.core.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolfence.core.fence.FenceScanner;
import io.toolfence.core.fence.FenceSpan;
import io.toolfence.core.fence.FenceTag;
import io.toolfence.core.model.ParsedResponse;
import io.toolfence.core.model.ParsedToolCall;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers tool calls from model text.
 *
 * <p>A fence (or tag) body is first read as one JSON value: an array yields one candidate per
 * element, an object is the only candidate. If that fails, each non-blank line is read on its own
 * and lines that are not JSON are skipped. A candidate without a name is dropped without affecting
 * its siblings. Malformed input only ever narrows the result; nothing here throws for it.
 */
public final class ToolCallParser {
    private static final Logger LOG = LoggerFactory.getLogger(ToolCallParser.class);
    private static final Pattern TAG_PATTERN = Pattern.compile(
        "<tool_call>\\s*(.*?)\\s*</tool_call>",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );
    private static final Pattern CALL_LITERAL_PATTERN = Pattern.compile("\\[(\\w+)\\(([^)]*)\\)\\]");
    private static final Pattern NEWLINE_RUN = Pattern.compile("\n{2,}");
    private static final List<String> ARGUMENT_FIELDS = List.of("arguments", "parameters");

    private final ToolCallGrammar grammar;
    private final Supplier<String> idGenerator;
    private final FenceScanner scanner = FenceScanner.forTag(FenceTag.TOOL_CALL);
    private final ObjectMapper mapper;

    public ToolCallParser() {
        this(ToolCallGrammar.JSON);
    }

    public ToolCallParser(ToolCallGrammar grammar) {
        this(grammar, new ToolCallIdGenerator());
    }

    public ToolCallParser(ToolCallGrammar grammar, Supplier<String> idGenerator) {
        this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
        this.mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ToolCallGrammar grammar() {
        return grammar;
    }

    public ParsedResponse parse(String response) {
        String text = response == null ? "" : response;
        List<Match> matches = findMatches(text);
        if (matches.isEmpty()) {
            return new ParsedResponse(List.of(), text);
        }

        List<ParsedToolCall> toolCalls = new ArrayList<>();
        StringBuilder remaining = new StringBuilder();
        int cursor = 0;
        for (Match match : matches) {
            remaining.append(text, cursor, match.start());
            cursor = match.end();
            toolCalls.addAll(toCalls(match));
        }
        remaining.append(text.substring(cursor));

        String textContent = NEWLINE_RUN.matcher(remaining).replaceAll("\n").trim();
        return new ParsedResponse(toolCalls, textContent);
    }

    /**
     * Parses the body of a single fence or tag, delimiters already removed.
     */
    public List<ParsedToolCall> parseBody(String body) {
        String trimmed = body == null ? "" : body.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }

        List<ParsedToolCall> calls = new ArrayList<>();
        JsonNode whole = readJson(trimmed);
        if (whole != null) {
            if (whole.isArray()) {
                for (JsonNode element : whole) {
                    addIfValid(calls, element);
                }
            } else {
                addIfValid(calls, whole);
            }
            return calls;
        }

        for (String line : trimmed.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode candidate = readJson(line.trim());
            if (candidate == null) {
                LOG.debug("Skipping unparseable tool call line");
                continue;
            }
            addIfValid(calls, candidate);
        }
        return calls;
    }

    public boolean hasToolCalls(String response) {
        return response != null && nextMatch(response, 0) != null;
    }

    /**
     * Returns the first call block in {@code response}, delimiters included, or {@code null}.
     */
    public String extractToolCallBlock(String response) {
        if (response == null) {
            return null;
        }
        Match match = nextMatch(response, 0);
        return match == null ? null : response.substring(match.start(), match.end());
    }

    private List<Match> findMatches(String text) {
        List<Match> matches = new ArrayList<>();
        int cursor = 0;
        while (cursor < text.length()) {
            Match match = nextMatch(text, cursor);
            if (match == null) {
                break;
            }
            matches.add(match);
            cursor = match.end();
        }
        return matches;
    }

    private Match nextMatch(String text, int from) {
        Match best = null;
        FenceSpan fence = scanner.findFence(text, from);
        if (fence != null) {
            best = new Match(fence.start(), fence.end(), fence.body(text), null);
        }
        if (!grammar.acceptsTagsAndLiterals()) {
            return best;
        }

        Matcher tag = TAG_PATTERN.matcher(text);
        if (tag.find(from) && (best == null || tag.start() < best.start())) {
            best = new Match(tag.start(), tag.end(), tag.group(1), null);
        }
        Matcher literal = CALL_LITERAL_PATTERN.matcher(text);
        if (literal.find(from) && (best == null || literal.start() < best.start())) {
            best = new Match(literal.start(), literal.end(), literal.group(2), literal.group(1));
        }
        return best;
    }

    private List<ParsedToolCall> toCalls(Match match) {
        if (match.literalName() == null) {
            return parseBody(match.body());
        }
        ObjectNode args = mapper.createObjectNode();
        for (Map.Entry<String, String> entry : CallLiteralArguments.parse(match.body()).entrySet()) {
            args.put(entry.getKey(), entry.getValue());
        }
        return List.of(new ParsedToolCall(idGenerator.get(), match.literalName(), args));
    }

    private void addIfValid(List<ParsedToolCall> calls, JsonNode candidate) {
        ParsedToolCall call = toCall(candidate);
        if (call != null) {
            calls.add(call);
        }
    }

    private ParsedToolCall toCall(JsonNode candidate) {
        if (candidate == null || !candidate.isObject()) {
            LOG.debug("Skipping tool call candidate that is not an object");
            return null;
        }
        JsonNode name = candidate.get("name");
        if (name == null || !name.isTextual() || name.asText().isEmpty()) {
            LOG.debug("Skipping tool call candidate without a name");
            return null;
        }
        return new ParsedToolCall(resolveId(candidate.get("id")), name.asText(), resolveArguments(candidate));
    }

    private String resolveId(JsonNode id) {
        if (id != null && (id.isTextual() || id.isNumber()) && !id.asText().isEmpty()) {
            return id.asText();
        }
        return idGenerator.get();
    }

    private JsonNode resolveArguments(JsonNode candidate) {
        for (String field : ARGUMENT_FIELDS) {
            JsonNode value = candidate.get(field);
            if (!isPresent(value)) {
                continue;
            }
            if (value.isTextual()) {
                JsonNode reparsed = readJson(value.asText());
                return reparsed != null ? reparsed : value;
            }
            return value;
        }
        return mapper.createObjectNode();
    }

    private static boolean isPresent(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            return value.asDouble() != 0;
        }
        return true;
    }

    private JsonNode readJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private record Match(int start, int end, String body, String literalName) {
    }
}
