package io.toolfence.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolfence.core.model.MessageRole;
import io.toolfence.core.model.TextMessage;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams completions from an OpenAI-compatible {@code /chat/completions} endpoint without sending
 * any tool definitions. Tool use is carried entirely in the text.
 */
public final class OpenAiCompatTextModel implements TextModel {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatTextModel.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String ERROR_PREFIX = "Error calling LLM: ";
    static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final String name;
    private final String apiKey;
    private final HttpUrl completionsUrl;
    private final Headers headers;
    private final OkHttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();
    private final int maxAttempts;

    public OpenAiCompatTextModel(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, extraHeaders, DEFAULT_MAX_ATTEMPTS);
    }

    public OpenAiCompatTextModel(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        int maxAttempts
    ) {
        this(name, apiKey, apiBase, extraHeaders, maxAttempts, defaultClient());
    }

    OpenAiCompatTextModel(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        int maxAttempts,
        OkHttpClient client
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.completionsUrl = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"))
            .newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
        this.headers = buildHeaders(this.apiKey, extraHeaders);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    private static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
    }

    private static Headers buildHeaders(String apiKey, Map<String, String> extraHeaders) {
        Headers.Builder builder = new Headers.Builder()
            .set("Authorization", "Bearer " + apiKey)
            .set("Accept", "application/json, text/event-stream");
        if (extraHeaders != null) {
            extraHeaders.forEach(builder::set);
        }
        return builder.build();
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Retries on 429, 5xx and I/O failures only while nothing has been delivered yet; a stream that
     * breaks midway is left truncated so no chunk is ever repeated. Terminal failures arrive as one
     * chunk starting with {@value #ERROR_PREFIX}.
     */
    @Override
    public void stream(String model, String systemPrompt, List<TextMessage> messages, Consumer<String> chunks) {
        if (apiKey.isEmpty()) {
            chunks.accept(ERROR_PREFIX + "missing API key for model " + name);
            return;
        }

        Request request;
        try {
            request = new Request.Builder()
                .url(completionsUrl)
                .headers(headers)
                .post(RequestBody.create(payload(model, systemPrompt, messages), JSON))
                .build();
        } catch (JsonProcessingException e) {
            chunks.accept(ERROR_PREFIX + "could not encode request: " + e.getOriginalMessage());
            return;
        }

        DeliveryTracker delivery = new DeliveryTracker(chunks);
        Backoff backoff = new Backoff(maxAttempts);
        while (true) {
            Failure failure = attempt(request, delivery);
            if (failure == null) {
                return;
            }
            if (delivery.delivered()) {
                LOG.warn("Stream from {} broke after partial delivery: {}", name, failure.message());
                return;
            }
            if (!failure.retryable() || !backoff.pause()) {
                chunks.accept(ERROR_PREFIX + failure.message());
                return;
            }
            LOG.debug("Retrying {} after: {}", name, failure.message());
        }
    }

    private Failure attempt(Request request, DeliveryTracker delivery) {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                String detail = body == null ? "" : body.string();
                int code = response.code();
                return new Failure("HTTP " + code + " " + detail, code == 429 || code >= 500);
            }
            if (body == null) {
                return null;
            }
            if (response.header("Content-Type", "").contains("text/event-stream")) {
                readSse(body.source(), delivery);
            } else {
                readJson(body.string(), delivery);
            }
            return null;
        } catch (IOException e) {
            LOG.debug("Request to {} failed", name, e);
            return new Failure(String.valueOf(e.getMessage()), true);
        }
    }

    private String payload(String model, String systemPrompt, List<TextMessage> messages)
        throws JsonProcessingException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model);
        ArrayNode wire = payload.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            wire.addObject().put("role", "system").put("content", systemPrompt);
        }
        for (TextMessage message : messages) {
            wire.addObject().put("role", toRoleValue(message.role())).put("content", message.content());
        }
        payload.put("stream", true);
        return mapper.writeValueAsString(payload);
    }

    private String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case ASSISTANT -> "assistant";
            case USER, TOOL -> "user";
        };
    }

    private void readJson(String body, DeliveryTracker delivery) throws IOException {
        JsonNode root = mapper.readTree(body);
        delivery.accept(root.path("choices").path(0).path("message").path("content").asText(""));
    }

    private void readSse(BufferedSource source, DeliveryTracker delivery) throws IOException {
        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null || line.isBlank() || !line.startsWith("data:")) {
                continue;
            }
            String payload = line.substring(5).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                break;
            }

            JsonNode event = mapper.readTree(payload);
            for (JsonNode choice : event.path("choices")) {
                JsonNode content = choice.path("delta").path("content");
                if (!content.isMissingNode() && !content.isNull()) {
                    delivery.accept(content.asText(""));
                }
            }
        }
    }

    private record Failure(String message, boolean retryable) {
    }

    /**
     * Exponential pause between attempts, 250 ms doubling up to 2 s.
     */
    private static final class Backoff {
        private final int maxAttempts;
        private int attempts = 1;
        private long delayMs = 250;

        private Backoff(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        boolean pause() {
            if (attempts >= maxAttempts) {
                return false;
            }
            attempts++;
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            delayMs = Math.min(delayMs * 2, 2000);
            return true;
        }
    }

    private static final class DeliveryTracker {
        private final Consumer<String> target;
        private boolean delivered;

        private DeliveryTracker(Consumer<String> target) {
            this.target = target;
        }

        void accept(String chunk) {
            if (chunk == null || chunk.isEmpty()) {
                return;
            }
            delivered = true;
            target.accept(chunk);
        }

        boolean delivered() {
            return delivered;
        }
    }
}
