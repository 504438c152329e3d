package io.toolfence.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"extra_headers"}) Map<String, String> extraHeaders
) {

    public ProviderConfig {
        extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
    }

    public static ProviderConfig defaults() {
        return new ProviderConfig("", "https://api.openai.com/v1", Map.of());
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
