package io.toolfence.cli;

import io.toolfence.core.config.model.ProviderConfig;
import io.toolfence.core.provider.DisabledTextModel;
import io.toolfence.core.provider.OpenAiCompatTextModel;
import io.toolfence.core.provider.TextModel;

@FunctionalInterface
public interface TextModelFactory {
    String DEFAULT_API_BASE = "https://api.openai.com/v1";

    TextModel create(ProviderConfig provider);

    static TextModelFactory openAiCompatible() {
        return provider -> {
            if (provider == null || !provider.configured()) {
                return new DisabledTextModel("openai_compat", "missing apiKey");
            }
            String apiBase = provider.apiBase() == null || provider.apiBase().isBlank()
                ? DEFAULT_API_BASE
                : provider.apiBase();
            return new OpenAiCompatTextModel("openai_compat", provider.apiKey(), apiBase, provider.extraHeaders());
        };
    }
}
