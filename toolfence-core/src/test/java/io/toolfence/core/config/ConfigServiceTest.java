package io.toolfence.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.toolfence.core.config.model.ProviderConfig;
import io.toolfence.core.config.model.ToolFenceConfig;
import io.toolfence.core.parse.ToolCallGrammar;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {
    private final ConfigService service = new ConfigService();

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnDefaultsWhenFileIsMissing() throws Exception {
        ToolFenceConfig config = service.load(tempDir.resolve("missing.json"));

        assertThat(config).isEqualTo(ToolFenceConfig.defaults());
        assertThat(config.protocol().grammar()).isEqualTo(ToolCallGrammar.JSON);
        assertThat(config.provider().configured()).isFalse();
    }

    @Test
    void shouldMergePartialFileOverDefaults() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "protocol": { "grammar": "extended" },
              "loop": { "model": "local-llama" },
              "provider": { "apiKey": "sk-test", "unknown": true }
            }
            """);

        ToolFenceConfig config = service.load(configPath);

        assertThat(config.protocol().grammar()).isEqualTo(ToolCallGrammar.EXTENDED);
        assertThat(config.protocol().allowParallelToolCalls()).isFalse();
        assertThat(config.loop().model()).isEqualTo("local-llama");
        assertThat(config.loop().maxToolIterations()).isEqualTo(10);
        assertThat(config.provider().configured()).isTrue();
        assertThat(config.provider().apiBase()).isEqualTo("https://api.openai.com/v1");
    }

    @Test
    void shouldSaveAndReloadConfig() throws Exception {
        Path configPath = tempDir.resolve("nested/config.json");
        ToolFenceConfig defaults = ToolFenceConfig.defaults();
        ToolFenceConfig config = new ToolFenceConfig(
            defaults.protocol(),
            defaults.loop(),
            new ProviderConfig("sk-1", "http://localhost:8080/v1", Map.of("X-Team", "core"))
        );

        service.save(configPath, config);

        assertThat(service.load(configPath)).isEqualTo(config);
        assertThat(service.toPrettyJson(config)).contains("\"grammar\" : \"JSON\"");
    }
}
