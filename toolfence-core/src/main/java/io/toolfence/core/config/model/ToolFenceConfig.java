package io.toolfence.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolFenceConfig(
    ProtocolConfig protocol,
    LoopConfig loop,
    ProviderConfig provider
) {

    public ToolFenceConfig {
        protocol = protocol == null ? ProtocolConfig.defaults() : protocol;
        loop = loop == null ? LoopConfig.defaults() : loop;
        provider = provider == null ? ProviderConfig.defaults() : provider;
    }

    public static ToolFenceConfig defaults() {
        return new ToolFenceConfig(ProtocolConfig.defaults(), LoopConfig.defaults(), ProviderConfig.defaults());
    }
}
