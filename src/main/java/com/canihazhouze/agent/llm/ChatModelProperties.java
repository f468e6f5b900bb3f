package com.canihazhouze.agent.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the chat model endpoint.
 * Bound from application.yml under the "llm" prefix.
 */
@ConfigurationProperties(prefix = "llm")
@Data
public class ChatModelProperties {

    /** openai | azure | dummy */
    private String provider = "openai";

    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey = "";

    /** Only used by the azure provider */
    private String apiVersion = "2024-06-01";

    /** Used when an agent does not name a model */
    private String defaultModel = "gpt-4o-mini";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(60);

    private int maxConnections = 50;

    public boolean isAzure() {
        return "azure".equalsIgnoreCase(provider);
    }

    /** No real endpoint: the provider is "dummy", or there is no key to call one with. */
    public boolean useDeterministicModel() {
        return "dummy".equalsIgnoreCase(provider) || apiKey == null || apiKey.isBlank();
    }
}
