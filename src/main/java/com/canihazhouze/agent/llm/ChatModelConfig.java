package com.canihazhouze.agent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw chat model client: the OpenAI-compatible one, or the
 * deterministic stand-in when no provider is configured. The engine never
 * injects it directly: ResilientChatModel wraps it with retry, circuit
 * breaker and time limit.
 */
@Configuration
@EnableConfigurationProperties(ChatModelProperties.class)
@RequiredArgsConstructor
@Slf4j
public class ChatModelConfig {

    private final ChatModelProperties props;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        if (props.useDeterministicModel()) {
            log.warn("  Chat model provider : DUMMY (deterministic replies, no endpoint called)");
            log.warn("  Set llm.provider and LLM_API_KEY to use a real model");
            log.info("================================================================");
            return;
        }
        log.info("  Chat model provider : {}", props.getProvider().toUpperCase());
        log.info("  Endpoint            : {}", props.getBaseUrl());
        log.info("  Default model       : {}", props.getDefaultModel());
        String key = props.getApiKey();
        log.info("  Key                 : {}...{}", key.substring(0, Math.min(4, key.length())),
                key.length() > 8 ? key.substring(key.length() - 4) : "");
        log.info("================================================================");
    }

    @Bean("rawChatModel")
    public ChatModelPort rawChatModel(ObjectMapper objectMapper,
                                      @Qualifier("chatModelRestClientBuilder") RestClient.Builder builder) {
        if (props.useDeterministicModel()) {
            return new DeterministicChatModel();
        }
        return new OpenAiChatModel(props, objectMapper, builder.clone());
    }
}
