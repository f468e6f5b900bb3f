package com.canihazhouze.agent.llm;

import com.canihazhouze.agent.model.Message;
import com.canihazhouze.agent.tool.ToolDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions client. Works against api.openai.com and
 * against Azure OpenAI deployments (provider = azure), where the model name is
 * the deployment name.
 *
 * Error mapping:
 *
 * | Response               | Kind      |
 * |------------------------|-----------|
 * | 429, 408, 5xx          | TRANSIENT |
 * | network error, timeout | TRANSIENT |
 * | 401, 403, other 4xx    | FATAL     |
 * | no choices / bad JSON  | MALFORMED |
 */
@Slf4j
public class OpenAiChatModel implements ChatModelPort {

    private final ChatModelProperties props;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public OpenAiChatModel(ChatModelProperties props,
                           ObjectMapper objectMapper,
                           RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;

        RestClient.Builder builder = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Content-Type", "application/json");
        if (props.isAzure()) {
            builder.defaultHeader("api-key", props.getApiKey());
        } else {
            builder.defaultHeader("Authorization", "Bearer " + props.getApiKey());
        }
        this.restClient = builder.build();
    }

    @Override
    public ChatCompletion complete(List<Message> messages, GenerationOptions options, List<ToolDescriptor> tools) {
        String model = resolveModel(options);
        Map<String, Object> requestBody = buildRequestBody(model, messages, options, tools);

        log.debug("Sending {} messages to {} [model={}]", messages.size(), props.getProvider(), model);

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri(completionsPath(model))
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", props.getProvider(), res.getStatusCode(), body);
                        throw classify4xx(res.getStatusCode().value(), body, model);
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", props.getProvider(), res.getStatusCode(), body);
                        throw ChatModelException.transientFailure(
                                props.getProvider() + " server error [" + res.getStatusCode() + "]", null);
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (ResourceAccessException e) {
            throw ChatModelException.transientFailure(
                    props.getProvider() + " unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ChatModelException(ChatModelException.Kind.MALFORMED,
                    props.getProvider() + " returned an unreadable response: " + e.getMessage(), e);
        }

        return parseResponse(response);
    }

    private String resolveModel(GenerationOptions options) {
        return options.getModel() == null || options.getModel().isBlank()
                ? props.getDefaultModel()
                : options.getModel();
    }

    private String completionsPath(String model) {
        if (props.isAzure()) {
            return "/openai/deployments/" + model + "/chat/completions?api-version=" + props.getApiVersion();
        }
        return "/chat/completions";
    }

    private ChatModelException classify4xx(int statusCode, String body, String model) {
        if (statusCode == 429 || statusCode == 408) {
            return ChatModelException.transientFailure(
                    props.getProvider() + " throttled the request [" + statusCode + "]", null);
        }
        if (statusCode == 401 || statusCode == 403) {
            return ChatModelException.fatal(props.getProvider()
                    + " rejected the credentials. Check the LLM_API_KEY environment variable.");
        }
        if (statusCode == 404) {
            return ChatModelException.fatal("Model deployment '" + model + "' not found");
        }
        return ChatModelException.fatal(props.getProvider() + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(String model,
                                                 List<Message> messages,
                                                 GenerationOptions options,
                                                 List<ToolDescriptor> tools) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("max_tokens", options.getMaxTokens());
        body.put("temperature", options.getTemperature());
        body.put("top_p", options.getTopP());
        body.put("frequency_penalty", options.getFrequencyPenalty());
        body.put("presence_penalty", options.getPresencePenalty());
        body.put("messages", messages.stream().map(this::formatMessage).toList());

        if (tools != null && !tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDescriptor::toFunctionSpec).toList());
            body.put("tool_choice", "auto");
        }
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        } else if (msg.getRole() == Message.Role.assistant) {
            // null content is valid when the assistant only called tools
            m.put("content", msg.getContent());
            if (msg.getToolCalls() != null && !msg.getToolCalls().isEmpty()) {
                m.put("tool_calls", msg.getToolCalls().stream().map(this::formatToolCall).toList());
            }
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCallRequest tc) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", tc.getName());
        fn.put("arguments", tc.getArguments() != null ? tc.getArguments() : "{}");

        Map<String, Object> tcMap = new HashMap<>();
        tcMap.put("id", tc.getId());
        tcMap.put("type", "function");
        tcMap.put("function", fn);
        return tcMap;
    }

    @SuppressWarnings("unchecked")
    private ChatCompletion parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw ChatModelException.malformed(props.getProvider() + " returned an empty body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw ChatModelException.malformed(props.getProvider() + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        if (message == null) {
            throw ChatModelException.malformed(props.getProvider() + " returned a choice without a message");
        }

        List<ToolCallRequest> toolCalls = new ArrayList<>();
        List<Map<String, Object>> rawCalls = (List<Map<String, Object>>) message.get("tool_calls");
        if (rawCalls != null) {
            for (Map<String, Object> raw : rawCalls) {
                Map<String, Object> function = (Map<String, Object>) raw.get("function");
                if (function == null || function.get("name") == null) {
                    throw ChatModelException.malformed("Tool call without a function name");
                }
                String arguments = (String) function.getOrDefault("arguments", "{}");
                requireJson(arguments);
                toolCalls.add(ToolCallRequest.builder()
                        .id((String) raw.get("id"))
                        .name((String) function.get("name"))
                        .arguments(arguments)
                        .build());
            }
        }

        log.debug("{} finish_reason={} toolCalls={} [prompt={} completion={}]",
                props.getProvider(), choices.get(0).get("finish_reason"),
                toolCalls.size(), promptTokens, completionTokens);

        return ChatCompletion.builder()
                .content((String) message.get("content"))
                .toolCalls(toolCalls)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    private void requireJson(String arguments) {
        try {
            objectMapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            throw new ChatModelException(ChatModelException.Kind.MALFORMED,
                    "Failed to parse tool arguments", e);
        }
    }
}
