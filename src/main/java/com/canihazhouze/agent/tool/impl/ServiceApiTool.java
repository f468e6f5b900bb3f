package com.canihazhouze.agent.tool.impl;

import com.canihazhouze.agent.config.ToolProperties;
import com.canihazhouze.agent.tool.AgentTool;
import com.canihazhouze.agent.tool.ToolExecutionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * HTTP tool bound to one platform service (ledger, CRM, documents, mortgage rules).
 *
 * The model supplies a method, a path relative to the service's base URL, and
 * optionally query parameters and a JSON body. The base URL is fixed by
 * configuration so a model cannot point the tool at another host.
 *
 * DELETE is not offered: agents read and update platform data, they never remove it.
 */
@Slf4j
public class ServiceApiTool implements AgentTool {

    private static final List<String> ALLOWED_METHODS = List.of("GET", "POST", "PUT", "PATCH");

    private final String name;
    private final ToolProperties.Service service;
    private final int maxResponseChars;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public ServiceApiTool(String name,
                          ToolProperties.Service service,
                          ToolProperties.Http http,
                          ObjectMapper objectMapper,
                          RestClient.Builder restClientBuilder) {
        this.name = name;
        this.service = service;
        this.maxResponseChars = http.getMaxResponseChars();
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(service.getBaseUrl())
                .requestInterceptor((request, body, execution) -> {
                    log.debug("Outbound service call: {} {}", request.getMethod(), request.getURI());
                    return execution.execute(request, body);
                })
                .build();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        String base = service.getDescription() == null || service.getDescription().isBlank()
                ? "Call the " + name + " platform service."
                : service.getDescription().trim();
        return base + " Paths are relative to the service root.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "method", Map.of(
                                "type", "string",
                                "enum", ALLOWED_METHODS,
                                "description", "HTTP method. Default: GET",
                                "default", "GET"
                        ),
                        "path", Map.of(
                                "type", "string",
                                "description", "Path on the service, starting with /"
                        ),
                        "query", Map.of(
                                "type", "object",
                                "description", "Query parameters as key-value pairs",
                                "additionalProperties", Map.of("type", "string")
                        ),
                        "body", Map.of(
                                "type", "object",
                                "description", "JSON request body for POST, PUT and PATCH"
                        )
                ),
                "required", List.of("path")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        Object rawPath = arguments.get("path");
        String method = String.valueOf(arguments.getOrDefault("method", "GET")).toUpperCase();

        if (!(rawPath instanceof String path) || path.isBlank()) {
            throw new ToolExecutionException("'path' is required");
        }
        if (!path.startsWith("/") || path.contains("://")) {
            throw new ToolExecutionException("'path' must be relative to the service root and start with /");
        }
        if (!ALLOWED_METHODS.contains(method)) {
            throw new ToolExecutionException("Method '" + method + "' is not allowed. Use: " + ALLOWED_METHODS);
        }

        log.info("Service call [{}]: {} {}", name, method, path);

        try {
            return performRequest(method, path, arguments);
        } catch (RestClientResponseException e) {
            String message = String.format("HTTP %d from %s: %s",
                    e.getStatusCode().value(), name, truncate(e.getResponseBodyAsString()));
            if (e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == 429) {
                throw ToolExecutionException.transientFailure(message, e);
            }
            throw new ToolExecutionException(message, e);
        } catch (ResourceAccessException e) {
            throw ToolExecutionException.transientFailure(name + " is unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ToolExecutionException(name + " call failed: " + e.getMessage(), e);
        }
    }

    private String performRequest(String method, String path, Map<String, Object> arguments) {
        Object rawQuery = arguments.get("query");
        var requestSpec = restClient.method(HttpMethod.valueOf(method))
                .uri(uriBuilder -> buildUri(uriBuilder, path, rawQuery));

        Object body = arguments.get("body");
        if (body != null && !method.equals("GET")) {
            requestSpec.contentType(MediaType.APPLICATION_JSON).body(toJson(body));
        }

        ResponseEntity<String> response = requestSpec.retrieve().toEntity(String.class);

        int statusCode = response.getStatusCode().value();
        String responseBody = response.getBody();
        log.info("Service response [{}]: status={} body-length={}", name, statusCode,
                responseBody != null ? responseBody.length() : 0);

        return String.format("HTTP %d\n\n%s", statusCode,
                responseBody != null ? truncate(responseBody) : "(empty response)");
    }

    private URI buildUri(UriBuilder uriBuilder, String path, Object rawQuery) {
        uriBuilder.path(path);
        if (rawQuery instanceof Map<?, ?> query) {
            query.forEach((k, v) -> uriBuilder.queryParam(k.toString(), String.valueOf(v)));
        }
        return uriBuilder.build();
    }

    private String toJson(Object body) {
        if (body instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("Request body is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private String truncate(String text) {
        if (text == null || text.length() <= maxResponseChars) {
            return text;
        }
        return text.substring(0, maxResponseChars)
                + "\n... [truncated, " + (text.length() - maxResponseChars) + " more chars]";
    }
}
