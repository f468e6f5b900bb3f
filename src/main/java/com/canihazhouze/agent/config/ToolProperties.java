package com.canihazhouze.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Strongly-typed configuration for the tools agents can call.
 * Bound from application.yml under the "tools" prefix.
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private Http http = new Http();

    /**
     * Platform services exposed as tools, keyed by tool name (LedgerAPI, CRMAPI, ...).
     * Each entry becomes one HTTP tool.
     */
    private Map<String, Service> services = new LinkedHashMap<>();

    @Data
    public static class Http {
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 10000;
        /** Response bodies longer than this are truncated before they reach the model */
        private int maxResponseChars = 8000;
    }

    @Data
    public static class Service {
        private String baseUrl;
        private String description = "";
    }
}
