package com.canihazhouze.agent.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reusable agent definition, stored in MongoDB.
 *
 * Collection: agents
 *
 * The engine only reads agents; they are created and edited through the
 * management endpoints. {@code agentId} mirrors {@code id} so agent and run
 * documents share the same partitioning field.
 */
@Document(collection = "agents")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Agent {

    @Id
    private String id;

    private String agentId;

    @Builder.Default
    private String entityType = "agent";

    /** Tenant that owns the agent; null in single-tenant deployments */
    @Indexed
    private String owner;

    @NotBlank(message = "name must not be blank")
    private String name;

    private String description;

    /** Prompt template, placeholders written as {{variableName}} */
    @NotBlank(message = "prompt must not be blank")
    private String prompt;

    @Valid
    @NotNull(message = "config must not be null")
    @Builder.Default
    private AgentConfig config = new AgentConfig();

    /** Tool names this agent may call, e.g. LedgerAPI, CRMAPI, DocumentsAPI */
    @Builder.Default
    private List<String> tools = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<AgentInputVariable> inputVariables = new ArrayList<>();

    private Instant createdAt;

    private Instant updatedAt;

    /** Tool names are matched case-insensitively against the declared list. */
    public boolean declaresTool(String toolName) {
        if (toolName == null || tools == null) {
            return false;
        }
        return tools.stream().anyMatch(toolName::equalsIgnoreCase);
    }
}
