package com.canihazhouze.agent.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentInputVariable {

    @NotBlank(message = "input variable name must not be blank")
    private String name;

    private String description;

    @Builder.Default
    private boolean required = true;
}
