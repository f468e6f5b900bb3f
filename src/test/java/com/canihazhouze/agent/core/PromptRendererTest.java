package com.canihazhouze.agent.core;

import com.canihazhouze.agent.exception.ConfigurationException;
import com.canihazhouze.agent.model.AgentInputVariable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptRendererTest {

    private final PromptRenderer renderer = new PromptRenderer();

    @Test
    void render_substitutesSuppliedValues() {
        String result = renderer.render(
                "Review the mortgage for {{customerName}} ({{ loanAmount }}).",
                List.of(variable("customerName", true), variable("loanAmount", true)),
                Map.of("customerName", "alice", "loanAmount", "350000"));

        assertThat(result).isEqualTo("Review the mortgage for alice (350000).");
    }

    @Test
    void render_declaredOptionalNotSupplied_becomesEmpty() {
        String result = renderer.render("Notes: [{{notes}}]",
                List.of(variable("notes", false)), Map.of());

        assertThat(result).isEqualTo("Notes: []");
    }

    @Test
    void render_suppliedButUndeclared_isAccepted() {
        String result = renderer.render("Hi {{name}}", List.of(), Map.of("name", "bob"));

        assertThat(result).isEqualTo("Hi bob");
    }

    @Test
    void render_unknownPlaceholder_throws() {
        assertThatThrownBy(() -> renderer.render("Hi {{who}}", List.of(), Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("{{who}}");
    }

    @Test
    void render_unclosedPlaceholder_throws() {
        assertThatThrownBy(() -> renderer.render("Hi {{name", List.of(variable("name", true)), Map.of("name", "x")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Unclosed");
    }

    @Test
    void render_emptyPlaceholder_throws() {
        assertThatThrownBy(() -> renderer.render("Hi {{ }}", List.of(), Map.of()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void render_templateWithoutPlaceholders_isUnchanged() {
        assertThat(renderer.render("Plain text, single } brace", null, null))
                .isEqualTo("Plain text, single } brace");
    }

    private static AgentInputVariable variable(String name, boolean required) {
        return AgentInputVariable.builder().name(name).required(required).build();
    }
}
