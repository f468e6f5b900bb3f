package com.canihazhouze.agent.llm;

import com.canihazhouze.agent.model.AgentConfig;
import com.canihazhouze.agent.model.Message;
import com.canihazhouze.agent.tool.ToolDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiChatModelTest {

    private static final String COMPLETIONS = "https://api.test/v1/chat/completions";

    private ChatModelProperties props;
    private RestClient.Builder builder;
    private MockRestServiceServer server;

    private final List<Message> messages = List.of(
            Message.builder().role(Message.Role.system).content("You review mortgages").build());
    private final GenerationOptions options = GenerationOptions.from(AgentConfig.builder().model("gpt-41-mini").build());

    @BeforeEach
    void setUp() {
        props = new ChatModelProperties();
        props.setBaseUrl("https://api.test/v1");
        props.setApiKey("sk-test");
        builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
    }

    @Test
    void complete_textReply_parsesContentAndUsage() {
        server.expect(requestTo(COMPLETIONS))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("gpt-41-mini"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":"Approved"},"finish_reason":"stop"}],
                         "usage":{"prompt_tokens":12,"completion_tokens":3}}
                        """, MediaType.APPLICATION_JSON));

        ChatCompletion completion = model().complete(messages, options, List.of());

        assertThat(completion.getContent()).isEqualTo("Approved");
        assertThat(completion.hasToolCalls()).isFalse();
        assertThat(completion.getPromptTokens()).isEqualTo(12);
        assertThat(completion.getCompletionTokens()).isEqualTo(3);
        server.verify();
    }

    @Test
    void complete_toolCalls_parsedInOrder() {
        ToolDescriptor ledger = ToolDescriptor.builder().name("LedgerAPI").description("ledger")
                .inputSchema(Map.of("type", "object")).build();
        server.expect(requestTo(COMPLETIONS))
                .andExpect(jsonPath("$.tools[0].function.name").value("LedgerAPI"))
                .andExpect(jsonPath("$.tool_choice").value("auto"))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":null,"tool_calls":[
                          {"id":"call_1","type":"function","function":{"name":"LedgerAPI","arguments":"{\\"path\\":\\"/a\\"}"}},
                          {"id":"call_2","type":"function","function":{"name":"CRMAPI","arguments":"{}"}}
                        ]}}]}
                        """, MediaType.APPLICATION_JSON));

        ChatCompletion completion = model().complete(messages, options, List.of(ledger));

        assertThat(completion.getToolCalls()).extracting(ToolCallRequest::getId).containsExactly("call_1", "call_2");
        assertThat(completion.getToolCalls().get(0).getArguments()).isEqualTo("{\"path\":\"/a\"}");
    }

    @Test
    void complete_azureProvider_usesDeploymentPathAndApiKeyHeader() {
        props.setProvider("azure");
        props.setBaseUrl("https://az.test");
        server.expect(requestTo("https://az.test/openai/deployments/gpt-41-mini/chat/completions?api-version=2024-06-01"))
                .andExpect(header("api-key", "sk-test"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"hi\"}}]}", MediaType.APPLICATION_JSON));

        assertThat(model().complete(messages, options, List.of()).getContent()).isEqualTo("hi");
    }

    @Test
    void complete_throttled_isTransient() {
        server.expect(requestTo(COMPLETIONS)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertKind(ChatModelException.Kind.TRANSIENT);
    }

    @Test
    void complete_serverError_isTransient() {
        server.expect(requestTo(COMPLETIONS)).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertKind(ChatModelException.Kind.TRANSIENT);
    }

    @Test
    void complete_unauthorized_isFatal() {
        server.expect(requestTo(COMPLETIONS)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertKind(ChatModelException.Kind.FATAL);
    }

    @Test
    void complete_unknownDeployment_isFatal() {
        server.expect(requestTo(COMPLETIONS)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> model().complete(messages, options, List.of()))
                .isInstanceOf(ChatModelException.class)
                .hasMessageContaining("gpt-41-mini");
    }

    @Test
    void complete_networkError_isTransient() {
        server.expect(requestTo(COMPLETIONS)).andRespond(withException(new IOException("connection reset")));

        assertKind(ChatModelException.Kind.TRANSIENT);
    }

    @Test
    void complete_noChoices_isMalformed() {
        server.expect(requestTo(COMPLETIONS))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertKind(ChatModelException.Kind.MALFORMED);
    }

    @Test
    void complete_toolArgumentsNotJson_isMalformed() {
        server.expect(requestTo(COMPLETIONS))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"tool_calls":[
                          {"id":"c","function":{"name":"LedgerAPI","arguments":"{path: /a"}}]}}]}
                        """, MediaType.APPLICATION_JSON));

        assertKind(ChatModelException.Kind.MALFORMED);
    }

    private OpenAiChatModel model() {
        return new OpenAiChatModel(props, new ObjectMapper(), builder);
    }

    private void assertKind(ChatModelException.Kind kind) {
        assertThatThrownBy(() -> model().complete(messages, options, List.of()))
                .isInstanceOf(ChatModelException.class)
                .extracting(e -> ((ChatModelException) e).getKind())
                .isEqualTo(kind);
    }
}
