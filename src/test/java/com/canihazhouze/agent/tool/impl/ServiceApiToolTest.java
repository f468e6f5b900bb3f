package com.canihazhouze.agent.tool.impl;

import com.canihazhouze.agent.config.ToolProperties;
import com.canihazhouze.agent.tool.ToolExecutionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ServiceApiToolTest {

    private MockRestServiceServer server;
    private ServiceApiTool tool;

    @BeforeEach
    void setUp() {
        ToolProperties.Service service = new ToolProperties.Service();
        service.setBaseUrl("http://ledger.local");
        service.setDescription("Ledger service.");
        ToolProperties.Http http = new ToolProperties.Http();
        http.setMaxResponseChars(20);

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        tool = new ServiceApiTool("LedgerAPI", service, http, new ObjectMapper(), builder);
    }

    @Test
    void execute_get_buildsUrlFromBaseAndQuery() {
        server.expect(requestTo("http://ledger.local/accounts/alice?currency=EUR"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"balance\":100}", MediaType.APPLICATION_JSON));

        String result = tool.execute(Map.of("path", "/accounts/alice", "query", Map.of("currency", "EUR")));

        assertThat(result).isEqualTo("HTTP 200\n\n{\"balance\":100}");
        server.verify();
    }

    @Test
    void execute_post_sendsJsonBody() {
        server.expect(requestTo("http://ledger.local/transactions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"amount\":5}"))
                .andRespond(withStatus(HttpStatus.CREATED).body("ok").contentType(MediaType.TEXT_PLAIN));

        String result = tool.execute(Map.of("method", "post", "path", "/transactions", "body", Map.of("amount", 5)));

        assertThat(result).startsWith("HTTP 201");
        server.verify();
    }

    @Test
    void execute_longResponse_isTruncated() {
        server.expect(requestTo("http://ledger.local/big"))
                .andRespond(withSuccess("x".repeat(50), MediaType.TEXT_PLAIN));

        String result = tool.execute(Map.of("path", "/big"));

        assertThat(result).contains("[truncated, 30 more chars]");
    }

    @Test
    void execute_errorStatus_throwsWithStatusCode() {
        server.expect(requestTo("http://ledger.local/accounts/bob"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND).body("no such account"));

        assertThatThrownBy(() -> tool.execute(Map.of("path", "/accounts/bob")))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("HTTP 404 from LedgerAPI");
    }

    @Test
    void execute_clientError_isNotTransient() {
        server.expect(requestTo("http://ledger.local/accounts/bob"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> tool.execute(Map.of("path", "/accounts/bob")))
                .isInstanceOfSatisfying(ToolExecutionException.class,
                        e -> assertThat(e.isTransientFailure()).isFalse());
    }

    @Test
    void execute_serverErrorOrThrottling_isTransient() {
        server.expect(requestTo("http://ledger.local/accounts/bob"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));
        server.expect(requestTo("http://ledger.local/accounts/bob"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> tool.execute(Map.of("path", "/accounts/bob")))
                    .isInstanceOfSatisfying(ToolExecutionException.class,
                            e -> assertThat(e.isTransientFailure()).isTrue());
        }
        server.verify();
    }

    @Test
    void execute_connectionFailure_isTransient() {
        server.expect(requestTo("http://ledger.local/accounts/bob"))
                .andRespond(withException(new SocketException("Connection reset")));

        assertThatThrownBy(() -> tool.execute(Map.of("path", "/accounts/bob")))
                .isInstanceOfSatisfying(ToolExecutionException.class, e -> {
                    assertThat(e.isTransientFailure()).isTrue();
                    assertThat(e.getMessage()).startsWith("LedgerAPI is unreachable");
                });
    }

    @Test
    void execute_missingPath_throws() {
        assertThatThrownBy(() -> tool.execute(Map.of()))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("'path' is required");
    }

    @Test
    void execute_absoluteUrl_isRejected() {
        assertThatThrownBy(() -> tool.execute(Map.of("path", "http://evil.example/steal")))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("relative");
    }

    @Test
    void execute_deleteMethod_isRejected() {
        assertThatThrownBy(() -> tool.execute(Map.of("method", "DELETE", "path", "/accounts/alice")))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("not allowed");
    }

    @Test
    void getDescription_appendsPathHint() {
        assertThat(tool.getDescription()).isEqualTo("Ledger service. Paths are relative to the service root.");
    }
}
