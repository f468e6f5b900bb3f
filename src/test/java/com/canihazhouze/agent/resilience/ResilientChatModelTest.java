package com.canihazhouze.agent.resilience;

import com.canihazhouze.agent.llm.ChatCompletion;
import com.canihazhouze.agent.llm.ChatModelException;
import com.canihazhouze.agent.llm.ChatModelPort;
import com.canihazhouze.agent.llm.GenerationOptions;
import com.canihazhouze.agent.model.AgentConfig;
import com.canihazhouze.agent.model.Message;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResilientChatModelTest {

    @Mock ChatModelPort delegate;

    private ExecutorService executor;
    private CircuitBreaker circuitBreaker;

    private final List<Message> messages = List.of(
            Message.builder().role(Message.Role.system).content("You review mortgages").build());
    private final GenerationOptions options = GenerationOptions.from(new AgentConfig());

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        circuitBreaker = CircuitBreaker.of("test", CircuitBreakerConfig.custom()
                .recordException(new TransientModelFailure())
                .slidingWindowSize(10)
                .minimumNumberOfCalls(10)
                .build());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void complete_transientFailures_retriedUntilSuccess() {
        ChatCompletion ok = ChatCompletion.builder().content("done").build();
        when(delegate.complete(anyList(), any(), anyList()))
                .thenThrow(ChatModelException.transientFailure("429", null))
                .thenThrow(ChatModelException.malformed("no choices"))
                .thenReturn(ok);

        ChatCompletion result = resilient(3, Duration.ofSeconds(2)).complete(messages, options, List.of());

        assertThat(result.getContent()).isEqualTo("done");
        verify(delegate, times(3)).complete(anyList(), any(), anyList());
    }

    @Test
    void complete_fatalFailure_notRetried() {
        when(delegate.complete(anyList(), any(), anyList()))
                .thenThrow(ChatModelException.fatal("bad key"));

        assertThatThrownBy(() -> resilient(3, Duration.ofSeconds(2)).complete(messages, options, List.of()))
                .isInstanceOf(ChatModelException.class)
                .extracting(e -> ((ChatModelException) e).getKind())
                .isEqualTo(ChatModelException.Kind.FATAL);
        verify(delegate, times(1)).complete(anyList(), any(), anyList());
    }

    @Test
    void complete_attemptsExhausted_rethrowsLastError() {
        when(delegate.complete(anyList(), any(), anyList()))
                .thenThrow(ChatModelException.transientFailure("503", null));

        assertThatThrownBy(() -> resilient(2, Duration.ofSeconds(2)).complete(messages, options, List.of()))
                .isInstanceOf(ChatModelException.class)
                .hasMessage("503");
        verify(delegate, times(2)).complete(anyList(), any(), anyList());
    }

    @Test
    void complete_slowModel_timesOutAsTransient() {
        when(delegate.complete(anyList(), any(), anyList())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return ChatCompletion.builder().content("late").build();
        });

        assertThatThrownBy(() -> resilient(1, Duration.ofMillis(100)).complete(messages, options, List.of()))
                .isInstanceOf(ChatModelException.class)
                .hasMessageContaining("timed out")
                .extracting(e -> ((ChatModelException) e).getKind())
                .isEqualTo(ChatModelException.Kind.TRANSIENT);
    }

    @Test
    void complete_openCircuit_rejectsWithoutCallingModel() {
        circuitBreaker.transitionToOpenState();

        assertThatThrownBy(() -> resilient(1, Duration.ofSeconds(2)).complete(messages, options, List.of()))
                .isInstanceOf(ChatModelException.class)
                .hasMessageContaining("circuit breaker is open");
        verify(delegate, never()).complete(anyList(), any(), anyList());
    }

    @Test
    void transientModelFailure_acceptsOnlyRetryableModelErrors() {
        TransientModelFailure predicate = new TransientModelFailure();

        assertThat(predicate.test(ChatModelException.transientFailure("x", null))).isTrue();
        assertThat(predicate.test(ChatModelException.malformed("x"))).isTrue();
        assertThat(predicate.test(ChatModelException.fatal("x"))).isFalse();
        assertThat(predicate.test(new IllegalStateException("x"))).isFalse();
    }

    private ResilientChatModel resilient(int maxAttempts, Duration timeout) {
        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(1))
                .retryOnException(new TransientModelFailure())
                .build());
        return new ResilientChatModel(delegate, retry, circuitBreaker, TimeLimiter.of(timeout), executor);
    }
}
