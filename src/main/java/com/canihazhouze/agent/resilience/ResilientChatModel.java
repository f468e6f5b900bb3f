package com.canihazhouze.agent.resilience;

import com.canihazhouze.agent.llm.ChatCompletion;
import com.canihazhouze.agent.llm.ChatModelException;
import com.canihazhouze.agent.llm.ChatModelPort;
import com.canihazhouze.agent.llm.GenerationOptions;
import com.canihazhouze.agent.model.Message;
import com.canihazhouze.agent.tool.ToolDescriptor;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Decorator around the raw chat model that adds a time limit, a circuit
 * breaker and retry with exponential backoff. {@code @Primary} so the engine
 * gets this bean rather than the raw client.
 *
 * Decoration order, outermost first: Retry → CircuitBreaker → TimeLimiter → delegate.
 * Every attempt is individually time-limited and individually recorded by the breaker.
 *
 * Unlike a request/response chat endpoint there is no canned fallback answer
 * here: a run whose model calls keep failing must end as failed, so the last
 * error is rethrown once the attempt budget is spent.
 *
 * Instance settings live in application.yml under resilience4j.*.chatModel.
 */
@Component
@Primary
@Slf4j
public class ResilientChatModel implements ChatModelPort {

    static final String INSTANCE = "chatModel";

    private final ChatModelPort delegate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;
    private final TimeLimiter timeLimiter;
    private final Executor executor;

    @Autowired
    public ResilientChatModel(@Qualifier("rawChatModel") ChatModelPort delegate,
                              RetryRegistry retryRegistry,
                              CircuitBreakerRegistry circuitBreakerRegistry,
                              TimeLimiterRegistry timeLimiterRegistry,
                              @Qualifier("modelCallExecutor") Executor executor) {
        this(delegate,
                retryRegistry.retry(INSTANCE),
                circuitBreakerRegistry.circuitBreaker(INSTANCE),
                timeLimiterRegistry.timeLimiter(INSTANCE),
                executor);
    }

    public ResilientChatModel(ChatModelPort delegate,
                              Retry retry,
                              CircuitBreaker circuitBreaker,
                              TimeLimiter timeLimiter,
                              Executor executor) {
        this.delegate = delegate;
        this.retry = retry;
        this.circuitBreaker = circuitBreaker;
        this.timeLimiter = timeLimiter;
        this.executor = executor;

        retry.getEventPublisher().onRetry(event -> log.warn("Chat model attempt {} failed, retrying in {}: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Chat model circuit breaker: {}", event.getStateTransition()));
    }

    @Override
    public ChatCompletion complete(List<Message> messages, GenerationOptions options, List<ToolDescriptor> tools) {
        Supplier<ChatCompletion> attempt = () -> callWithTimeLimit(messages, options, tools);
        Supplier<ChatCompletion> guarded = CircuitBreaker.decorateSupplier(circuitBreaker, attempt);
        Supplier<ChatCompletion> retried = Retry.decorateSupplier(retry, guarded);

        try {
            return retried.get();
        } catch (CallNotPermittedException e) {
            log.error("Chat model circuit breaker is OPEN, rejecting call");
            throw ChatModelException.transientFailure("Chat model circuit breaker is open", e);
        }
    }

    private ChatCompletion callWithTimeLimit(List<Message> messages,
                                             GenerationOptions options,
                                             List<ToolDescriptor> tools) {
        try {
            return timeLimiter.executeFutureSupplier(() ->
                    CompletableFuture.supplyAsync(() -> delegate.complete(messages, options, tools), executor));
        } catch (ChatModelException e) {
            throw e;
        } catch (TimeoutException e) {
            throw ChatModelException.transientFailure("Chat model call timed out after "
                    + timeLimiter.getTimeLimiterConfig().getTimeoutDuration(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ChatModelException.transientFailure("Interrupted while waiting for the chat model", e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ChatModelException chatModelException) {
                throw chatModelException;
            }
            throw ChatModelException.transientFailure("Chat model call failed: " + cause.getMessage(), cause);
        } catch (Exception e) {
            throw ChatModelException.transientFailure("Chat model call failed: " + e.getMessage(), e);
        }
    }
}
