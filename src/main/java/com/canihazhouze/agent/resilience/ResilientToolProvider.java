package com.canihazhouze.agent.resilience;

import com.canihazhouze.agent.tool.ToolDescriptor;
import com.canihazhouze.agent.tool.ToolProviderPort;
import com.canihazhouze.agent.tool.ToolResult;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Retries tool invocations that come back {@link ToolResult.ErrorKind#TRANSIENT},
 * with the bounded exponential backoff configured under resilience4j.retry.instances.toolCall.
 *
 * When the attempts run out the last error result is returned as is, so the
 * loop records it on the tool turn like any other tool failure.
 */
@Component
@Primary
@Slf4j
public class ResilientToolProvider implements ToolProviderPort {

    static final String INSTANCE = "toolCall";

    private final ToolProviderPort delegate;
    private final Retry retry;

    @Autowired
    public ResilientToolProvider(@Qualifier("toolRegistry") ToolProviderPort delegate, RetryRegistry retryRegistry) {
        this(delegate, retryRegistry.retry(INSTANCE));
    }

    public ResilientToolProvider(ToolProviderPort delegate, Retry retry) {
        this.delegate = delegate;
        this.retry = retry;

        retry.getEventPublisher().onRetry(event -> log.warn("Tool call attempt {} failed, retrying in {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval()));
    }

    @Override
    public List<ToolDescriptor> listTools() {
        return delegate.listTools();
    }

    @Override
    public ToolResult invoke(String name, String argumentsJson) {
        ToolResult result = Retry.decorateSupplier(retry, () -> delegate.invoke(name, argumentsJson)).get();
        if (result.isTransient()) {
            log.warn("Tool [{}] still failing after {} attempts",
                    name, retry.getRetryConfig().getMaxAttempts());
        }
        return result;
    }
}
