package com.canihazhouze.agent.resilience;

import com.canihazhouze.agent.llm.ChatModelException;

import java.util.function.Predicate;

/**
 * Decides which chat model failures are worth retrying and which count
 * against the circuit breaker. Referenced by class name from application.yml.
 *
 * Fatal errors (bad key, unknown deployment) are neither retried nor recorded:
 * they say nothing about the health of the provider.
 */
public class TransientModelFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof ChatModelException e && e.isRetryable();
    }
}
