package com.canihazhouze.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Sizing and timing of the background execution engine.
 * Bound from application.yml under the "agent.engine" prefix.
 */
@ConfigurationProperties(prefix = "agent.engine")
@Data
public class EngineProperties {

    /** Number of worker threads draining the execution queue */
    private int workers = 4;

    /** Runs that may wait in the queue at once */
    private int queueCapacity = 100;

    /** How long enqueue waits for a free slot; zero fails fast */
    private Duration enqueueTimeout = Duration.ZERO;

    /** How long an idle worker blocks on the queue before re-checking for shutdown */
    private Duration pollInterval = Duration.ofMillis(500);

    /** Wall-clock budget for a run measured over time spent running; zero disables it */
    private Duration runTimeout = Duration.ZERO;

    /** User message appended between turns when the model's last word was an assistant turn */
    private String continuationPrompt = "Continue working towards the goal.";

    /** How long context shutdown waits for workers to reach a turn boundary */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    public boolean hasRunTimeout() {
        return runTimeout != null && !runTimeout.isZero() && !runTimeout.isNegative();
    }
}
