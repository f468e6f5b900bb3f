package com.canihazhouze.agent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools owned by the engine.
 *
 * runWorkerExecutor hosts the long-lived worker loops, one thread per worker,
 * so its size is fixed by agent.engine.workers and it has no queue.
 *
 * modelCallExecutor runs each chat model call under the TimeLimiter. It is kept
 * apart from the workers so a hung provider call times out without the worker
 * thread being the one that hangs.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "runWorkerExecutor")
    public ThreadPoolTaskExecutor runWorkerExecutor(EngineProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getWorkers());
        executor.setMaxPoolSize(props.getWorkers());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("run-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) props.getShutdownTimeout().toSeconds());
        executor.initialize();
        return executor;
    }

    @Bean(name = "modelCallExecutor")
    public ThreadPoolTaskExecutor modelCallExecutor(EngineProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getWorkers());
        executor.setMaxPoolSize(props.getWorkers() * 2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("model-call-");
        executor.initialize();
        return executor;
    }
}
