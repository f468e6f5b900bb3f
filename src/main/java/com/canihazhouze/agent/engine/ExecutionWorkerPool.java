package com.canihazhouze.agent.engine;

import com.canihazhouze.agent.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Fixed set of worker loops draining the execution queue.
 *
 * Each worker: dequeue → claim in the registry → execute until the turn loop
 * returns → release the claim. Settling a run releases the claim itself;
 * the release here covers runs that never got that far. A worker that loses
 * the claim drops the run; whoever won it is responsible for it.
 *
 * Tied to the application context: workers start after the context is
 * refreshed, and on shutdown every held run is asked to pause at its next
 * turn boundary so it can be resumed after a restart.
 */
@Component
@Slf4j
public class ExecutionWorkerPool implements SmartLifecycle {

    private final ExecutionQueue queue;
    private final ActiveRunRegistry registry;
    private final RunLifecycleManager lifecycleManager;
    private final EngineProperties props;
    private final TaskExecutor executor;

    private volatile boolean running;
    private volatile CountDownLatch stopped = new CountDownLatch(0);

    public ExecutionWorkerPool(ExecutionQueue queue,
                               ActiveRunRegistry registry,
                               RunLifecycleManager lifecycleManager,
                               EngineProperties props,
                               @Qualifier("runWorkerExecutor") TaskExecutor executor) {
        this.queue = queue;
        this.registry = registry;
        this.lifecycleManager = lifecycleManager;
        this.props = props;
        this.executor = executor;
    }

    @Override
    public void start() {
        int workers = props.getWorkers();
        running = true;
        stopped = new CountDownLatch(workers);
        for (int i = 1; i <= workers; i++) {
            String workerName = "worker-" + i;
            executor.execute(() -> workLoop(workerName));
        }
        log.info("Execution engine started [workers={}, queueCapacity={}]", workers, queue.capacity());
    }

    @Override
    public void stop() {
        running = false;
        int held = registry.requestPauseAll();
        log.info("Execution engine stopping, pausing {} held run(s)", held);
        try {
            if (!stopped.await(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not reach a turn boundary within {}", props.getShutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Execution engine stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void workLoop(String workerName) {
        log.debug("{} started", workerName);
        try {
            while (running) {
                RunHandle handle;
                try {
                    handle = queue.poll(props.getPollInterval());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (handle != null) {
                    process(handle, workerName);
                }
            }
        } finally {
            stopped.countDown();
            log.debug("{} exited", workerName);
        }
    }

    private void process(RunHandle handle, String workerName) {
        if (!registry.tryClaim(handle, workerName)) {
            log.debug("{} lost the claim on run {}, dropping it", workerName, handle.getRunId());
            return;
        }
        if (!running) {
            // taken off the queue while shutting down
            handle.setPauseRequested(true);
        }
        try {
            lifecycleManager.execute(handle, workerName);
        } catch (RuntimeException e) {
            // the lifecycle manager settles loop failures itself; this is a store or transition failure
            log.error("{} could not settle run {}", workerName, handle.getRunId(), e);
        } finally {
            registry.release(handle.getRunId(), workerName);
        }
    }
}
