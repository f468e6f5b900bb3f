package com.canihazhouze.agent.engine;

import com.canihazhouze.agent.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO of runs waiting for a worker.
 *
 * Capacity is enforced with slot reservations rather than by the queue
 * itself: a caller reserves a slot first, then creates the run, then
 * submits it. A full queue is detected before any run document exists.
 * A slot is given back when a worker takes the handle, when a handle is
 * withdrawn, or when the caller abandons its reservation.
 */
@Component
@Slf4j
public class ExecutionQueue {

    private final int capacity;
    private final Semaphore slots;
    private final BlockingQueue<RunHandle> queue = new LinkedBlockingQueue<>();

    public ExecutionQueue(EngineProperties props) {
        this.capacity = props.getQueueCapacity();
        this.slots = new Semaphore(capacity, true);
    }

    /**
     * @param timeout how long to wait for a free slot; zero fails immediately
     * @return false if no slot became free in time
     */
    public boolean tryReserve(Duration timeout) {
        try {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                return slots.tryAcquire();
            }
            return slots.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void releaseReservation() {
        slots.release();
    }

    /** Adds a handle for which the caller holds a reservation. */
    public void submit(RunHandle handle) {
        handle.setQueued(true);
        queue.add(handle);
        log.debug("Queued run {} ({} waiting)", handle.getRunId(), queue.size());
    }

    public RunHandle poll(Duration timeout) throws InterruptedException {
        RunHandle handle = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (handle != null) {
            handle.setQueued(false);
            slots.release();
        }
        return handle;
    }

    /** Removes a handle that no worker has taken yet. */
    public boolean withdraw(RunHandle handle) {
        if (queue.remove(handle)) {
            handle.setQueued(false);
            slots.release();
            return true;
        }
        return false;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }
}
