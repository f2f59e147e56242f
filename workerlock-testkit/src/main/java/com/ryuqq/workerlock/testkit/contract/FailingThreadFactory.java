package com.ryuqq.workerlock.testkit.contract;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ThreadFactory that never produces a runnable thread.
 *
 * <p>Used to drive the launcher's SPAWN_FAILURE path. The task handed to
 * {@link #newThread(Runnable)} is never executed.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public class FailingThreadFactory implements ThreadFactory {

    /**
     * How the spawn fails.
     */
    public enum Mode {
        RETURN_NULL,
        THROW,
        ALREADY_STARTED
    }

    private final Mode mode;
    private final AtomicInteger requests = new AtomicInteger();

    public FailingThreadFactory(Mode mode) {
        this.mode = mode;
    }

    @Override
    public Thread newThread(Runnable task) {
        requests.incrementAndGet();
        switch (mode) {
            case THROW:
                throw new IllegalStateException("Simulated thread creation failure");
            case ALREADY_STARTED:
                Thread started = new Thread(() -> { }, "already-started");
                started.start();
                return started;
            default:
                return null;
        }
    }

    public int getRequests() {
        return requests.get();
    }
}
