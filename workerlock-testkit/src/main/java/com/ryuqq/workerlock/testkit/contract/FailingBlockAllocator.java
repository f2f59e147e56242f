package com.ryuqq.workerlock.testkit.contract;

import com.ryuqq.workerlock.core.block.ParameterBlock;
import com.ryuqq.workerlock.core.model.TaskId;
import com.ryuqq.workerlock.core.policy.LockWaitPolicy;
import com.ryuqq.workerlock.core.spi.ParameterBlockAllocator;
import com.ryuqq.workerlock.core.spi.TaskMutex;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * ParameterBlockAllocator that refuses every allocation.
 *
 * <p>Used to drive the launcher's ALLOCATION_FAILURE path. Depending on the mode it
 * either throws or returns {@code null}.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public class FailingBlockAllocator implements ParameterBlockAllocator {

    /**
     * How the allocation fails.
     */
    public enum Mode {
        RETURN_NULL,
        THROW
    }

    private final Mode mode;
    private final AtomicInteger attempts = new AtomicInteger();

    public FailingBlockAllocator(Mode mode) {
        this.mode = mode;
    }

    @Override
    public ParameterBlock allocate(TaskId taskId, TaskMutex mutex, long waitBeforeLockMs,
                                   long waitWhileLockedMs, LockWaitPolicy lockWaitPolicy) {
        attempts.incrementAndGet();
        if (mode == Mode.THROW) {
            throw new IllegalStateException("Simulated allocation failure for " + taskId.getValue());
        }
        return null;
    }

    @Override
    public void release(ParameterBlock block) {
        throw new IllegalStateException("Nothing was allocated: " + block);
    }

    @Override
    public int outstanding() {
        return 0;
    }

    public int getAttempts() {
        return attempts.get();
    }
}
