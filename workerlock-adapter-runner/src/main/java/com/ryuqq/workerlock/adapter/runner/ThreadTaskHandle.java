package com.ryuqq.workerlock.adapter.runner;

import com.ryuqq.workerlock.application.launcher.JoinedTask;
import com.ryuqq.workerlock.application.launcher.TaskHandle;
import com.ryuqq.workerlock.core.block.BlockOwner;
import com.ryuqq.workerlock.core.block.ParameterBlock;
import com.ryuqq.workerlock.core.model.TaskId;
import com.ryuqq.workerlock.core.spi.ParameterBlockAllocator;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Worker 스레드 하나에 대한 join 핸들.
 *
 * <p>{@link Thread#join()}으로 종료를 기다린 뒤 block 소유권을 WORKER → JOINER로 가져옵니다.
 * 소유권 회수는 한 번만 성공하며, 여러 스레드가 동시에 join해도 하나만 block을 받습니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class ThreadTaskHandle implements TaskHandle {

    private final TaskId taskId;
    private final Thread thread;
    private final ParameterBlock block;
    private final ParameterBlockAllocator allocator;
    private final AtomicBoolean joined;

    ThreadTaskHandle(Thread thread, ParameterBlock block, ParameterBlockAllocator allocator) {
        this.taskId = block.getTaskId();
        this.thread = thread;
        this.block = block;
        this.allocator = allocator;
        this.joined = new AtomicBoolean(false);
    }

    @Override
    public TaskId getTaskId() {
        return taskId;
    }

    @Override
    public boolean isDone() {
        return !thread.isAlive();
    }

    @Override
    public JoinedTask join() throws InterruptedException {
        ensureNotJoined();
        thread.join();
        return reclaim();
    }

    @Override
    public Optional<JoinedTask> join(long timeoutMs) throws InterruptedException {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        ensureNotJoined();
        thread.join(timeoutMs);
        if (thread.isAlive()) {
            return Optional.empty();
        }
        return Optional.of(reclaim());
    }

    /**
     * Worker가 실행 중인 스레드 이름 조회.
     *
     * @return 스레드 이름
     */
    public String getThreadName() {
        return thread.getName();
    }

    private void ensureNotJoined() {
        if (joined.get()) {
            throw new IllegalStateException("Task " + taskId.getValue() + " already joined");
        }
    }

    private JoinedTask reclaim() {
        if (!joined.compareAndSet(false, true)) {
            throw new IllegalStateException("Task " + taskId.getValue() + " already joined");
        }
        block.transferOwnership(BlockOwner.WORKER, BlockOwner.JOINER);
        return new JoinedTask(block, allocator);
    }

    @Override
    public String toString() {
        return "ThreadTaskHandle{taskId=" + taskId.getValue()
            + ", thread=" + thread.getName()
            + ", joined=" + joined.get() + "}";
    }
}
