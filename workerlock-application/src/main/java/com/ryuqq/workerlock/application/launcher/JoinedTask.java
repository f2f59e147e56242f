package com.ryuqq.workerlock.application.launcher;

import com.ryuqq.workerlock.core.block.BlockOwner;
import com.ryuqq.workerlock.core.block.ParameterBlock;
import com.ryuqq.workerlock.core.failure.TaskFailure;
import com.ryuqq.workerlock.core.model.TaskId;
import com.ryuqq.workerlock.core.spi.ParameterBlockAllocator;
import com.ryuqq.workerlock.core.statemachine.CompletionStatus;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * join으로 회수된 ParameterBlock.
 *
 * <p>호출자가 block을 소유하는 구간을 나타냅니다. {@link #close()}가 block을 정확히 한 번 해제하므로
 * try-with-resources로 사용하면 해제 누락과 이중 해제가 구조적으로 막힙니다.</p>
 *
 * <pre>{@code
 * try (JoinedTask joined = handle.join()) {
 *     if (joined.getCompletionStatus() == CompletionStatus.FAILURE) {
 *         log.warn("task failed: {}", joined.getFailure().orElseThrow());
 *     }
 * }
 * }</pre>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class JoinedTask implements AutoCloseable {

    private final ParameterBlock block;
    private final ParameterBlockAllocator allocator;
    private final AtomicBoolean closed;

    /**
     * 생성자.
     *
     * @param block JOINER가 소유한 block
     * @param allocator block을 할당한 allocator (해제에 사용)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException block이 JOINER 소유가 아닌 경우
     */
    public JoinedTask(ParameterBlock block, ParameterBlockAllocator allocator) {
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        if (allocator == null) {
            throw new IllegalArgumentException("allocator cannot be null");
        }
        if (block.getOwner() != BlockOwner.JOINER) {
            throw new IllegalStateException("Joined block must be owned by JOINER (current: " + block.getOwner() + ")");
        }
        this.block = block;
        this.allocator = allocator;
        this.closed = new AtomicBoolean(false);
    }

    public TaskId getTaskId() {
        return block.getTaskId();
    }

    /**
     * 완료 상태 조회.
     *
     * @return SUCCESS 또는 FAILURE
     * @throws IllegalStateException 이미 해제된 경우
     */
    public CompletionStatus getCompletionStatus() {
        ensureOpen();
        return block.getCompletionStatus();
    }

    /**
     * 실패 상세 조회.
     *
     * @return FAILURE인 경우 실패 상세
     * @throws IllegalStateException 이미 해제된 경우
     */
    public Optional<TaskFailure> getFailure() {
        ensureOpen();
        return block.getFailure();
    }

    public boolean isSuccess() {
        return getCompletionStatus() == CompletionStatus.SUCCESS;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * block 해제.
     *
     * <p>멱등: 두 번째 호출부터는 아무 동작도 하지 않습니다.</p>
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            allocator.release(block);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Joined task " + block.getTaskId().getValue() + " already closed");
        }
    }

    @Override
    public String toString() {
        return "JoinedTask{taskId=" + block.getTaskId().getValue() + ", closed=" + closed.get() + "}";
    }
}
