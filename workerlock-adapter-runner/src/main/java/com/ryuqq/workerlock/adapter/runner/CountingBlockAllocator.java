package com.ryuqq.workerlock.adapter.runner;

import com.ryuqq.workerlock.core.block.BlockOwner;
import com.ryuqq.workerlock.core.block.ParameterBlock;
import com.ryuqq.workerlock.core.model.TaskId;
import com.ryuqq.workerlock.core.policy.LockWaitPolicy;
import com.ryuqq.workerlock.core.spi.ParameterBlockAllocator;
import com.ryuqq.workerlock.core.spi.TaskMutex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 해제되지 않은 block을 추적하는 기본 allocator.
 *
 * <p>할당된 block을 집합으로 보관하고, 해제 시 소유권을 RELEASED로 전이한 뒤 제거합니다.
 * 다른 allocator가 할당한 block의 해제는 거부합니다.</p>
 *
 * <p><strong>동시성:</strong> thread-safe. 여러 Launcher와 Joiner가 공유할 수 있습니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class CountingBlockAllocator implements ParameterBlockAllocator {

    private static final Logger log = LoggerFactory.getLogger(CountingBlockAllocator.class);

    private final Set<ParameterBlock> live;

    public CountingBlockAllocator() {
        this.live = ConcurrentHashMap.newKeySet();
    }

    @Override
    public ParameterBlock allocate(TaskId taskId, TaskMutex mutex,
                                   long waitBeforeLockMs, long waitWhileLockedMs,
                                   LockWaitPolicy lockWaitPolicy) {
        ParameterBlock block = new ParameterBlock(taskId, mutex, waitBeforeLockMs, waitWhileLockedMs, lockWaitPolicy);
        live.add(block);
        log.trace("Allocated block for {} ({} outstanding)", taskId.getValue(), live.size());
        return block;
    }

    @Override
    public void release(ParameterBlock block) {
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        if (!live.contains(block)) {
            throw new IllegalStateException(
                "Block " + block.getTaskId().getValue() + " is not outstanding in this allocator (owner: " + block.getOwner() + ")"
            );
        }

        BlockOwner current = block.getOwner();
        block.transferOwnership(current, BlockOwner.RELEASED);
        live.remove(block);
        log.trace("Released block for {} from {} ({} outstanding)", block.getTaskId().getValue(), current, live.size());
    }

    @Override
    public int outstanding() {
        return live.size();
    }
}
