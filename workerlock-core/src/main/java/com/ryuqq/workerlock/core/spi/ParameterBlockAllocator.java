package com.ryuqq.workerlock.core.spi;

import com.ryuqq.workerlock.core.block.ParameterBlock;
import com.ryuqq.workerlock.core.model.TaskId;
import com.ryuqq.workerlock.core.policy.LockWaitPolicy;

/**
 * ParameterBlock 할당/해제 SPI.
 *
 * <p>모든 block은 이 SPI를 통해 할당되고 정확히 한 번 해제됩니다.
 * {@link #outstanding()}으로 해제되지 않은 block 수를 관찰할 수 있어 누수를 검증할 수 있습니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public interface ParameterBlockAllocator {

    /**
     * ParameterBlock 할당.
     *
     * <p>반환된 block의 소유자는 LAUNCHER, 완료 상태는 PENDING입니다.</p>
     *
     * @param taskId Task ID
     * @param mutex 공유 mutex (호출자 소유)
     * @param waitBeforeLockMs lock 시도 전 대기 시간 (밀리초, 0 이상)
     * @param waitWhileLockedMs lock 보유 중 대기 시간 (밀리초, 0 이상)
     * @param lockWaitPolicy lock 대기 정책
     * @return 새 ParameterBlock
     * @throws RuntimeException 할당 실패 시 (구현체 정의)
     */
    ParameterBlock allocate(TaskId taskId, TaskMutex mutex,
                            long waitBeforeLockMs, long waitWhileLockedMs,
                            LockWaitPolicy lockWaitPolicy);

    /**
     * ParameterBlock 해제 (파괴).
     *
     * <p>block의 소유자를 RELEASED로 전이합니다. 두 번째 해제는 실패합니다.</p>
     *
     * @param block 해제할 block
     * @throws IllegalArgumentException block이 null인 경우
     * @throws IllegalStateException 이미 해제되었거나 Worker가 소유 중인 경우
     */
    void release(ParameterBlock block);

    /**
     * 해제되지 않은 block 수 조회.
     *
     * @return 할당 후 아직 해제되지 않은 block 수
     */
    int outstanding();
}
