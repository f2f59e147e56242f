package com.ryuqq.workerlock.core.block;

import com.ryuqq.workerlock.core.failure.TaskFailure;
import com.ryuqq.workerlock.core.model.TaskId;
import com.ryuqq.workerlock.core.policy.LockWaitPolicy;
import com.ryuqq.workerlock.core.spi.TaskMutex;
import com.ryuqq.workerlock.core.statemachine.CompletionStatus;
import com.ryuqq.workerlock.core.statemachine.StatusTransition;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Worker Task 하나의 파라미터와 결과를 담는 block.
 *
 * <p>스레드 경계를 넘는 유일한 통신 단위입니다. 어느 시점에나 정확히 한 주체가 소유합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>mutex:</strong> 호출자 소유 mutex 참조 (block은 소유하지 않음)</li>
 *   <li><strong>waitBeforeLockMs:</strong> lock 시도 전 대기 시간</li>
 *   <li><strong>waitWhileLockedMs:</strong> lock 보유 중 대기 시간 (critical section)</li>
 *   <li><strong>completionStatus:</strong> PENDING → SUCCESS/FAILURE, 소유 Worker가 단 한 번 기록</li>
 * </ul>
 *
 * <p><strong>소유권 검증:</strong></p>
 * <ul>
 *   <li>완료 상태 기록: WORKER만 가능</li>
 *   <li>완료 상태 조회: JOINER만 가능 (join 이후에만 관찰 가능)</li>
 *   <li>RELEASED 이후 모든 접근은 {@link IllegalStateException}</li>
 * </ul>
 *
 * <p>결과 필드는 스레드 시작/join 및 소유권 CAS가 만드는 happens-before 관계로 보호되므로
 * 별도의 동기화가 없습니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class ParameterBlock {

    private final TaskId taskId;
    private final TaskMutex mutex;
    private final long waitBeforeLockMs;
    private final long waitWhileLockedMs;
    private final LockWaitPolicy lockWaitPolicy;
    private final AtomicReference<BlockOwner> owner;

    private CompletionStatus completionStatus;
    private TaskFailure failure;

    /**
     * 생성자.
     *
     * <p>소유자 LAUNCHER, 완료 상태 PENDING으로 시작합니다.</p>
     *
     * @param taskId Task ID
     * @param mutex 공유 mutex
     * @param waitBeforeLockMs lock 시도 전 대기 시간 (밀리초, 0 이상)
     * @param waitWhileLockedMs lock 보유 중 대기 시간 (밀리초, 0 이상)
     * @param lockWaitPolicy lock 대기 정책
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public ParameterBlock(TaskId taskId, TaskMutex mutex,
                          long waitBeforeLockMs, long waitWhileLockedMs,
                          LockWaitPolicy lockWaitPolicy) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (mutex == null) {
            throw new IllegalArgumentException("mutex cannot be null");
        }
        if (waitBeforeLockMs < 0) {
            throw new IllegalArgumentException("waitBeforeLockMs must be non-negative (current: " + waitBeforeLockMs + ")");
        }
        if (waitWhileLockedMs < 0) {
            throw new IllegalArgumentException("waitWhileLockedMs must be non-negative (current: " + waitWhileLockedMs + ")");
        }
        if (lockWaitPolicy == null) {
            throw new IllegalArgumentException("lockWaitPolicy cannot be null");
        }
        this.taskId = taskId;
        this.mutex = mutex;
        this.waitBeforeLockMs = waitBeforeLockMs;
        this.waitWhileLockedMs = waitWhileLockedMs;
        this.lockWaitPolicy = lockWaitPolicy;
        this.owner = new AtomicReference<>(BlockOwner.LAUNCHER);
        this.completionStatus = CompletionStatus.PENDING;
    }

    public TaskId getTaskId() {
        return taskId;
    }

    public TaskMutex getMutex() {
        ensureNotReleased();
        return mutex;
    }

    public long getWaitBeforeLockMs() {
        ensureNotReleased();
        return waitBeforeLockMs;
    }

    public long getWaitWhileLockedMs() {
        ensureNotReleased();
        return waitWhileLockedMs;
    }

    public LockWaitPolicy getLockWaitPolicy() {
        ensureNotReleased();
        return lockWaitPolicy;
    }

    /**
     * 현재 소유자 조회.
     *
     * @return 현재 소유자
     */
    public BlockOwner getOwner() {
        return owner.get();
    }

    /**
     * 소유권 이전.
     *
     * <p>현재 소유자가 expected일 때만 원자적으로 이전합니다.
     * 두 주체가 동시에 같은 block을 가져가려 하면 하나만 성공합니다.</p>
     *
     * @param expected 현재 소유자로 기대하는 값
     * @param next 새 소유자
     * @throws IllegalStateException 허용되지 않은 이전이거나 현재 소유자가 expected가 아닌 경우
     */
    public void transferOwnership(BlockOwner expected, BlockOwner next) {
        OwnershipTransition.validate(expected, next);
        if (!owner.compareAndSet(expected, next)) {
            throw new IllegalStateException(
                String.format("Block %s is owned by %s, not %s (requested: %s)",
                    taskId.getValue(), owner.get(), expected, next)
            );
        }
    }

    /**
     * 완료 상태가 PENDING인지 재확인 (Worker INIT 단계).
     *
     * @throws IllegalStateException WORKER 소유가 아니거나 이미 종료 상태가 기록된 경우
     */
    public void reassertPending() {
        ensureOwner(BlockOwner.WORKER);
        if (completionStatus != CompletionStatus.PENDING) {
            throw new IllegalStateException(
                "Completion status already recorded for " + taskId.getValue() + ": " + completionStatus
            );
        }
        completionStatus = CompletionStatus.PENDING;
    }

    /**
     * 성공 기록.
     *
     * @throws IllegalStateException WORKER 소유가 아니거나 이미 기록된 경우
     */
    public void recordSuccess() {
        ensureOwner(BlockOwner.WORKER);
        completionStatus = StatusTransition.transition(completionStatus, CompletionStatus.SUCCESS);
    }

    /**
     * 실패 기록.
     *
     * @param failure 실패 상세
     * @throws IllegalArgumentException failure가 null이거나 동기 실패 종류인 경우
     * @throws IllegalStateException WORKER 소유가 아니거나 이미 기록된 경우
     */
    public void recordFailure(TaskFailure failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (failure.kind().isSynchronous()) {
            throw new IllegalArgumentException("Only lock/unlock failures are recorded in a block (current: " + failure.kind() + ")");
        }
        ensureOwner(BlockOwner.WORKER);
        completionStatus = StatusTransition.transition(completionStatus, CompletionStatus.FAILURE);
        this.failure = failure;
    }

    /**
     * 완료 상태 조회.
     *
     * @return 완료 상태
     * @throws IllegalStateException join 이전(JOINER 소유가 아님)인 경우
     */
    public CompletionStatus getCompletionStatus() {
        ensureOwner(BlockOwner.JOINER);
        return completionStatus;
    }

    /**
     * 실패 상세 조회.
     *
     * @return FAILURE인 경우 실패 상세, 아니면 empty
     * @throws IllegalStateException join 이전(JOINER 소유가 아님)인 경우
     */
    public Optional<TaskFailure> getFailure() {
        ensureOwner(BlockOwner.JOINER);
        return Optional.ofNullable(failure);
    }

    private void ensureOwner(BlockOwner required) {
        BlockOwner current = owner.get();
        if (current != required) {
            throw new IllegalStateException(
                String.format("Block %s requires owner %s (current: %s)", taskId.getValue(), required, current)
            );
        }
    }

    private void ensureNotReleased() {
        if (owner.get() == BlockOwner.RELEASED) {
            throw new IllegalStateException("Block " + taskId.getValue() + " already released");
        }
    }

    @Override
    public String toString() {
        return "ParameterBlock{taskId=" + taskId.getValue()
            + ", waitBeforeLockMs=" + waitBeforeLockMs
            + ", waitWhileLockedMs=" + waitWhileLockedMs
            + ", owner=" + owner.get() + "}";
    }
}
