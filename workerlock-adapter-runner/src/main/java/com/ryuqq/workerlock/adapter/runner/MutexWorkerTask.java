package com.ryuqq.workerlock.adapter.runner;

import com.ryuqq.workerlock.core.block.BlockOwner;
import com.ryuqq.workerlock.core.block.ParameterBlock;
import com.ryuqq.workerlock.core.failure.MutexErrorCode;
import com.ryuqq.workerlock.core.failure.MutexException;
import com.ryuqq.workerlock.core.failure.TaskErrorKind;
import com.ryuqq.workerlock.core.failure.TaskFailure;
import com.ryuqq.workerlock.core.model.TaskId;
import com.ryuqq.workerlock.core.observation.TaskObserver;
import com.ryuqq.workerlock.core.policy.LockWaitPolicy;
import com.ryuqq.workerlock.core.spi.TaskMutex;
import com.ryuqq.workerlock.core.statemachine.CompletionStatus;
import com.ryuqq.workerlock.core.statemachine.WorkerState;
import com.ryuqq.workerlock.core.statemachine.WorkerStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Worker 스레드에서 실행되는 wait → lock → wait → unlock 프로토콜.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * INIT          block 소유권 획득 (LAUNCHER → WORKER), PENDING 재확인
 *   ↓
 * PRE_LOCK_WAIT waitBeforeLockMs 대기
 *   ↓
 * LOCKING       mutex 획득 (기본 무제한 대기)
 *   ├─ 실패 → FAILURE(LOCK_FAILURE) → DONE   (획득하지 않았으므로 해제할 것 없음)
 *   ↓
 * HOLDING_LOCK  waitWhileLockedMs 대기 (critical section)
 *   ↓
 * UNLOCKING     mutex 해제
 *   ├─ 성공 → SUCCESS → DONE
 *   └─ 실패 → FAILURE(UNLOCK_FAILURE) → DONE (mutex 상태는 해제 시도가 남긴 그대로)
 * </pre>
 *
 * <p><strong>취소 없음:</strong> 두 번의 대기는 인터럽트로 단축되지 않으며, 인터럽트 플래그는 대기 후 복원됩니다.
 * 무제한 lock 대기 역시 인터럽트되지 않습니다. 제한 대기 정책에서는 인터럽트가 LOCK_FAILURE(INTERRUPTED)가 됩니다.</p>
 *
 * <p>완료 상태는 DONE 전이 직전에 단 한 번 기록되며, DONE 이후 block은 변경되지 않습니다.
 * mutex 어댑터나 관찰자가 {@link Error}를 던져 프로토콜이 중단되어도 block에는 FAILURE가 기록되고
 * (lock 보유 전이면 LOCK_FAILURE, 이후면 UNLOCK_FAILURE, 코드 INVALID_MUTEX) 단계는 DONE이 된 뒤
 * 원래 예외가 다시 던져집니다. 보유 중이던 mutex는 한 번 해제를 시도합니다.
 * 한 인스턴스는 한 번만 실행할 수 있습니다 (두 번째 실행은 소유권 검증에서 실패).</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class MutexWorkerTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MutexWorkerTask.class);

    private final ParameterBlock block;
    private final TaskObserver observer;
    private final TaskId taskId;
    private volatile WorkerState state;
    private boolean mutexHeld;
    private boolean statusRecorded;

    /**
     * 생성자.
     *
     * @param block 이 Task가 실행 중 독점할 block (LAUNCHER 소유 상태)
     * @param observer 상태 전이 관찰자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public MutexWorkerTask(ParameterBlock block, TaskObserver observer) {
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        this.block = block;
        this.observer = observer;
        this.taskId = block.getTaskId();
        this.state = WorkerState.INIT;
    }

    @Override
    public void run() {
        block.transferOwnership(BlockOwner.LAUNCHER, BlockOwner.WORKER);
        block.reassertPending();
        log.debug("Worker {} started on {}", taskId.getValue(), Thread.currentThread().getName());

        try {
            execute();
        } catch (RuntimeException | Error e) {
            abort(e);
            throw e;
        }
    }

    private void execute() {
        moveTo(WorkerState.PRE_LOCK_WAIT);
        sleepUninterruptibly(block.getWaitBeforeLockMs());

        moveTo(WorkerState.LOCKING);
        TaskFailure lockFailure = acquire(block.getMutex(), block.getLockWaitPolicy());
        if (lockFailure != null) {
            finish(lockFailure);
            return;
        }
        mutexHeld = true;

        moveTo(WorkerState.HOLDING_LOCK);
        sleepUninterruptibly(block.getWaitWhileLockedMs());

        moveTo(WorkerState.UNLOCKING);
        finish(release(block.getMutex()));
    }

    /**
     * 현재 실행 단계 조회.
     *
     * <p>다른 스레드에서 읽으면 이미 지난 값일 수 있습니다. DONE만 확정값입니다.</p>
     *
     * @return 현재 단계
     */
    public WorkerState getState() {
        return state;
    }

    public TaskId getTaskId() {
        return taskId;
    }

    private TaskFailure acquire(TaskMutex mutex, LockWaitPolicy policy) {
        try {
            if (!policy.bounded()) {
                mutex.lock();
                return null;
            }
            if (mutex.tryLock(policy.timeoutMs())) {
                return null;
            }
            return failed(TaskErrorKind.LOCK_FAILURE, new MutexException(
                MutexErrorCode.TIMED_OUT, "Mutex not acquired within " + policy.timeoutMs() + "ms"));
        } catch (MutexException e) {
            return failed(TaskErrorKind.LOCK_FAILURE, e);
        } catch (RuntimeException e) {
            return failed(TaskErrorKind.LOCK_FAILURE, new MutexException(
                MutexErrorCode.INVALID_MUTEX, "Mutex adapter failed on lock: " + e, e));
        }
    }

    private TaskFailure release(TaskMutex mutex) {
        // 실패해도 재시도하지 않음
        mutexHeld = false;
        try {
            mutex.unlock();
            return null;
        } catch (MutexException e) {
            return failed(TaskErrorKind.UNLOCK_FAILURE, e);
        } catch (RuntimeException e) {
            return failed(TaskErrorKind.UNLOCK_FAILURE, new MutexException(
                MutexErrorCode.INVALID_MUTEX, "Mutex adapter failed on unlock: " + e, e));
        }
    }

    private TaskFailure failed(TaskErrorKind kind, MutexException e) {
        TaskFailure failure = TaskFailure.fromMutex(kind, e);
        if (e.getCause() == null) {
            log.error("Worker {} {}: error code {} - {}",
                taskId.getValue(), kind, e.getErrorCode().code(), failure.message());
        } else {
            log.error("Worker {} {}: error code {} - {}",
                taskId.getValue(), kind, e.getErrorCode().code(), failure.message(), e.getCause());
        }
        return failure;
    }

    /**
     * 완료 상태를 기록하고 DONE으로 전이.
     *
     * @param failure 실패 상세 (성공이면 null)
     */
    private void finish(TaskFailure failure) {
        CompletionStatus status;
        if (failure == null) {
            block.recordSuccess();
            status = CompletionStatus.SUCCESS;
        } else {
            block.recordFailure(failure);
            status = CompletionStatus.FAILURE;
        }
        statusRecorded = true;
        moveTo(WorkerState.DONE);
        log.debug("Worker {} finished with {}", taskId.getValue(), status);

        try {
            observer.onCompleted(taskId, status);
        } catch (RuntimeException e) {
            log.warn("TaskObserver failed on completion of {}", taskId.getValue(), e);
        }
    }

    /**
     * 프로토콜이 예외로 중단된 경우 block을 종료 상태로 정리.
     *
     * <p>관찰자는 호출하지 않습니다 (중단 원인일 수 있음).</p>
     *
     * @param cause 중단 원인
     */
    private void abort(Throwable cause) {
        WorkerState abortedAt = state;
        TaskErrorKind kind = mutexHeld || abortedAt.holdsLock()
            ? TaskErrorKind.UNLOCK_FAILURE
            : TaskErrorKind.LOCK_FAILURE;

        if (mutexHeld) {
            mutexHeld = false;
            try {
                block.getMutex().unlock();
            } catch (MutexException | RuntimeException | Error e) {
                cause.addSuppressed(e);
            }
        }

        if (statusRecorded) {
            log.error("Worker {} aborted in {} after its status was recorded", taskId.getValue(), abortedAt, cause);
        } else {
            block.recordFailure(new TaskFailure(kind, MutexErrorCode.INVALID_MUTEX,
                "Worker aborted in " + abortedAt + ": " + cause));
            statusRecorded = true;
            log.error("Worker {} aborted in {}, recorded {}", taskId.getValue(), abortedAt, kind, cause);
        }
        state = WorkerState.DONE;
    }

    private void moveTo(WorkerState next) {
        WorkerState previous = state;
        state = WorkerStateTransition.transition(previous, next);
        log.debug("Worker {}: {} → {}", taskId.getValue(), previous, next);

        try {
            observer.onTransition(taskId, previous, next);
        } catch (RuntimeException e) {
            log.warn("TaskObserver failed on {} → {} for {}", previous, next, taskId.getValue(), e);
        }
    }

    /**
     * 인터럽트와 무관하게 지정 시간 전체를 대기.
     *
     * <p>대기 중 받은 인터럽트는 대기가 끝난 뒤 현재 스레드에 다시 설정됩니다.</p>
     *
     * @param millis 대기 시간 (밀리초, 0이면 즉시 반환)
     */
    private static void sleepUninterruptibly(long millis) {
        if (millis <= 0) {
            return;
        }
        boolean interrupted = false;
        long remainingNanos = TimeUnit.MILLISECONDS.toNanos(millis);
        long deadline = System.nanoTime() + remainingNanos;
        try {
            while (remainingNanos > 0) {
                try {
                    TimeUnit.NANOSECONDS.sleep(remainingNanos);
                    return;
                } catch (InterruptedException e) {
                    interrupted = true;
                    remainingNanos = deadline - System.nanoTime();
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
