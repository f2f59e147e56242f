package com.ryuqq.workerlock.core.observation;

import com.ryuqq.workerlock.core.model.TaskId;
import com.ryuqq.workerlock.core.statemachine.CompletionStatus;
import com.ryuqq.workerlock.core.statemachine.WorkerState;

/**
 * Worker Task 관찰 SPI.
 *
 * <p>Worker 스레드 안에서 동기적으로 호출됩니다. 구현체는 빠르게 반환해야 하며,
 * 특히 HOLDING_LOCK 진입 통지는 critical section 안에서 발생합니다.</p>
 *
 * <p>구현체에서 발생한 예외는 로그만 남기고 프로토콜 진행에는 영향을 주지 않습니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public interface TaskObserver {

    /**
     * 상태 전이 통지.
     *
     * <p>HOLDING_LOCK 진입은 mutex 획득 직후, UNLOCKING 진입은 해제 시도 직전에 통지됩니다.</p>
     *
     * @param taskId Task ID
     * @param from 이전 상태
     * @param to 새 상태
     */
    void onTransition(TaskId taskId, WorkerState from, WorkerState to);

    /**
     * 완료 상태 기록 통지.
     *
     * @param taskId Task ID
     * @param status 기록된 종료 상태 (SUCCESS 또는 FAILURE)
     */
    void onCompleted(TaskId taskId, CompletionStatus status);
}
