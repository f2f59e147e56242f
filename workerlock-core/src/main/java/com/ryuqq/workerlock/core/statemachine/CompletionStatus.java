package com.ryuqq.workerlock.core.statemachine;

/**
 * Worker Task의 완료 상태 (tri-state).
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → SUCCESS (lock, hold, unlock 모두 성공)</li>
 *   <li>PENDING → FAILURE (어느 단계든 실패)</li>
 *   <li><strong>종료 상태는 정확히 한 번만 기록됨 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 * PENDING
 *    │
 *    ├─► SUCCESS
 *    │
 *    └─► FAILURE
 * </pre>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public enum CompletionStatus {

    /**
     * 아직 Worker Task가 끝나지 않음.
     */
    PENDING,

    /**
     * 성공.
     */
    SUCCESS,

    /**
     * 실패 (lock 또는 unlock 실패).
     */
    FAILURE;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCESS 또는 FAILURE인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }
}
