package com.ryuqq.workerlock.core.statemachine;

/**
 * Worker Task 내부 실행 단계.
 *
 * <p>엄격히 순차적이며 되돌아가지 않습니다.</p>
 *
 * <pre>
 * INIT → PRE_LOCK_WAIT → LOCKING → HOLDING_LOCK → UNLOCKING → DONE
 *                           │                         ▲
 *                           └──── (lock 실패) ──► DONE │
 *                                                     └─ (unlock 실패도 DONE)
 * </pre>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public enum WorkerState {

    /** 완료 상태를 PENDING으로 재확인. */
    INIT,

    /** lock 시도 전 대기. */
    PRE_LOCK_WAIT,

    /** mutex 획득 시도. */
    LOCKING,

    /** mutex 보유 중 대기 (critical section). */
    HOLDING_LOCK,

    /** mutex 해제 시도. */
    UNLOCKING,

    /** 종료. 이후 ParameterBlock 변경 없음. */
    DONE;

    /**
     * 종료 상태인지 확인.
     *
     * @return DONE인 경우 true
     */
    public boolean isTerminal() {
        return this == DONE;
    }

    /**
     * mutex를 보유한 단계인지 확인.
     *
     * @return HOLDING_LOCK 또는 UNLOCKING인 경우 true
     */
    public boolean holdsLock() {
        return this == HOLDING_LOCK || this == UNLOCKING;
    }
}
