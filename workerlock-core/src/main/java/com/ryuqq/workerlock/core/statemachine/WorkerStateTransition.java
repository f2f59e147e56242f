package com.ryuqq.workerlock.core.statemachine;

/**
 * WorkerState 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>INIT → PRE_LOCK_WAIT</li>
 *   <li>PRE_LOCK_WAIT → LOCKING</li>
 *   <li>LOCKING → HOLDING_LOCK (획득 성공)</li>
 *   <li>LOCKING → DONE (획득 실패, 해제할 것 없음)</li>
 *   <li>HOLDING_LOCK → UNLOCKING</li>
 *   <li>UNLOCKING → DONE</li>
 * </ul>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class WorkerStateTransition {

    private WorkerStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WorkerState from, WorkerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case INIT -> to == WorkerState.PRE_LOCK_WAIT;
            case PRE_LOCK_WAIT -> to == WorkerState.LOCKING;
            case LOCKING -> to == WorkerState.HOLDING_LOCK || to == WorkerState.DONE;
            case HOLDING_LOCK -> to == WorkerState.UNLOCKING;
            case UNLOCKING -> to == WorkerState.DONE;
            case DONE -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static WorkerState transition(WorkerState current, WorkerState next) {
        validate(current, next);
        return next;
    }
}
