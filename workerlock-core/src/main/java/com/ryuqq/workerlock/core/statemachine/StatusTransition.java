package com.ryuqq.workerlock.core.statemachine;

/**
 * CompletionStatus 전이 검증.
 *
 * <p>완료 상태는 PENDING에서 종료 상태로 단 한 번만 전이할 수 있습니다.
 * 두 번째 기록 시도는 {@link IllegalStateException}으로 즉시 실패합니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class StatusTransition {

    private StatusTransition() {
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
    public static void validate(CompletionStatus from, CompletionStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Statuses cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Completion status already recorded: %s → %s", from, to)
            );
        }
        if (!to.isTerminal()) {
            throw new IllegalStateException(
                String.format("Invalid status transition: %s → %s", from, to)
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
    public static CompletionStatus transition(CompletionStatus current, CompletionStatus next) {
        validate(current, next);
        return next;
    }
}
