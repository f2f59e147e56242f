package com.ryuqq.workerlock.core.policy;

/**
 * Lock 획득 대기 정책.
 *
 * <p>기본값은 무제한 대기({@link #unbounded()})입니다.
 * 제한 대기({@link #bounded(long)})는 명시적으로 선택한 경우에만 적용되며,
 * 시간 초과 시 Worker Task는 LOCK_FAILURE(TIMED_OUT)로 끝납니다.</p>
 *
 * @param bounded 제한 대기 여부
 * @param timeoutMs 최대 대기 시간 (밀리초, 무제한이면 0)
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public record LockWaitPolicy(boolean bounded, long timeoutMs) {

    private static final LockWaitPolicy UNBOUNDED = new LockWaitPolicy(false, 0);

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException timeoutMs가 음수이거나, 무제한 대기인데 timeoutMs가 0이 아닌 경우
     */
    public LockWaitPolicy {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be non-negative (current: " + timeoutMs + ")");
        }
        if (!bounded && timeoutMs != 0) {
            throw new IllegalArgumentException("timeoutMs must be 0 for unbounded wait (current: " + timeoutMs + ")");
        }
    }

    /**
     * 무제한 대기 정책 (기본값).
     *
     * @return 무제한 대기 정책
     */
    public static LockWaitPolicy unbounded() {
        return UNBOUNDED;
    }

    /**
     * 제한 대기 정책.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초, 0 이상)
     * @return 제한 대기 정책
     * @throws IllegalArgumentException timeoutMs가 음수인 경우
     */
    public static LockWaitPolicy bounded(long timeoutMs) {
        return new LockWaitPolicy(true, timeoutMs);
    }
}
