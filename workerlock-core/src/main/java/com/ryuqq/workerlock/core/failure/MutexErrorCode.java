package com.ryuqq.workerlock.core.failure;

/**
 * Mutex 연산이 보고하는 하위 오류 코드.
 *
 * <p>실패 지점에서 로그에 {@link #code()}가 함께 기록됩니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public enum MutexErrorCode {

    /** 파괴되었거나 초기화되지 않은 mutex. */
    INVALID_MUTEX("MUTEX-001"),

    /** 이미 보유한 mutex를 같은 스레드가 다시 획득하려 함. */
    DEADLOCK("MUTEX-002"),

    /** 보유하지 않은 스레드가 해제하려 함. */
    NOT_OWNER("MUTEX-003"),

    /** 잠긴 상태에서 파괴하려 함. */
    BUSY("MUTEX-004"),

    /** 제한 대기(bounded wait) 시간 초과. */
    TIMED_OUT("MUTEX-005"),

    /** 제한 대기 중 인터럽트. */
    INTERRUPTED("MUTEX-006");

    private final String code;

    MutexErrorCode(String code) {
        this.code = code;
    }

    /**
     * 오류 코드 문자열 조회.
     *
     * @return 오류 코드 (예: MUTEX-002)
     */
    public String code() {
        return code;
    }
}
