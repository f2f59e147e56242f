package com.ryuqq.workerlock.core.failure;

/**
 * Mutex 연산 실패.
 *
 * <p>{@link com.ryuqq.workerlock.core.spi.TaskMutex} 구현체가 lock/unlock/destroy 실패 시 던집니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public class MutexException extends Exception {

    private static final long serialVersionUID = 1L;

    private final MutexErrorCode errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @throws IllegalArgumentException errorCode가 null인 경우
     */
    public MutexException(MutexErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException errorCode가 null인 경우
     */
    public MutexException(MutexErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (non-null)
     */
    public MutexErrorCode getErrorCode() {
        return errorCode;
    }
}
