package com.ryuqq.workerlock.core.failure;

import java.util.Optional;

/**
 * 실패 상세 정보.
 *
 * <p>launch 거부 사유 또는 Worker Task가 FAILURE로 끝난 이유를 나타냅니다.</p>
 *
 * @param kind 실패 종류
 * @param errorCode 하위 mutex 오류 코드 (LOCK_FAILURE/UNLOCK_FAILURE에서만 non-null)
 * @param message 오류 메시지
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public record TaskFailure(
    TaskErrorKind kind,
    MutexErrorCode errorCode,
    String message
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 message가 null/blank인 경우
     */
    public TaskFailure {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // errorCode는 null 허용
    }

    /**
     * 오류 코드 없이 생성 (할당/스폰 실패).
     *
     * @param kind 실패 종류
     * @param message 오류 메시지
     * @return TaskFailure 인스턴스
     */
    public static TaskFailure of(TaskErrorKind kind, String message) {
        return new TaskFailure(kind, null, message);
    }

    /**
     * MutexException으로부터 생성.
     *
     * @param kind LOCK_FAILURE 또는 UNLOCK_FAILURE
     * @param e mutex 예외
     * @return TaskFailure 인스턴스
     */
    public static TaskFailure fromMutex(TaskErrorKind kind, MutexException e) {
        String message = e.getMessage() == null || e.getMessage().isBlank()
            ? kind + " (" + e.getErrorCode().code() + ")"
            : e.getMessage();
        return new TaskFailure(kind, e.getErrorCode(), message);
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (없으면 empty)
     */
    public Optional<MutexErrorCode> errorCodeIfPresent() {
        return Optional.ofNullable(errorCode);
    }
}
