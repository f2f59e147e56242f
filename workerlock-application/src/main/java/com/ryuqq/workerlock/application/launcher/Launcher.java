package com.ryuqq.workerlock.application.launcher;

import com.ryuqq.workerlock.core.policy.LockWaitPolicy;
import com.ryuqq.workerlock.core.spi.TaskMutex;

/**
 * Worker Task 실행기.
 *
 * <p>ParameterBlock을 할당하고, 전용 스레드에서 wait → lock → wait → unlock 프로토콜을
 * 수행하는 Worker Task를 시작합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * LaunchResult result = launcher.launch(mutex, 10, 100);
 * if (result.isOk()) {
 *     TaskHandle handle = ((LaunchResult.Launched) result).handle();
 *     try (JoinedTask joined = handle.join()) {
 *         CompletionStatus status = joined.getCompletionStatus();
 *     }
 * } else {
 *     // 동기 실패: 스레드 없음, join 금지
 *     TaskFailure failure = ((LaunchResult.Rejected) result).failure();
 * }
 * }</pre>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public interface Launcher {

    /**
     * Worker Task 시작 (기본 lock 대기 정책).
     *
     * @param mutex 공유 mutex (호출자 소유, 모든 Task보다 오래 살아있어야 함)
     * @param waitBeforeLockMs lock 시도 전 대기 시간 (밀리초, 0 이상)
     * @param waitWhileLockedMs lock 보유 중 대기 시간 (밀리초, 0 이상)
     * @return Launched(handle) 또는 Rejected(failure)
     * @throws IllegalArgumentException mutex가 null이거나 대기 시간이 음수인 경우
     */
    LaunchResult launch(TaskMutex mutex, long waitBeforeLockMs, long waitWhileLockedMs);

    /**
     * Worker Task 시작 (lock 대기 정책 지정).
     *
     * @param mutex 공유 mutex
     * @param waitBeforeLockMs lock 시도 전 대기 시간 (밀리초, 0 이상)
     * @param waitWhileLockedMs lock 보유 중 대기 시간 (밀리초, 0 이상)
     * @param lockWaitPolicy lock 대기 정책
     * @return Launched(handle) 또는 Rejected(failure)
     * @throws IllegalArgumentException 인자가 null이거나 대기 시간이 음수인 경우
     */
    LaunchResult launch(TaskMutex mutex, long waitBeforeLockMs, long waitWhileLockedMs,
                        LockWaitPolicy lockWaitPolicy);
}
