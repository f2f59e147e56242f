package com.ryuqq.workerlock.adapter.runner;

import com.ryuqq.workerlock.core.policy.LockWaitPolicy;

/**
 * ThreadPerTaskLauncher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threadNamePrefix: Worker 스레드 이름 접두사 (기본 "workerlock-")</li>
 *   <li>daemon: Worker 스레드의 daemon 여부 (기본 false)</li>
 *   <li>lockWaitPolicy: 정책을 지정하지 않은 launch()에 적용할 lock 대기 정책 (기본 무제한 대기)</li>
 * </ul>
 *
 * <p>daemon=true로 두면 JVM 종료 시 join되지 않은 Worker가 중간에 사라질 수 있습니다.
 * 이 경우 mutex는 잠긴 채로 남을 수 있습니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 * @param threadNamePrefix 스레드 이름 접두사 (null/blank 불가)
 * @param daemon daemon 스레드 여부
 * @param lockWaitPolicy 기본 lock 대기 정책 (null 불가)
 */
public record LauncherConfig(
    String threadNamePrefix,
    boolean daemon,
    LockWaitPolicy lockWaitPolicy
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: threadNamePrefix="workerlock-", daemon=false, lockWaitPolicy=unbounded</p>
     */
    public LauncherConfig() {
        this("workerlock-", false, LockWaitPolicy.unbounded());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LauncherConfig {
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (lockWaitPolicy == null) {
            throw new IllegalArgumentException("lockWaitPolicy cannot be null");
        }
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public LauncherConfig withThreadNamePrefix(String threadNamePrefix) {
        return new LauncherConfig(threadNamePrefix, daemon, lockWaitPolicy);
    }

    /**
     * daemon만 변경한 새 인스턴스 생성.
     */
    public LauncherConfig withDaemon(boolean daemon) {
        return new LauncherConfig(threadNamePrefix, daemon, lockWaitPolicy);
    }

    /**
     * lockWaitPolicy만 변경한 새 인스턴스 생성.
     */
    public LauncherConfig withLockWaitPolicy(LockWaitPolicy lockWaitPolicy) {
        return new LauncherConfig(threadNamePrefix, daemon, lockWaitPolicy);
    }
}
