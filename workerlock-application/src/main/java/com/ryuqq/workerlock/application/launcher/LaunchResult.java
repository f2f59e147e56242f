package com.ryuqq.workerlock.application.launcher;

import com.ryuqq.workerlock.core.failure.TaskFailure;

/**
 * launch() 결과.
 *
 * <ul>
 *   <li>{@link Launched}: 스레드 시작 성공 (ok = true), block 소유권은 Worker로 이전됨</li>
 *   <li>{@link Rejected}: 할당 또는 스폰 실패 (ok = false), 스레드 없음, block 누수 없음</li>
 * </ul>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public sealed interface LaunchResult permits LaunchResult.Launched, LaunchResult.Rejected {

    /**
     * 시작 성공 여부.
     *
     * @return Launched인 경우 true
     */
    default boolean isOk() {
        return this instanceof Launched;
    }

    /**
     * 시작 성공.
     *
     * @param handle join 핸들 (정확히 한 번 join 가능)
     */
    record Launched(TaskHandle handle) implements LaunchResult {

        public Launched {
            if (handle == null) {
                throw new IllegalArgumentException("handle cannot be null");
            }
        }
    }

    /**
     * 시작 거부 (동기 실패).
     *
     * @param failure 실패 상세 (ALLOCATION_FAILURE 또는 SPAWN_FAILURE)
     */
    record Rejected(TaskFailure failure) implements LaunchResult {

        public Rejected {
            if (failure == null) {
                throw new IllegalArgumentException("failure cannot be null");
            }
            if (!failure.kind().isSynchronous()) {
                throw new IllegalArgumentException(
                    "Only allocation/spawn failures reject a launch (current: " + failure.kind() + ")"
                );
            }
        }
    }
}
