package com.ryuqq.workerlock.core.block;

/**
 * ParameterBlock의 현재 소유자.
 *
 * <pre>
 * LAUNCHER ──► WORKER ──► JOINER ──► RELEASED
 *     │                                 ▲
 *     └──────── (스폰 실패) ────────────┘
 * </pre>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public enum BlockOwner {

    /** 할당 직후, 스레드 시작 전. */
    LAUNCHER,

    /** Worker Task 실행 중. */
    WORKER,

    /** join 이후 호출자. */
    JOINER,

    /** 해제됨. 더 이상 접근 불가. */
    RELEASED
}
