package com.ryuqq.workerlock.core.failure;

/**
 * Worker Task 실패 분류.
 *
 * <table>
 *   <caption>실패 종류와 전달 방식</caption>
 *   <tr><th>종류</th><th>발생 시점</th><th>전달 방식</th></tr>
 *   <tr><td>ALLOCATION_FAILURE</td><td>ParameterBlock 할당 실패</td><td>launch()의 동기 결과 (스레드 없음)</td></tr>
 *   <tr><td>SPAWN_FAILURE</td><td>스레드 생성/시작 실패</td><td>launch()의 동기 결과 (block은 launch가 회수)</td></tr>
 *   <tr><td>LOCK_FAILURE</td><td>mutex 획득 실패</td><td>join 이후 completionStatus=FAILURE</td></tr>
 *   <tr><td>UNLOCK_FAILURE</td><td>mutex 해제 실패</td><td>join 이후 completionStatus=FAILURE (mutex 상태 미정)</td></tr>
 * </table>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public enum TaskErrorKind {

    ALLOCATION_FAILURE(true),

    SPAWN_FAILURE(true),

    LOCK_FAILURE(false),

    UNLOCK_FAILURE(false);

    private final boolean synchronous;

    TaskErrorKind(boolean synchronous) {
        this.synchronous = synchronous;
    }

    /**
     * launch() 호출 시점에 동기적으로 드러나는 실패인지 확인.
     *
     * <p>동기 실패는 스레드를 만들지 않으며, 호출자는 join을 시도하면 안 됩니다.</p>
     *
     * @return ALLOCATION_FAILURE 또는 SPAWN_FAILURE인 경우 true
     */
    public boolean isSynchronous() {
        return synchronous;
    }
}
