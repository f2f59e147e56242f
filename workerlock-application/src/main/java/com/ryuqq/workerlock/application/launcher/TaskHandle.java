package com.ryuqq.workerlock.application.launcher;

import com.ryuqq.workerlock.core.model.TaskId;

import java.util.Optional;

/**
 * 실행 중인 Worker Task 핸들.
 *
 * <p>핸들은 정확히 한 번만 join할 수 있습니다. join이 성공하면 ParameterBlock 소유권이
 * 호출자에게 돌아오며, 두 번째 join은 {@link IllegalStateException}으로 실패합니다.</p>
 *
 * <p><strong>주의:</strong> 인터럽트나 시간 초과로 끝난 join은 핸들을 소비하지 않으므로 다시 시도할 수 있습니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public interface TaskHandle {

    /**
     * Task ID 조회.
     *
     * @return Task ID
     */
    TaskId getTaskId();

    /**
     * Worker Task가 DONE에 도달했는지 확인.
     *
     * @return 스레드가 종료된 경우 true
     */
    boolean isDone();

    /**
     * Worker Task 종료까지 대기 후 block 회수.
     *
     * @return 회수된 block (try-with-resources로 해제)
     * @throws InterruptedException 대기 중 인터럽트 발생 시 (핸들은 소비되지 않음)
     * @throws IllegalStateException 이미 join된 핸들인 경우
     */
    JoinedTask join() throws InterruptedException;

    /**
     * 제한 시간 동안 대기 후 block 회수.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초, 양수)
     * @return 회수된 block, 시간 내 종료되지 않으면 empty (핸들은 소비되지 않음)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws IllegalArgumentException timeoutMs가 양수가 아닌 경우
     * @throws IllegalStateException 이미 join된 핸들인 경우
     */
    Optional<JoinedTask> join(long timeoutMs) throws InterruptedException;
}
