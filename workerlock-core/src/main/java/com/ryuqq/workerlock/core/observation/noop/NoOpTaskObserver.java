package com.ryuqq.workerlock.core.observation.noop;

import com.ryuqq.workerlock.core.model.TaskId;
import com.ryuqq.workerlock.core.observation.TaskObserver;
import com.ryuqq.workerlock.core.statemachine.CompletionStatus;
import com.ryuqq.workerlock.core.statemachine.WorkerState;

/**
 * TaskObserver NoOp 구현.
 *
 * <p>아무 동작도 하지 않습니다. Launcher의 기본 관찰자로 사용됩니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class NoOpTaskObserver implements TaskObserver {

    @Override
    public void onTransition(TaskId taskId, WorkerState from, WorkerState to) {
        // NoOp
    }

    @Override
    public void onCompleted(TaskId taskId, CompletionStatus status) {
        // NoOp
    }
}
