package com.ryuqq.workerlock.adapter.runner;

import com.ryuqq.workerlock.application.launcher.LaunchResult;
import com.ryuqq.workerlock.application.launcher.Launcher;
import com.ryuqq.workerlock.core.block.ParameterBlock;
import com.ryuqq.workerlock.core.failure.TaskErrorKind;
import com.ryuqq.workerlock.core.failure.TaskFailure;
import com.ryuqq.workerlock.core.model.TaskId;
import com.ryuqq.workerlock.core.observation.TaskObserver;
import com.ryuqq.workerlock.core.observation.noop.NoOpTaskObserver;
import com.ryuqq.workerlock.core.policy.LockWaitPolicy;
import com.ryuqq.workerlock.core.spi.ParameterBlockAllocator;
import com.ryuqq.workerlock.core.spi.TaskMutex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;

/**
 * Task마다 새 스레드를 띄우는 Launcher 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>입력 검증 (null mutex, 음수 대기 시간은 IllegalArgumentException)</li>
 *   <li>ParameterBlock 할당 → 실패 시 Rejected(ALLOCATION_FAILURE), 스레드 없음</li>
 *   <li>ThreadFactory로 스레드 생성 후 시작 → 실패 시 block을 직접 해제하고 Rejected(SPAWN_FAILURE)</li>
 *   <li>성공 시 Launched(handle). 이후 block은 Worker 소유</li>
 * </ol>
 *
 * <p><strong>특성:</strong></p>
 * <ul>
 *   <li>호출당 최대 한 개의 스레드 생성, 풀링/재사용 없음</li>
 *   <li>호출자가 넘긴 mutex 외에는 공유 상태를 변경하지 않음 (allocator의 집계 제외)</li>
 *   <li>thread-safe: 여러 스레드에서 동시에 launch() 가능</li>
 * </ul>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class ThreadPerTaskLauncher implements Launcher {

    private static final Logger log = LoggerFactory.getLogger(ThreadPerTaskLauncher.class);

    private final ParameterBlockAllocator allocator;
    private final LauncherConfig config;
    private final TaskObserver observer;
    private final ThreadFactory threadFactory;

    /**
     * 생성자 (기본 설정, CountingBlockAllocator).
     */
    public ThreadPerTaskLauncher() {
        this(new CountingBlockAllocator(), new LauncherConfig());
    }

    /**
     * 생성자 (NoOp 관찰자).
     *
     * @param allocator block allocator
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ThreadPerTaskLauncher(ParameterBlockAllocator allocator, LauncherConfig config) {
        this(allocator, config, new NoOpTaskObserver());
    }

    /**
     * 생성자 (설정 기반 WorkerThreadFactory).
     *
     * @param allocator block allocator
     * @param config 설정
     * @param observer 상태 전이 관찰자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ThreadPerTaskLauncher(ParameterBlockAllocator allocator, LauncherConfig config, TaskObserver observer) {
        this(allocator, config, observer, config == null ? null : new WorkerThreadFactory(config));
    }

    /**
     * 생성자 (커스텀 ThreadFactory 주입).
     *
     * @param allocator block allocator
     * @param config 설정
     * @param observer 상태 전이 관찰자
     * @param threadFactory Worker 스레드 팩토리 (호출마다 새 스레드를 반환해야 함)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ThreadPerTaskLauncher(ParameterBlockAllocator allocator, LauncherConfig config,
                                 TaskObserver observer, ThreadFactory threadFactory) {
        if (allocator == null) {
            throw new IllegalArgumentException("allocator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        if (threadFactory == null) {
            throw new IllegalArgumentException("threadFactory cannot be null");
        }
        this.allocator = allocator;
        this.config = config;
        this.observer = observer;
        this.threadFactory = threadFactory;
    }

    @Override
    public LaunchResult launch(TaskMutex mutex, long waitBeforeLockMs, long waitWhileLockedMs) {
        return launch(mutex, waitBeforeLockMs, waitWhileLockedMs, config.lockWaitPolicy());
    }

    @Override
    public LaunchResult launch(TaskMutex mutex, long waitBeforeLockMs, long waitWhileLockedMs,
                               LockWaitPolicy lockWaitPolicy) {
        validateInput(mutex, waitBeforeLockMs, waitWhileLockedMs, lockWaitPolicy);

        TaskId taskId = TaskId.random();

        // 1. block 할당
        ParameterBlock block;
        try {
            block = allocator.allocate(taskId, mutex, waitBeforeLockMs, waitWhileLockedMs, lockWaitPolicy);
        } catch (RuntimeException | OutOfMemoryError e) {
            log.error("Failed to allocate parameter block for {}", taskId.getValue(), e);
            return rejected(TaskErrorKind.ALLOCATION_FAILURE, "Failed to allocate parameter block: " + e);
        }
        if (block == null) {
            log.error("Failed to allocate parameter block for {}: allocator returned null", taskId.getValue());
            return rejected(TaskErrorKind.ALLOCATION_FAILURE, "Allocator returned no parameter block");
        }

        // 2. 스레드 생성 및 시작 (실패 시 block은 아직 launch 소유이므로 여기서 해제)
        Thread thread;
        try {
            thread = threadFactory.newThread(new MutexWorkerTask(block, observer));
            if (thread == null) {
                log.error("Failed to create thread for {}: thread factory returned null", taskId.getValue());
                return abandon(block, "Thread factory returned no thread");
            }
            thread.start();
        } catch (RuntimeException | OutOfMemoryError e) {
            log.error("Failed to create thread for {}", taskId.getValue(), e);
            return abandon(block, "Failed to create thread: " + e);
        }

        log.debug("Launched {} on {} (waitBeforeLockMs={}, waitWhileLockedMs={})",
            taskId.getValue(), thread.getName(), waitBeforeLockMs, waitWhileLockedMs);
        return new LaunchResult.Launched(new ThreadTaskHandle(thread, block, allocator));
    }

    public ParameterBlockAllocator getAllocator() {
        return allocator;
    }

    public LauncherConfig getConfig() {
        return config;
    }

    private void validateInput(TaskMutex mutex, long waitBeforeLockMs, long waitWhileLockedMs,
                               LockWaitPolicy lockWaitPolicy) {
        if (mutex == null) {
            throw new IllegalArgumentException("mutex cannot be null");
        }
        if (waitBeforeLockMs < 0) {
            throw new IllegalArgumentException("waitBeforeLockMs must be non-negative (current: " + waitBeforeLockMs + ")");
        }
        if (waitWhileLockedMs < 0) {
            throw new IllegalArgumentException("waitWhileLockedMs must be non-negative (current: " + waitWhileLockedMs + ")");
        }
        if (lockWaitPolicy == null) {
            throw new IllegalArgumentException("lockWaitPolicy cannot be null");
        }
    }

    private LaunchResult abandon(ParameterBlock block, String message) {
        allocator.release(block);
        return rejected(TaskErrorKind.SPAWN_FAILURE, message);
    }

    private static LaunchResult rejected(TaskErrorKind kind, String message) {
        return new LaunchResult.Rejected(TaskFailure.of(kind, message));
    }
}
