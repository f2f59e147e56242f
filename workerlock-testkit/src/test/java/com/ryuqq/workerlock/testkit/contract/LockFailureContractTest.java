package com.ryuqq.workerlock.testkit.contract;

import com.ryuqq.workerlock.application.launcher.JoinedTask;
import com.ryuqq.workerlock.application.launcher.LaunchResult;
import com.ryuqq.workerlock.application.launcher.TaskHandle;
import com.ryuqq.workerlock.core.failure.MutexErrorCode;
import com.ryuqq.workerlock.core.failure.MutexException;
import com.ryuqq.workerlock.core.failure.TaskErrorKind;
import com.ryuqq.workerlock.core.failure.TaskFailure;
import com.ryuqq.workerlock.core.policy.LockWaitPolicy;
import com.ryuqq.workerlock.core.spi.TaskMutex;
import com.ryuqq.workerlock.core.statemachine.CompletionStatus;
import com.ryuqq.workerlock.core.statemachine.WorkerState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: lock and unlock failures inside the worker.
 *
 * <p>These failures are asynchronous: launch succeeds, and the failure is observed
 * through the joined block.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
class LockFailureContractTest extends AbstractLauncherContractTest {

    @Test
    void testDestroyedMutex_FailsWithLockFailure() throws Exception {
        // Given
        mutex.destroy();

        // When
        TaskHandle handle = launchOk(0, 50);

        // Then
        try (JoinedTask joined = handle.join()) {
            assertEquals(CompletionStatus.FAILURE, joined.getCompletionStatus());
            TaskFailure failure = joined.getFailure().orElseThrow();
            assertEquals(TaskErrorKind.LOCK_FAILURE, failure.kind());
            assertEquals(MutexErrorCode.INVALID_MUTEX, failure.errorCode());
        }
        assertEquals(List.of(WorkerState.PRE_LOCK_WAIT, WorkerState.LOCKING, WorkerState.DONE),
                observer.statesOf(handle.getTaskId()));
        assertTrue(observer.getCriticalSections().isEmpty(), "Failed lock must not enter a critical section");
        assertNoOutstandingBlocks();
    }

    @Test
    void testBoundedWait_TimesOutWhileMutexHeld() throws Exception {
        // Given: the test thread holds the mutex
        mutex.lock();
        TaskHandle handle;
        try {
            LaunchResult result = launcher.launch(mutex, 0, 10, LockWaitPolicy.bounded(50));
            assertTrue(result.isOk());
            handle = ((LaunchResult.Launched) result).handle();

            // When
            try (JoinedTask joined = handle.join()) {
                // Then
                assertEquals(CompletionStatus.FAILURE, joined.getCompletionStatus());
                TaskFailure failure = joined.getFailure().orElseThrow();
                assertEquals(TaskErrorKind.LOCK_FAILURE, failure.kind());
                assertEquals(MutexErrorCode.TIMED_OUT, failure.errorCode());
            }
        } finally {
            mutex.unlock();
        }
        assertNoOutstandingBlocks();
    }

    @Test
    void testBoundedWait_SucceedsWhenMutexFreesInTime() throws Exception {
        // Given
        TaskHandle holder = launchOk(0, 30);
        LaunchResult result = launcher.launch(mutex, 5, 0, LockWaitPolicy.bounded(2000));

        // When
        List<CompletionStatus> statuses = joinAll(List.of(holder, ((LaunchResult.Launched) result).handle()));

        // Then
        assertEquals(List.of(CompletionStatus.SUCCESS, CompletionStatus.SUCCESS), statuses);
        assertNoOutstandingBlocks();
    }

    @Test
    void testUnlockFailure_RecordedAsUnlockFailure() throws InterruptedException {
        // Given: a mutex whose unlock always fails
        TaskMutex brokenUnlock = new TaskMutex() {
            @Override
            public void lock() {
            }

            @Override
            public boolean tryLock(long timeoutMs) {
                return true;
            }

            @Override
            public void unlock() throws MutexException {
                throw new MutexException(MutexErrorCode.NOT_OWNER, "Simulated unlock failure");
            }
        };

        // When
        TaskHandle handle = launchOk(brokenUnlock, 0, 10);

        // Then
        try (JoinedTask joined = handle.join()) {
            assertEquals(CompletionStatus.FAILURE, joined.getCompletionStatus());
            TaskFailure failure = joined.getFailure().orElseThrow();
            assertEquals(TaskErrorKind.UNLOCK_FAILURE, failure.kind());
            assertEquals(MutexErrorCode.NOT_OWNER, failure.errorCode());
            assertEquals("Simulated unlock failure", failure.message());
        }
        assertEquals(1, observer.getCriticalSections().size());
        assertEquals(WorkerState.DONE, observer.statesOf(handle.getTaskId()).get(4));
        assertNoOutstandingBlocks();
    }

    @Test
    void testAdapterRuntimeException_MappedToInvalidMutex() throws InterruptedException {
        // Given
        TaskMutex exploding = new TaskMutex() {
            @Override
            public void lock() {
                throw new IllegalStateException("adapter bug");
            }

            @Override
            public boolean tryLock(long timeoutMs) {
                throw new IllegalStateException("adapter bug");
            }

            @Override
            public void unlock() {
            }
        };

        // When
        TaskHandle handle = launchOk(exploding, 0, 10);

        // Then
        try (JoinedTask joined = handle.join()) {
            TaskFailure failure = joined.getFailure().orElseThrow();
            assertEquals(TaskErrorKind.LOCK_FAILURE, failure.kind());
            assertEquals(MutexErrorCode.INVALID_MUTEX, failure.errorCode());
        }
        assertNoOutstandingBlocks();
    }

    @Test
    void testAdapterError_StillRecordsTerminalStatus() throws InterruptedException {
        // Given: an adapter whose lock throws an Error instead of an Exception
        TaskMutex erroring = new TaskMutex() {
            @Override
            public void lock() {
                throw new AssertionError("adapter assertion");
            }

            @Override
            public boolean tryLock(long timeoutMs) {
                throw new AssertionError("adapter assertion");
            }

            @Override
            public void unlock() {
            }
        };

        // When
        TaskHandle handle = launchOk(erroring, 0, 10);

        // Then
        try (JoinedTask joined = handle.join()) {
            assertEquals(CompletionStatus.FAILURE, joined.getCompletionStatus(),
                    "Worker killed by an Error must not leave the block PENDING");
            TaskFailure failure = joined.getFailure().orElseThrow();
            assertEquals(TaskErrorKind.LOCK_FAILURE, failure.kind());
            assertEquals(MutexErrorCode.INVALID_MUTEX, failure.errorCode());
            assertTrue(failure.message().contains("adapter assertion"));
        }
        assertTrue(observer.getCriticalSections().isEmpty(), "Failed lock must not enter a critical section");
        assertNoOutstandingBlocks();
    }
}
