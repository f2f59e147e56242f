package com.ryuqq.workerlock.testkit.contract;

import com.ryuqq.workerlock.adapter.mutex.ErrorCheckingMutex;
import com.ryuqq.workerlock.adapter.runner.CountingBlockAllocator;
import com.ryuqq.workerlock.adapter.runner.LauncherConfig;
import com.ryuqq.workerlock.adapter.runner.ThreadPerTaskLauncher;
import com.ryuqq.workerlock.application.launcher.JoinedTask;
import com.ryuqq.workerlock.application.launcher.LaunchResult;
import com.ryuqq.workerlock.application.launcher.TaskHandle;
import com.ryuqq.workerlock.core.failure.TaskFailure;
import com.ryuqq.workerlock.core.spi.TaskMutex;
import com.ryuqq.workerlock.core.statemachine.CompletionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for launcher contract tests.
 *
 * <p>Provides a fresh allocator, recording observer, mutex and launcher per test, plus
 * helpers that launch and join tasks and check that every block was handed back.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractLauncherContractTest {
 *     {@literal @}Test
 *     void testScenario() throws InterruptedException {
 *         TaskHandle handle = launchOk(0, 50);
 *
 *         try (JoinedTask joined = handle.join()) {
 *             assertEquals(CompletionStatus.SUCCESS, joined.getCompletionStatus());
 *         }
 *         assertNoOutstandingBlocks();
 *     }
 * }
 * </pre>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public abstract class AbstractLauncherContractTest {

    protected CountingBlockAllocator allocator;
    protected RecordingTaskObserver observer;
    protected ErrorCheckingMutex mutex;
    protected ThreadPerTaskLauncher launcher;

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUp() {
        allocator = new CountingBlockAllocator();
        observer = new RecordingTaskObserver();
        mutex = new ErrorCheckingMutex();
        launcher = new ThreadPerTaskLauncher(allocator, createConfig(), observer);
    }

    /**
     * Clears recorded events after each test.
     */
    @AfterEach
    void tearDown() {
        if (observer != null) {
            observer.clear();
        }
    }

    /**
     * Launcher configuration used by {@link #setUp()}. Override to change the default policy.
     *
     * @return launcher configuration
     */
    protected LauncherConfig createConfig() {
        return new LauncherConfig().withThreadNamePrefix("contract-worker-");
    }

    /**
     * Launches a task on the shared mutex and asserts it was accepted.
     *
     * @param waitBeforeLockMs wait before locking
     * @param waitWhileLockedMs wait while holding the mutex
     * @return the task handle
     */
    protected TaskHandle launchOk(long waitBeforeLockMs, long waitWhileLockedMs) {
        return launchOk(mutex, waitBeforeLockMs, waitWhileLockedMs);
    }

    /**
     * Launches a task on the given mutex and asserts it was accepted.
     *
     * @param target the mutex the task will lock
     * @param waitBeforeLockMs wait before locking
     * @param waitWhileLockedMs wait while holding the mutex
     * @return the task handle
     */
    protected TaskHandle launchOk(TaskMutex target, long waitBeforeLockMs, long waitWhileLockedMs) {
        LaunchResult result = launcher.launch(target, waitBeforeLockMs, waitWhileLockedMs);
        assertTrue(result.isOk(), "Expected launch to succeed but was " + result);
        return ((LaunchResult.Launched) result).handle();
    }

    /**
     * Asserts that the launch result was rejected and returns the failure.
     *
     * @param result the launch result
     * @return the synchronous failure
     */
    protected TaskFailure assertRejected(LaunchResult result) {
        assertFalse(result.isOk(), "Expected launch to be rejected but was " + result);
        return ((LaunchResult.Rejected) result).failure();
    }

    /**
     * Joins every handle in order, records the statuses and releases the blocks.
     *
     * @param handles the handles to join
     * @return completion statuses in handle order
     * @throws InterruptedException if interrupted while joining
     */
    protected List<CompletionStatus> joinAll(List<TaskHandle> handles) throws InterruptedException {
        List<CompletionStatus> statuses = new ArrayList<>();
        for (TaskHandle handle : handles) {
            try (JoinedTask joined = handle.join()) {
                statuses.add(joined.getCompletionStatus());
            }
        }
        return statuses;
    }

    /**
     * Asserts that every allocated block has been released.
     */
    protected void assertNoOutstandingBlocks() {
        assertEquals(0, allocator.outstanding(),
                String.format("Expected no outstanding blocks but found %d", allocator.outstanding()));
    }

    /**
     * Asserts that no two recorded critical sections overlap.
     */
    protected void assertCriticalSectionsDisjoint() {
        List<RecordingTaskObserver.CriticalSection> sections = observer.getCriticalSections();
        for (int i = 0; i < sections.size(); i++) {
            for (int j = i + 1; j < sections.size(); j++) {
                RecordingTaskObserver.CriticalSection a = sections.get(i);
                RecordingTaskObserver.CriticalSection b = sections.get(j);
                assertFalse(a.overlaps(b),
                        String.format("Critical sections overlap: %s and %s", a, b));
            }
        }
    }

    /**
     * Elapsed milliseconds since the given {@link System#nanoTime()} reading.
     *
     * @param startNanos start reading
     * @return elapsed milliseconds
     */
    protected static long elapsedMillisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
