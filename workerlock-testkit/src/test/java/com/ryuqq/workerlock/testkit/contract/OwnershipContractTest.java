package com.ryuqq.workerlock.testkit.contract;

import com.ryuqq.workerlock.application.launcher.JoinedTask;
import com.ryuqq.workerlock.application.launcher.TaskHandle;
import com.ryuqq.workerlock.core.statemachine.CompletionStatus;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: block ownership across launch, join and release.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A handle can be joined exactly once</li>
 *   <li>Closing a joined task twice releases the block once</li>
 *   <li>Reads after close are rejected</li>
 *   <li>Timed join and interrupted join leave the handle joinable</li>
 *   <li>Concurrent joins on one handle hand the block to exactly one caller</li>
 * </ul>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
class OwnershipContractTest extends AbstractLauncherContractTest {

    @Test
    void testDoubleJoin_Rejected() throws InterruptedException {
        // Given
        TaskHandle handle = launchOk(0, 10);
        try (JoinedTask joined = handle.join()) {
            assertTrue(joined.isSuccess());
        }

        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class, handle::join);
        assertTrue(exception.getMessage().contains("already joined"));
        assertNoOutstandingBlocks();
    }

    @Test
    void testDoubleClose_ReleasesOnce() throws InterruptedException {
        // Given
        JoinedTask joined = launchOk(0, 0).join();
        assertEquals(1, allocator.outstanding());

        // When
        joined.close();
        joined.close();

        // Then
        assertTrue(joined.isClosed());
        assertNoOutstandingBlocks();
    }

    @Test
    void testReadAfterClose_Rejected() throws InterruptedException {
        // Given
        JoinedTask joined = launchOk(0, 0).join();
        joined.close();

        // When & Then
        assertThrows(IllegalStateException.class, joined::getCompletionStatus);
        assertThrows(IllegalStateException.class, joined::getFailure);
    }

    @Test
    void testUnjoinedTask_KeepsBlockOutstanding() throws InterruptedException {
        // Given
        TaskHandle handle = launchOk(0, 0);
        while (!handle.isDone()) {
            Thread.sleep(5);
        }

        // Then: finishing the worker does not release the block
        assertEquals(1, allocator.outstanding());

        handle.join().close();
        assertNoOutstandingBlocks();
    }

    @Test
    void testTimedJoin_EmptyWhileRunning_ThenJoinable() throws InterruptedException {
        // Given
        TaskHandle handle = launchOk(0, 300);

        // When
        Optional<JoinedTask> early = handle.join(20);

        // Then
        assertTrue(early.isEmpty());
        assertFalse(handle.isDone());
        try (JoinedTask joined = handle.join()) {
            assertEquals(CompletionStatus.SUCCESS, joined.getCompletionStatus());
        }
        assertNoOutstandingBlocks();
    }

    @Test
    void testInterruptedJoin_HandleStaysJoinable() throws InterruptedException {
        // Given
        TaskHandle handle = launchOk(0, 50);

        // When
        Thread.currentThread().interrupt();
        assertThrows(InterruptedException.class, handle::join);

        // Then
        assertFalse(Thread.currentThread().isInterrupted());
        try (JoinedTask joined = handle.join()) {
            assertTrue(joined.isSuccess());
        }
        assertNoOutstandingBlocks();
    }

    @Test
    void testConcurrentJoin_OnlyOneCallerGetsBlock() throws Exception {
        // Given
        TaskHandle handle = launchOk(0, 100);
        int joinerCount = 4;
        ExecutorService joiners = Executors.newFixedThreadPool(joinerCount);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        // When
        Future<?>[] futures = new Future<?>[joinerCount];
        for (int i = 0; i < joinerCount; i++) {
            futures[i] = joiners.submit(() -> {
                go.await();
                try (JoinedTask joined = handle.join()) {
                    winners.incrementAndGet();
                } catch (IllegalStateException e) {
                    rejected.incrementAndGet();
                }
                return null;
            });
        }
        go.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        joiners.shutdown();

        // Then
        assertEquals(1, winners.get());
        assertEquals(joinerCount - 1, rejected.get());
        assertNoOutstandingBlocks();
    }
}
