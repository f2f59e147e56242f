/**
 * Runner Adapter Layer - thread-per-task implementation of the launch/join contracts.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workerlock.adapter.runner.ThreadPerTaskLauncher} - allocates, spawns, rejects synchronously on failure</li>
 *   <li>{@link com.ryuqq.workerlock.adapter.runner.MutexWorkerTask} - the wait → lock → wait → unlock protocol</li>
 *   <li>{@link com.ryuqq.workerlock.adapter.runner.ThreadTaskHandle} - once-only join, hands the block back to the caller</li>
 *   <li>{@link com.ryuqq.workerlock.adapter.runner.CountingBlockAllocator} - tracks outstanding blocks</li>
 *   <li>{@link com.ryuqq.workerlock.adapter.runner.WorkerThreadFactory} - named platform threads, never reused</li>
 *   <li>{@link com.ryuqq.workerlock.adapter.runner.LauncherConfig} - thread naming, daemon flag, default lock wait policy</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (ThreadPerTaskLauncher)
 *   ↓ implements
 * application (Launcher, TaskHandle, JoinedTask)
 *   ↓ depends on
 * core (ParameterBlock, WorkerState, CompletionStatus, TaskMutex)
 * </pre>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
package com.ryuqq.workerlock.adapter.runner;
