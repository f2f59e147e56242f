/**
 * Caller-facing launch and join contracts.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workerlock.application.launcher.Launcher} - allocates a block and spawns its worker thread</li>
 *   <li>{@link com.ryuqq.workerlock.application.launcher.LaunchResult} - sealed result (Launched / Rejected)</li>
 *   <li>{@link com.ryuqq.workerlock.application.launcher.TaskHandle} - once-only join handle</li>
 *   <li>{@link com.ryuqq.workerlock.application.launcher.JoinedTask} - joined block, released on close</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (ThreadPerTaskLauncher)
 *   ↓ implements
 * application (Launcher, TaskHandle)
 *   ↓ depends on
 * core (ParameterBlock, CompletionStatus, TaskMutex, ParameterBlockAllocator)
 * </pre>
 *
 * @since 1.0.0
 * @author WorkerLock Team
 */
package com.ryuqq.workerlock.application.launcher;
