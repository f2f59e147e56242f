/**
 * Error taxonomy.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workerlock.core.failure.TaskErrorKind} - allocation, spawn, lock and unlock failures</li>
 *   <li>{@link com.ryuqq.workerlock.core.failure.MutexErrorCode} - underlying mutex error codes</li>
 *   <li>{@link com.ryuqq.workerlock.core.failure.MutexException} - checked exception raised by mutex adapters</li>
 *   <li>{@link com.ryuqq.workerlock.core.failure.TaskFailure} - failure details attached to a launch rejection or a failed block</li>
 * </ul>
 *
 * <h2>Propagation</h2>
 * <ul>
 *   <li><strong>Synchronous</strong> (allocation, spawn): returned by {@code launch}; no thread exists, nothing to join.</li>
 *   <li><strong>Asynchronous</strong> (lock, unlock): recorded in the block; observable only after join.</li>
 * </ul>
 *
 * <p>Nothing is retried. Each failure is logged once, where it happens.</p>
 *
 * @since 1.0.0
 * @author WorkerLock Team
 */
package com.ryuqq.workerlock.core.failure;
