/**
 * Mutex adapters - {@link com.ryuqq.workerlock.core.spi.TaskMutex} implementations.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workerlock.adapter.mutex.ErrorCheckingMutex} - non-reentrant, reports relock,
 *       foreign unlock and use-after-destroy as error codes</li>
 *   <li>{@link com.ryuqq.workerlock.adapter.mutex.LockBackedMutex} - wraps a caller-supplied
 *       {@link java.util.concurrent.locks.Lock}</li>
 * </ul>
 *
 * <p>Both are created and destroyed by the caller; the launcher and its workers only hold references.
 * Acquisition order among waiters is whatever the underlying lock provides.</p>
 *
 * @since 1.0.0
 * @author WorkerLock Team
 */
package com.ryuqq.workerlock.adapter.mutex;
