/**
 * Service Provider Interfaces.
 *
 * <ul>
 *   <li>{@link com.ryuqq.workerlock.core.spi.TaskMutex} - caller-owned mutex shared by tasks</li>
 *   <li>{@link com.ryuqq.workerlock.core.spi.ParameterBlockAllocator} - block allocation and release, with outstanding count</li>
 * </ul>
 *
 * <p>Mutex implementations live in {@code workerlock-adapter-mutex}; the counting allocator lives in
 * {@code workerlock-adapter-runner}.</p>
 *
 * @since 1.0.0
 * @author WorkerLock Team
 */
package com.ryuqq.workerlock.core.spi;
