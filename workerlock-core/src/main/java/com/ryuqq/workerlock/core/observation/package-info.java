/**
 * Task observation SPI.
 *
 * <ul>
 *   <li>{@link com.ryuqq.workerlock.core.observation.TaskObserver} - transition and completion callbacks, invoked on the worker thread</li>
 *   <li>{@link com.ryuqq.workerlock.core.observation.noop.NoOpTaskObserver} - default, does nothing</li>
 * </ul>
 *
 * @since 1.0.0
 * @author WorkerLock Team
 */
package com.ryuqq.workerlock.core.observation;
