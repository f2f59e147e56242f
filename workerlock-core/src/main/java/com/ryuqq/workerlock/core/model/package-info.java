/**
 * Identifier types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.workerlock.core.model.TaskId} - validated task identifier used for thread names and log correlation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author WorkerLock Team
 */
package com.ryuqq.workerlock.core.model;
