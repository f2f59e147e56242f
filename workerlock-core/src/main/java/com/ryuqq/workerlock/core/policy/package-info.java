/**
 * Lock acquisition policy.
 *
 * <p>{@link com.ryuqq.workerlock.core.policy.LockWaitPolicy#unbounded()} is the default and
 * matches the plain blocking acquisition. A bounded wait is an additive, opt-in capability.</p>
 *
 * @since 1.0.0
 * @author WorkerLock Team
 */
package com.ryuqq.workerlock.core.policy;
