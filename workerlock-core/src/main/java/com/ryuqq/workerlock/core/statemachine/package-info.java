/**
 * Task state machines.
 *
 * <p>Two independent machines describe a worker task: the internal protocol
 * ({@link com.ryuqq.workerlock.core.statemachine.WorkerState}) and the result recorded for the
 * caller ({@link com.ryuqq.workerlock.core.statemachine.CompletionStatus}).</p>
 *
 * <h2>Worker protocol</h2>
 * <pre>
 * INIT → PRE_LOCK_WAIT → LOCKING → HOLDING_LOCK → UNLOCKING → DONE
 * LOCKING → DONE (acquisition failed)
 * </pre>
 *
 * <h2>Completion status</h2>
 * <pre>
 * PENDING → SUCCESS
 * PENDING → FAILURE
 *
 * Forbidden:
 * - any second terminal write
 * - SUCCESS/FAILURE → PENDING
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * WorkerState state = WorkerState.INIT;
 * state = WorkerStateTransition.transition(state, WorkerState.PRE_LOCK_WAIT);
 *
 * // This will throw IllegalStateException
 * WorkerStateTransition.validate(state, WorkerState.HOLDING_LOCK);
 * </pre>
 *
 * @since 1.0.0
 * @author WorkerLock Team
 */
package com.ryuqq.workerlock.core.statemachine;
