/**
 * Parameter block and its ownership rules.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workerlock.core.block.ParameterBlock} - per-task configuration and single result field</li>
 *   <li>{@link com.ryuqq.workerlock.core.block.BlockOwner} - the party owning a block</li>
 *   <li>{@link com.ryuqq.workerlock.core.block.OwnershipTransition} - allowed ownership transfers</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * allocate (LAUNCHER) → thread start (WORKER) → join (JOINER) → release (RELEASED)
 * allocate (LAUNCHER) → spawn failure → release (RELEASED)
 * </pre>
 *
 * <p>Transfers are compare-and-set, so a second join or a second release fails fast instead of
 * aliasing the block.</p>
 *
 * @since 1.0.0
 * @author WorkerLock Team
 */
package com.ryuqq.workerlock.core.block;
