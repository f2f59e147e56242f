/**
 * Contract test support for launcher implementations.
 *
 * <p>Includes a base test class, a recording observer that captures critical section
 * timings, and allocator/thread factory doubles that inject synchronous failures.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
package com.ryuqq.workerlock.testkit.contract;
