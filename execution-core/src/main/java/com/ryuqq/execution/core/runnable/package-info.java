/**
 * Worker lifecycle package.
 *
 * <p>This package implements the four-state lifecycle shared by every long-running worker
 * and the periodic control loop that drives it.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.execution.core.runnable.RunnableStatus} - Worker lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.execution.core.runnable.StatusTransition} - Forward-only transition validation</li>
 *   <li>{@link com.ryuqq.execution.core.runnable.RunnableBase} - Background loop invoking {@code controlTask()} every interval</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * NOT_STARTED → RUNNING (start)
 * RUNNING → SHUTTING_DOWN (stop / earlyStop)
 * SHUTTING_DOWN → TERMINATED (loop unwound)
 * NOT_STARTED → TERMINATED (stop before start)
 *
 * Forbidden:
 * - TERMINATED → * (terminal state)
 * - Backward transitions (e.g., SHUTTING_DOWN → RUNNING)
 * </pre>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execution.core.runnable;
