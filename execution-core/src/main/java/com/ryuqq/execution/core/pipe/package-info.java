/**
 * Bounded pipe primitive with end-of-stream signalling.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.execution.core.pipe.Pipe} - Bounded FIFO with deferred SENTINEL and retrying put</li>
 *   <li>{@link com.ryuqq.execution.core.pipe.PipeItem} - Data or SENTINEL</li>
 *   <li>{@link com.ryuqq.execution.core.pipe.PutOptions} - Backpressure retry budget</li>
 *   <li>{@link com.ryuqq.execution.core.pipe.PipeIterator} - Iteration up to the SENTINEL</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.execution.core.pipe.PipeFullException} - retry budget exhausted (transient)</li>
 *   <li>{@link com.ryuqq.execution.core.pipe.PipeStoppedException} - put after stop (producer must stop)</li>
 *   <li>{@link com.ryuqq.execution.core.pipe.PipeSentinelException} - SENTINEL put directly (programming error)</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Pipe<Trade> pipe = new Pipe<>(1000);
 * pipe.put(trade, new PutOptions(Duration.ofMillis(100), 3, Duration.ofSeconds(1)));
 * pipe.stop();
 *
 * for (Trade t : Pipe.iterate(pipe)) {
 *     handle(t);
 * }
 * }</pre>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execution.core.pipe;
