/**
 * In-memory order event bus.
 *
 * <p>Reference implementation of {@link com.ryuqq.execution.core.spi.OrderEventSource} with
 * explicit, deterministic delivery through
 * {@link com.ryuqq.execution.adapter.inmemory.bus.InMemoryOrderEventBus#dispatchPending()}.</p>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execution.adapter.inmemory.bus;
