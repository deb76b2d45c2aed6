/**
 * In-memory paper exchange.
 *
 * <p>{@link com.ryuqq.execution.adapter.inmemory.exchange.InMemoryExchangeConnector} matches orders against
 * prices set by the caller and publishes the resulting order events to an
 * {@link com.ryuqq.execution.adapter.inmemory.bus.InMemoryOrderEventBus}.</p>
 *
 * <p>Intended for tests and local runs; it keeps no state outside the JVM.</p>
 */
package com.ryuqq.execution.adapter.inmemory.exchange;
