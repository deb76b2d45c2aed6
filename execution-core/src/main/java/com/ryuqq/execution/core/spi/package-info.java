/**
 * Collaborator interfaces required by the execution core.
 *
 * <ul>
 *   <li>{@link com.ryuqq.execution.core.spi.ExchangeConnector} - order placement and market data</li>
 *   <li>{@link com.ryuqq.execution.core.spi.OrderEventSource} - order event subscription</li>
 *   <li>{@link com.ryuqq.execution.core.spi.MessageStream} - message source for stream connectors</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execution.core.spi;
