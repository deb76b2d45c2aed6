/**
 * Runner Adapter Layer - 구체 Executor 구현체.
 *
 * <p>이 패키지는 {@link com.ryuqq.execution.core.executor.ExecutorBase} 계약을 따르는 실제 Executor들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.execution.adapter.runner.PositionExecutor} - triple barrier 포지션 (손절, 익절, 시간 제한)</li>
 *   <li>{@link com.ryuqq.execution.adapter.runner.OrderChaserExecutor} - 호가 추종 지정가 주문</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (PositionExecutor, OrderChaserExecutor)
 *   ↓ extends
 * core/executor (ExecutorBase)
 *   ↓ extends
 * core/runnable (RunnableBase)
 *   ↓ depends on
 * core/spi (ExchangeConnector, OrderEventSource)
 * </pre>
 *
 * @author Execution Team
 * @since 1.0.0
 */
package com.ryuqq.execution.adapter.runner;
