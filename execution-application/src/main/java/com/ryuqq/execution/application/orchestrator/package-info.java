/**
 * Execution Application Layer - Executor 실행 조정.
 *
 * <p>이 패키지는 여러 Executor를 controller 단위로 묶어 생성, 조기 종료, 보고, 일괄 종료하는
 * 감독 코드를 담고 있습니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.execution.application.orchestrator.ExecutorOrchestrator} - Executor 실행 조정자</li>
 *   <li>{@link com.ryuqq.execution.application.orchestrator.ExecutorAction} - 생성/조기 종료 요청</li>
 *   <li>{@link com.ryuqq.execution.application.orchestrator.ExecutorFactory} - 유형별 Executor 생성기</li>
 *   <li>{@link com.ryuqq.execution.application.orchestrator.PerformanceReport} - controller 성과 요약</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>의존성 역전:</strong> 구체 Executor는 adapter-runner 모듈에 위치하며 팩토리로 주입</li>
 *   <li><strong>불변성:</strong> 요청, 설정, 보고서는 record</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 */
package com.ryuqq.execution.application.orchestrator;
