/**
 * Conductor Application Layer - 파이프라인 Run 제어 API.
 *
 * <p>이 패키지는 프레젠테이션/전송 계층이 사용하는 제어 표면으로,
 * Run 시작, 상태 조회, 사용자 선택 전달, 취소, 이벤트 구독을 담당합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.application.orchestrator.Orchestrator} - Run 실행 조정자</li>
 *   <li>{@link com.ryuqq.conductor.application.orchestrator.RunListener} - 이벤트/부분 출력 수신자</li>
 *   <li>{@link com.ryuqq.conductor.application.orchestrator.Subscription} - 구독 핸들</li>
 *   <li>{@link com.ryuqq.conductor.application.orchestrator.FeedbackSelection} - 사용자 선택 값</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>유도된 상태:</strong> 조회 결과는 항상 이벤트 로그에서 접힌 상태</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.application.orchestrator;
