/**
 * Runner Adapter Layer - reference runtime for the event handler.
 *
 * <p>관리형 큐의 재전달 설정(backoff, 최대 시도 횟수, DLQ)을 in-memory 큐 위에서 흉내 내는 테스트 하네스입니다.
 * 서비스 자체는 재시도하지 않으며 handler는 Retry/Fail 결과만 반환합니다.
 * 실제 배포에서는 전송 계층의 redrive 설정이 이 모듈을 대신합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.orderevents.adapter.runner.DeliveryRunner} - drains the event queue into the handler</li>
 *   <li>{@link com.ryuqq.orderevents.adapter.runner.ChangeFinalizer} - re-publishes pending change events</li>
 * </ul>
 *
 * <pre>
 * adapter-runner (DeliveryRunner, ChangeFinalizer)
 *   ↓ drives
 * application (EventHandler, ChangePublisher)
 *   ↓ depends on
 * core (outcome, spi)
 * </pre>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
package com.ryuqq.orderevents.adapter.runner;
