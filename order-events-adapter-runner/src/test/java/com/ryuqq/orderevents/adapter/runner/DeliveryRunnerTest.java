package com.ryuqq.orderevents.adapter.runner;

import com.ryuqq.orderevents.application.handler.EventHandler;
import com.ryuqq.orderevents.core.contract.DomainEvent;
import com.ryuqq.orderevents.core.model.OrderId;
import com.ryuqq.orderevents.core.outcome.Fail;
import com.ryuqq.orderevents.core.outcome.Ignored;
import com.ryuqq.orderevents.core.outcome.Processed;
import com.ryuqq.orderevents.core.outcome.Retry;
import com.ryuqq.orderevents.core.spi.Delivery;
import com.ryuqq.orderevents.core.spi.EventQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * DeliveryRunner 유닛 테스트.
 *
 * <p>결과별 큐 응답을 검증합니다:</p>
 * <ul>
 *   <li>Processed, Ignored → ack</li>
 *   <li>Retry → backoff nack, 시도 횟수 소진 시 DLQ</li>
 *   <li>Fail → DLQ 또는 ack</li>
 *   <li>핸들러 예외 → Retry와 동일</li>
 * </ul>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DeliveryRunnerTest {

    private static final DomainEvent EVENT =
        DomainEvent.of("ecommerce.delivery", "DeliveryCompleted", "O1", "{\"orderId\":\"O1\"}");

    @Mock
    private EventQueue queue;

    @Mock
    private EventHandler handler;

    private DeliveryRunner runner;

    @BeforeEach
    void setUp() {
        runner = newRunner(new RunnerConfig().withMaxAttempts(3));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        runner.shutdown();
    }

    private DeliveryRunner newRunner(RunnerConfig config) {
        return new DeliveryRunner(queue, handler, config, new BackoffCalculator(100, 1_000, 0.0));
    }

    // ============================================================
    // 1. 빈 큐
    // ============================================================

    @Test
    void pump_빈_큐면_0_반환() {
        when(queue.dequeue(10)).thenReturn(List.of());

        assertThat(runner.pump()).isZero();
        verifyNoInteractions(handler);
    }

    // ============================================================
    // 2. 성공 / 무시 → ack
    // ============================================================

    @Test
    void pump_Processed면_ack() {
        // given
        Delivery delivery = new Delivery("d-1", EVENT, 1);
        when(queue.dequeue(10)).thenReturn(List.of(delivery));
        when(handler.handle(EVENT)).thenReturn(new Processed(OrderId.of("O1"), Set.of("status"), true));

        // when
        int settled = runner.pump();

        // then
        assertThat(settled).isEqualTo(1);
        verify(queue).ack(delivery);
        verify(queue, never()).nack(any(), anyLong());
        verify(queue, never()).deadLetter(any(), anyString());
    }

    @Test
    void pump_Ignored면_ack() {
        Delivery delivery = new Delivery("d-1", EVENT, 1);
        when(queue.dequeue(10)).thenReturn(List.of(delivery));
        when(handler.handle(EVENT)).thenReturn(new Ignored("DeliveryCompleted", "unsupported"));

        runner.pump();

        verify(queue).ack(delivery);
    }

    @Test
    void pump_배치의_모든_전달을_처리() {
        Delivery first = new Delivery("d-1", EVENT, 1);
        Delivery second = new Delivery("d-2", EVENT, 1);
        Delivery third = new Delivery("d-3", EVENT, 1);
        when(queue.dequeue(10)).thenReturn(List.of(first, second, third));
        when(handler.handle(EVENT)).thenReturn(new Processed(OrderId.of("O1"), Set.of(), false));

        assertThat(runner.pump()).isEqualTo(3);
        verify(queue).ack(first);
        verify(queue).ack(second);
        verify(queue).ack(third);
    }

    // ============================================================
    // 3. Retry → nack / DLQ
    // ============================================================

    @Test
    void pump_Retry면_backoff_지연으로_nack() {
        // given
        Delivery delivery = new Delivery("d-1", EVENT, 2);
        when(queue.dequeue(10)).thenReturn(List.of(delivery));
        when(handler.handle(EVENT)).thenReturn(new Retry("CONCURRENT_UPDATE", "conflict"));

        // when
        runner.pump();

        // then
        verify(queue).nack(delivery, 200L);
        verify(queue, never()).ack(any());
    }

    @Test
    void pump_Retry_시도_횟수_소진시_DLQ() {
        Delivery delivery = new Delivery("d-1", EVENT, 3);
        when(queue.dequeue(10)).thenReturn(List.of(delivery));
        when(handler.handle(EVENT)).thenReturn(new Retry("ORDER_NOT_FOUND", "Order not found: O1"));

        runner.pump();

        verify(queue).deadLetter(delivery, "ORDER_NOT_FOUND: Order not found: O1");
        verify(queue, never()).nack(any(), anyLong());
    }

    @Test
    void pump_핸들러_예외는_Retry로_처리() {
        Delivery delivery = new Delivery("d-1", EVENT, 1);
        when(queue.dequeue(10)).thenReturn(List.of(delivery));
        when(handler.handle(EVENT)).thenThrow(new IllegalStateException("boom"));

        int settled = runner.pump();

        assertThat(settled).isEqualTo(1);
        verify(queue).nack(delivery, 100L);
    }

    @Test
    void pump_핸들러_예외_시도_횟수_소진시_DLQ() {
        Delivery delivery = new Delivery("d-1", EVENT, 3);
        when(queue.dequeue(10)).thenReturn(List.of(delivery));
        when(handler.handle(EVENT)).thenThrow(new IllegalStateException("boom"));

        runner.pump();

        verify(queue).deadLetter(eq(delivery), startsWith(DeliveryRunner.HANDLER_ERROR));
    }

    // ============================================================
    // 4. Fail → DLQ / ack
    // ============================================================

    @Test
    void pump_Fail이면_DLQ() {
        Delivery delivery = new Delivery("d-1", EVENT, 1);
        when(queue.dequeue(10)).thenReturn(List.of(delivery));
        when(handler.handle(EVENT)).thenReturn(Fail.of("INVALID_TRANSITION", "FULFILLED → PACKAGED"));

        runner.pump();

        verify(queue).deadLetter(delivery, "INVALID_TRANSITION: FULFILLED → PACKAGED");
        verify(queue, never()).ack(any());
    }

    @Test
    void pump_DLQ_비활성화면_Fail은_ack() throws InterruptedException {
        runner.shutdown();
        runner = newRunner(new RunnerConfig().withDlqEnabled(false));
        Delivery delivery = new Delivery("d-1", EVENT, 1);
        when(queue.dequeue(10)).thenReturn(List.of(delivery));
        when(handler.handle(EVENT)).thenReturn(Fail.of("MALFORMED_EVENT", "bad"));

        runner.pump();

        verify(queue).ack(delivery);
        verify(queue, never()).deadLetter(any(), anyString());
    }

    // ============================================================
    // 5. 큐 응답 실패
    // ============================================================

    @Test
    void pump_ack_실패는_나머지_전달_처리를_막지_않음() {
        Delivery failing = new Delivery("d-1", EVENT, 1);
        Delivery healthy = new Delivery("d-2", EVENT, 1);
        when(queue.dequeue(10)).thenReturn(List.of(failing, healthy));
        when(handler.handle(EVENT)).thenReturn(new Processed(OrderId.of("O1"), Set.of(), false));
        doThrow(new IllegalStateException("queue down")).when(queue).ack(failing);

        int settled = runner.pump();

        assertThat(settled).isEqualTo(1);
        verify(queue).ack(healthy);
    }

    @Test
    void 생성자_null_인자는_IllegalArgumentException() {
        assertThatThrownBy(() -> new DeliveryRunner(null, handler, new RunnerConfig()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DeliveryRunner(queue, null, new RunnerConfig()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DeliveryRunner(queue, handler, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
