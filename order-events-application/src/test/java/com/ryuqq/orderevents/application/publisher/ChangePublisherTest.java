package com.ryuqq.orderevents.application.publisher;

import com.ryuqq.orderevents.application.config.OnEventsConfig;
import com.ryuqq.orderevents.core.contract.ChangeEvent;
import com.ryuqq.orderevents.core.exception.PublishException;
import com.ryuqq.orderevents.core.model.Order;
import com.ryuqq.orderevents.core.model.OrderStatus;
import com.ryuqq.orderevents.core.spi.EventBus;
import com.ryuqq.orderevents.core.statemachine.TransitionResult;
import com.ryuqq.orderevents.testkit.fixture.OrderFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

/**
 * ChangePublisher 테스트.
 *
 * @author Order Events Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ChangePublisherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Mock
    private EventBus eventBus;

    private ChangePublisher publisher;

    @BeforeEach
    void setUp() {
        OnEventsConfig config = new OnEventsConfig().withEventBusName(OrderFixtures.EVENT_BUS_NAME);
        publisher = new ChangePublisher(eventBus, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void prepare_전이_결과를_OrderModified_이벤트로_변환() {
        // given
        Order before = OrderFixtures.order();
        Order after = before.withStatus(OrderStatus.PACKAGED);
        TransitionResult result = new TransitionResult(before, after, Set.of("status", "products"));

        // when
        ChangeEvent change = publisher.prepare(result);

        // then
        assertThat(change.source()).isEqualTo(OnEventsConfig.DEFAULT_SOURCE);
        assertThat(change.detailType()).isEqualTo(ChangeEvent.ORDER_MODIFIED);
        assertThat(change.resources()).containsExactly(before.orderId().getValue());
        assertThat(change.detail().changed()).containsExactly("products", "status");
        assertThat(change.detail().oldImage()).containsEntry("status", "CREATED");
        assertThat(change.detail().newImage()).containsEntry("status", "PACKAGED");
        assertThat(change.eventBusName()).isEqualTo(OrderFixtures.EVENT_BUS_NAME);
        assertThat(change.time()).isEqualTo(NOW);
        assertThat(change.eventId()).isNotBlank();
    }

    @Test
    void prepare_호출마다_새로운_eventId() {
        Order before = OrderFixtures.order();
        TransitionResult result = new TransitionResult(before, before.withStatus(OrderStatus.PACKAGED), Set.of("status"));

        assertThat(publisher.prepare(result).eventId()).isNotEqualTo(publisher.prepare(result).eventId());
    }

    @Test
    void prepareNoOp_changed가_비어있고_old와_new가_같음() {
        Order order = OrderFixtures.order();

        ChangeEvent change = publisher.prepareNoOp(order);

        assertThat(change.isEmpty()).isTrue();
        assertThat(change.detail().oldImage()).isEqualTo(change.detail().newImage());
    }

    @Test
    void publish_버스로_전달() {
        ChangeEvent change = publisher.prepareNoOp(OrderFixtures.order());

        publisher.publish(change);

        verify(eventBus).publish(change);
    }

    @Test
    void publish_버스_오류는_PublishException으로_변환() {
        // given
        ChangeEvent change = publisher.prepareNoOp(OrderFixtures.order());
        IllegalStateException cause = new IllegalStateException("bus down");
        doThrow(cause).when(eventBus).publish(any());

        // when & then
        assertThatThrownBy(() -> publisher.publish(change))
            .isInstanceOf(PublishException.class)
            .hasCause(cause)
            .hasMessageContaining(change.eventId());
    }

    @Test
    void publish_PublishException은_그대로_전파() {
        ChangeEvent change = publisher.prepareNoOp(OrderFixtures.order());
        PublishException failure = new PublishException("throttled");
        doThrow(failure).when(eventBus).publish(any());

        assertThatThrownBy(() -> publisher.publish(change)).isSameAs(failure);
    }

    @Test
    void null_인자는_IllegalArgumentException() {
        assertThatThrownBy(() -> new ChangePublisher(null, new OnEventsConfig()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> publisher.prepare(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> publisher.prepareNoOp(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> publisher.publish(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
