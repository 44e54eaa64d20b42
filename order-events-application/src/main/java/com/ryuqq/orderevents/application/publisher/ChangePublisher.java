package com.ryuqq.orderevents.application.publisher;

import com.ryuqq.orderevents.application.config.OnEventsConfig;
import com.ryuqq.orderevents.core.contract.ChangeDetail;
import com.ryuqq.orderevents.core.contract.ChangeEvent;
import com.ryuqq.orderevents.core.exception.PublishException;
import com.ryuqq.orderevents.core.model.Order;
import com.ryuqq.orderevents.core.spi.EventBus;
import com.ryuqq.orderevents.core.statemachine.TransitionResult;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * OrderModified 변경 이벤트 생성 및 발행.
 *
 * <p>이벤트 생성({@link #prepare})과 발행({@link #publish})을 나눠, 저장소가 발행 전에
 * 변경 이벤트를 pending으로 기록할 수 있게 합니다.</p>
 *
 * <p><strong>발행 형식:</strong></p>
 * <ul>
 *   <li>source: {@link OnEventsConfig#source()}</li>
 *   <li>detail-type: OrderModified</li>
 *   <li>resources: [orderId]</li>
 *   <li>detail: changed(이름순), old, new</li>
 * </ul>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class ChangePublisher {

    private final EventBus eventBus;
    private final OnEventsConfig config;
    private final Clock clock;

    public ChangePublisher(EventBus eventBus, OnEventsConfig config) {
        this(eventBus, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param eventBus 이벤트 버스
     * @param config 핸들러 설정
     * @param clock 이벤트 시각에 사용할 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ChangePublisher(EventBus eventBus, OnEventsConfig config, Clock clock) {
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.eventBus = eventBus;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 전이 결과로부터 변경 이벤트 생성.
     *
     * @param result 전이 결과
     * @return 변경 이벤트 (아직 발행되지 않음)
     * @throws IllegalArgumentException result가 null인 경우
     */
    public ChangeEvent prepare(TransitionResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return build(result.previous(), new ArrayList<>(result.changedFields()),
            result.previous().toFieldMap(), result.updated().toFieldMap());
    }

    /**
     * 변경 없는 전이에 대한 빈 변경 이벤트 생성.
     *
     * @param order 현재 주문
     * @return changed가 빈 변경 이벤트
     * @throws IllegalArgumentException order가 null인 경우
     */
    public ChangeEvent prepareNoOp(Order order) {
        if (order == null) {
            throw new IllegalArgumentException("order cannot be null");
        }
        Map<String, Object> image = order.toFieldMap();
        return build(order, List.of(), image, image);
    }

    /**
     * 변경 이벤트 발행.
     *
     * @param event 변경 이벤트
     * @throws IllegalArgumentException event가 null인 경우
     * @throws PublishException 버스가 이벤트를 받지 못한 경우 (재시도 가능)
     */
    public void publish(ChangeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        try {
            eventBus.publish(event);
        } catch (PublishException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PublishException(
                String.format("Failed to publish %s %s for %s", event.detailType(), event.eventId(), event.orderId().getValue()),
                e
            );
        }
    }

    private ChangeEvent build(Order order, List<String> changed, Map<String, Object> oldImage, Map<String, Object> newImage) {
        return ChangeEvent.orderModified(
            UUID.randomUUID().toString(),
            config.source(),
            order.orderId(),
            new ChangeDetail(changed, oldImage, newImage),
            config.eventBusName(),
            Instant.now(clock)
        );
    }
}
