package com.ryuqq.orderevents.application.handler;

import com.ryuqq.orderevents.application.codec.EventEnvelopeCodec;
import com.ryuqq.orderevents.application.config.OnEventsConfig;
import com.ryuqq.orderevents.application.normalizer.EventNormalizer;
import com.ryuqq.orderevents.application.publisher.ChangePublisher;
import com.ryuqq.orderevents.core.contract.ChangeEvent;
import com.ryuqq.orderevents.core.contract.DomainEvent;
import com.ryuqq.orderevents.core.contract.NormalizedEvent;
import com.ryuqq.orderevents.core.exception.ConcurrentUpdateException;
import com.ryuqq.orderevents.core.exception.OrderEventException;
import com.ryuqq.orderevents.core.exception.OrderNotFoundException;
import com.ryuqq.orderevents.core.exception.UnsupportedEventException;
import com.ryuqq.orderevents.core.model.Order;
import com.ryuqq.orderevents.core.model.OrderId;
import com.ryuqq.orderevents.core.outcome.Fail;
import com.ryuqq.orderevents.core.outcome.HandlingOutcome;
import com.ryuqq.orderevents.core.outcome.Ignored;
import com.ryuqq.orderevents.core.outcome.Processed;
import com.ryuqq.orderevents.core.outcome.Retry;
import com.ryuqq.orderevents.core.spi.EventBus;
import com.ryuqq.orderevents.core.spi.OrderStore;
import com.ryuqq.orderevents.core.statemachine.OrderTransitionEngine;
import com.ryuqq.orderevents.core.statemachine.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * 창고/배송 이벤트를 주문 상태 변경으로 반영하는 핸들러.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>정규화 ({@link EventNormalizer})</li>
 *   <li>처리 대상이 아닌 이벤트는 주문을 읽지 않고 {@link Ignored}</li>
 *   <li>주문 조회 (없으면 {@link OrderNotFoundException})</li>
 *   <li>전이 ({@link OrderTransitionEngine})</li>
 *   <li>변경 없음: 저장하지 않고 남아 있는 pending 변경만 재발행</li>
 *   <li>변경 있음: 조건부 저장 + pending 기록 → 발행 → 발행 완료 표시</li>
 * </ol>
 *
 * <p><strong>결과 매핑:</strong></p>
 * <ul>
 *   <li>재시도 가능한 오류 → {@link Retry} (런타임이 재전달)</li>
 *   <li>재시도 불가능한 오류 → {@link Fail} (로그 후 폐기)</li>
 *   <li>예상하지 못한 런타임 예외 → {@link Retry} (어댑터의 일시 장애로 간주)</li>
 * </ul>
 *
 * <p>핸들러 내부에서는 재시도하지 않습니다. 같은 주문에 대한 동시 호출은 저장소의 조건부 쓰기로만
 * 직렬화됩니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class OnEventsHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(OnEventsHandler.class);

    static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

    private final EventEnvelopeCodec codec;
    private final EventNormalizer normalizer;
    private final OrderTransitionEngine engine;
    private final OrderStore store;
    private final ChangePublisher publisher;
    private final OnEventsConfig config;

    /**
     * 기본 구성 요소로 핸들러 생성.
     *
     * @param store 주문 저장소
     * @param eventBus 변경 이벤트 버스
     * @param config 핸들러 설정
     */
    public OnEventsHandler(OrderStore store, EventBus eventBus, OnEventsConfig config) {
        this(new EventEnvelopeCodec(), new EventNormalizer(), new OrderTransitionEngine(),
            store, new ChangePublisher(eventBus, config), config);
    }

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public OnEventsHandler(
        EventEnvelopeCodec codec,
        EventNormalizer normalizer,
        OrderTransitionEngine engine,
        OrderStore store,
        ChangePublisher publisher,
        OnEventsConfig config
    ) {
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.codec = codec;
        this.normalizer = normalizer;
        this.engine = engine;
        this.store = store;
        this.publisher = publisher;
        this.config = config;
    }

    @Override
    public HandlingOutcome handle(String rawEnvelope) {
        DomainEvent event;
        try {
            event = codec.decode(rawEnvelope);
        } catch (OrderEventException e) {
            return failed(HandlingStage.RECEIVED, null, e);
        }
        return handle(event);
    }

    @Override
    public HandlingOutcome handle(DomainEvent event) {
        HandlingStage stage = HandlingStage.RECEIVED;
        OrderId orderId = null;
        try {
            NormalizedEvent normalized = normalizer.normalize(event);
            stage = HandlingStage.NORMALIZED;
            orderId = normalized.orderId();

            if (!engine.supports(normalized)) {
                return ignored(stage, normalized.detailType(),
                    String.format("Unsupported event %s from %s", normalized.detailType(), normalized.source()));
            }

            final OrderId id = orderId;
            Order current = store.get(id)
                .orElseThrow(() -> new OrderNotFoundException(id, config.retryMissingOrders()));
            stage = HandlingStage.LOADED;

            TransitionResult result = engine.apply(current, normalized);
            stage = HandlingStage.TRANSITIONED;

            if (result.isNoOp()) {
                return handleNoOp(current, normalized.detailType());
            }

            ChangeEvent change = publisher.prepare(result);
            if (!store.commit(current, result.updated(), change)) {
                throw new ConcurrentUpdateException(
                    String.format("Order %s changed while applying %s", orderId.getValue(), normalized.detailType()));
            }
            stage = HandlingStage.PERSISTED;

            publisher.publish(change);
            store.markPublished(change);
            stage = HandlingStage.PUBLISHED;

            log.info("Processed {} for {}: {} → {} changed={} stage={}",
                normalized.detailType(), orderId.getValue(), current.status(), result.updated().status(),
                result.changedFields(), HandlingStage.DONE);
            return new Processed(orderId, result.changedFields(), true);

        } catch (UnsupportedEventException e) {
            return ignored(stage, e.getDetailType(), e.getMessage());
        } catch (OrderEventException e) {
            return failed(stage, orderId, e);
        } catch (RuntimeException e) {
            log.warn("Unexpected error at stage {} for {}: treating as transient", stage, idOf(orderId), e);
            return new Retry(UNEXPECTED_ERROR, describe(e));
        }
    }

    private HandlingOutcome handleNoOp(Order current, String detailType) {
        OrderId orderId = current.orderId();
        List<ChangeEvent> pending = store.pendingChanges(orderId);
        if (!pending.isEmpty()) {
            for (ChangeEvent change : pending) {
                publisher.publish(change);
                store.markPublished(change);
            }
            log.info("No-op {} for {}: re-published {} pending change(s) stage={}",
                detailType, orderId.getValue(), pending.size(), HandlingStage.DONE);
            return new Processed(orderId, Set.of(), true);
        }

        if (config.publishNoOpChanges()) {
            publisher.publish(publisher.prepareNoOp(current));
            log.info("No-op {} for {}: published empty change stage={}", detailType, orderId.getValue(), HandlingStage.DONE);
            return new Processed(orderId, Set.of(), true);
        }

        log.info("No-op {} for {}: nothing to publish stage={}", detailType, orderId.getValue(), HandlingStage.DONE);
        return new Processed(orderId, Set.of(), false);
    }

    private HandlingOutcome ignored(HandlingStage stage, String detailType, String reason) {
        log.info("Ignored {} at stage {}: {}", detailType, stage, reason);
        return new Ignored(detailType, reason);
    }

    private HandlingOutcome failed(HandlingStage reached, OrderId orderId, OrderEventException e) {
        String message = describe(e);
        if (e.isRetryable()) {
            log.warn("Retryable {} for {} after stage {}: {} stage={}",
                e.getErrorCode(), idOf(orderId), reached, message, HandlingStage.FAILED);
            return new Retry(e.getErrorCode(), message);
        }
        log.error("Dropping event for {} after stage {}: {} {} stage={}",
            idOf(orderId), reached, e.getErrorCode(), message, HandlingStage.FAILED);
        return new Fail(e.getErrorCode(), message, e.getCause() == null ? null : e.getCause().toString());
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static String idOf(OrderId orderId) {
        return orderId == null ? "<unknown>" : orderId.getValue();
    }
}
