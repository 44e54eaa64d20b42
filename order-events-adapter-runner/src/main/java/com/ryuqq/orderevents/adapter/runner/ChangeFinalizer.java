package com.ryuqq.orderevents.adapter.runner;

import com.ryuqq.orderevents.application.publisher.ChangePublisher;
import com.ryuqq.orderevents.core.contract.ChangeEvent;
import com.ryuqq.orderevents.core.spi.OrderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 발행되지 않은 변경 이벤트 복구 컴포넌트.
 *
 * <p>주문 저장 후 발행 전에 실패한 변경 이벤트를 주기적으로 재발행합니다.</p>
 *
 * <p><strong>복구 시나리오:</strong></p>
 * <pre>
 * 1. 핸들러가 commit(expected, updated, change) 성공 → change는 PENDING
 * 2. publish(change) 실패 또는 markPublished 전 크래시
 * 3. ChangeFinalizer가 scanPending(batchSize) 실행
 * 4. 오래된 순으로 publish → markPublished
 * </pre>
 *
 * <p><strong>멱등성:</strong></p>
 * <ul>
 *   <li>같은 변경이 핸들러와 동시에 재발행될 수 있음 (eventId 동일)</li>
 *   <li>markPublished는 여러 번 호출해도 안전</li>
 *   <li>한 항목의 실패가 나머지 항목 처리를 막지 않음</li>
 * </ul>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public final class ChangeFinalizer {

    private static final Logger log = LoggerFactory.getLogger(ChangeFinalizer.class);

    private final OrderStore store;
    private final ChangePublisher publisher;
    private final FinalizerConfig config;

    /**
     * 생성자.
     *
     * @param store 주문 저장소
     * @param publisher 변경 이벤트 발행기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ChangeFinalizer(OrderStore store, ChangePublisher publisher, FinalizerConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.publisher = publisher;
        this.config = config;
    }

    /**
     * PENDING 변경 스캔 및 재발행.
     *
     * @return 재발행 후 발행 완료로 표시한 변경 수
     */
    public int scan() {
        List<ChangeEvent> pending = store.scanPending(config.batchSize());
        if (pending.isEmpty()) {
            log.debug("Finalizer scan: no pending changes");
            return 0;
        }

        int recovered = 0;
        for (ChangeEvent change : pending) {
            if (tryPublish(change)) {
                recovered++;
            }
        }
        log.info("Finalizer scan completed: {} recovered out of {} pending", recovered, pending.size());
        return recovered;
    }

    /**
     * scanIntervalMs 주기로 {@link #scan()}을 예약.
     *
     * @param scheduler 스케줄러
     * @return 예약된 작업 (취소용)
     * @throws IllegalArgumentException scheduler가 null인 경우
     */
    public ScheduledFuture<?> start(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        return scheduler.scheduleWithFixedDelay(this::scanSafely,
            config.scanIntervalMs(), config.scanIntervalMs(), TimeUnit.MILLISECONDS);
    }

    private void scanSafely() {
        // 예외가 빠져나가면 이후 실행이 모두 취소됨
        try {
            scan();
        } catch (RuntimeException e) {
            log.error("Finalizer scan failed, will retry in {}ms", config.scanIntervalMs(), e);
        }
    }

    private boolean tryPublish(ChangeEvent change) {
        try {
            publisher.publish(change);
            store.markPublished(change);
            log.info("Finalizer re-published {} for {}", change.eventId(), change.orderId().getValue());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to re-publish {} for {}", change.eventId(), change.orderId().getValue(), e);
            return false;
        }
    }
}
