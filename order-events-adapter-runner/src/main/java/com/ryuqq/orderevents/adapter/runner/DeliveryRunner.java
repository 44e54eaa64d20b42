package com.ryuqq.orderevents.adapter.runner;

import com.ryuqq.orderevents.application.handler.EventHandler;
import com.ryuqq.orderevents.core.outcome.Fail;
import com.ryuqq.orderevents.core.outcome.HandlingOutcome;
import com.ryuqq.orderevents.core.outcome.Ignored;
import com.ryuqq.orderevents.core.outcome.Processed;
import com.ryuqq.orderevents.core.outcome.Retry;
import com.ryuqq.orderevents.core.spi.Delivery;
import com.ryuqq.orderevents.core.spi.EventQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 이벤트 큐 전달 러너.
 *
 * <p>큐에서 전달을 배치로 가져와 {@link EventHandler}에 넘기고, 결과에 따라 큐에 응답합니다.
 * 관리형 큐의 redrive 설정을 대신하는 참조 구현이며, 재시도 정책은 handler가 아닌 이 러너에만 있습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * dequeue(batchSize) → [Delivery1, Delivery2, ...]
 *   ↓
 * 워커 풀에서 병렬 처리 (배치 완료까지 대기, maxProcessingTimeMs 제한)
 *   - Processed, Ignored → ack
 *   - Retry → attempt &lt; maxAttempts면 backoff 후 nack, 아니면 DLQ
 *   - Fail → DLQ (dlqEnabled=false면 로그 후 ack)
 *   - 핸들러 예외 → Retry와 동일하게 처리
 * </pre>
 *
 * <p>제한 시간 안에 끝나지 않은 전달은 취소되고 응답하지 않은 채로 남습니다.
 * 큐의 visibility timeout이 지나면 다시 전달됩니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public final class DeliveryRunner {

    private static final Logger log = LoggerFactory.getLogger(DeliveryRunner.class);

    static final String HANDLER_ERROR = "HANDLER_ERROR";

    private final EventQueue queue;
    private final EventHandler handler;
    private final RunnerConfig config;
    private final BackoffCalculator backoffCalculator;
    private final ExecutorService workerExecutor;

    public DeliveryRunner(EventQueue queue, EventHandler handler, RunnerConfig config) {
        this(queue, handler, config, new BackoffCalculator());
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param queue 인바운드 이벤트 큐
     * @param handler 이벤트 핸들러
     * @param config 설정
     * @param backoffCalculator 백오프 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DeliveryRunner(EventQueue queue, EventHandler handler, RunnerConfig config, BackoffCalculator backoffCalculator) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.queue = queue;
        this.handler = handler;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    /**
     * 배치 하나를 가져와 처리.
     *
     * @return 큐에 응답(ack, nack, DLQ)까지 마친 전달 수
     * @throws IllegalStateException 배치 대기 중 인터럽트 발생 시
     */
    public int pump() {
        List<Delivery> deliveries = queue.dequeue(config.batchSize());
        if (deliveries.isEmpty()) {
            return 0;
        }

        List<Callable<HandlingOutcome>> tasks = new ArrayList<>(deliveries.size());
        for (Delivery delivery : deliveries) {
            tasks.add(() -> process(delivery));
        }

        List<Future<HandlingOutcome>> futures;
        try {
            futures = workerExecutor.invokeAll(tasks, config.maxProcessingTimeMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for delivery batch", e);
        }

        int completed = 0;
        for (int i = 0; i < futures.size(); i++) {
            Delivery delivery = deliveries.get(i);
            try {
                futures.get(i).get();
                completed++;
            } catch (CancellationException e) {
                log.warn("Delivery {} timed out after {}ms, left for redelivery",
                    delivery.deliveryId(), config.maxProcessingTimeMs());
            } catch (ExecutionException e) {
                log.error("Failed to settle delivery {}, left for redelivery", delivery.deliveryId(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while collecting delivery batch", e);
            }
        }
        log.debug("Pumped {} deliveries, {} settled", deliveries.size(), completed);
        return completed;
    }

    /**
     * 워커 풀 종료.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    private HandlingOutcome process(Delivery delivery) {
        HandlingOutcome outcome;
        try {
            outcome = handler.handle(delivery.event());
        } catch (RuntimeException e) {
            log.warn("Handler threw for delivery {} (attempt {})", delivery.deliveryId(), delivery.attempt(), e);
            outcome = new Retry(HANDLER_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        settle(delivery, outcome);
        return outcome;
    }

    private void settle(Delivery delivery, HandlingOutcome outcome) {
        if (outcome instanceof Processed || outcome instanceof Ignored) {
            queue.ack(delivery);
        } else if (outcome instanceof Retry) {
            handleRetry(delivery, (Retry) outcome);
        } else if (outcome instanceof Fail) {
            Fail fail = (Fail) outcome;
            deadLetterOrDrop(delivery, fail.errorCode() + ": " + fail.message());
        } else {
            throw new IllegalStateException("Unknown outcome: " + outcome);
        }
    }

    private void handleRetry(Delivery delivery, Retry retry) {
        if (delivery.attempt() < config.maxAttempts()) {
            long delay = backoffCalculator.calculate(delivery.attempt());
            queue.nack(delivery, delay);
            log.info("Retry scheduled for delivery {} after {}ms (attempt {}): {}",
                delivery.deliveryId(), delay, delivery.attempt(), retry.errorCode());
            return;
        }
        log.warn("Retry budget exhausted for delivery {} after {} attempts", delivery.deliveryId(), delivery.attempt());
        deadLetterOrDrop(delivery, retry.errorCode() + ": " + retry.reason());
    }

    private void deadLetterOrDrop(Delivery delivery, String reason) {
        if (config.dlqEnabled()) {
            queue.deadLetter(delivery, reason);
            log.error("Delivery {} moved to DLQ: {}", delivery.deliveryId(), reason);
        } else {
            queue.ack(delivery);
            log.error("Delivery {} dropped: {}", delivery.deliveryId(), reason);
        }
    }
}
