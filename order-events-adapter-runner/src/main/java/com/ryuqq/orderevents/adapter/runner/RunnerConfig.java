package com.ryuqq.orderevents.adapter.runner;

/**
 * DeliveryRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: 한 번에 dequeue할 전달 수 (기본 10)</li>
 *   <li>concurrency: 동시 처리 스레드 수 (기본 5)</li>
 *   <li>maxProcessingTimeMs: 배치 하나의 최대 처리 시간 (기본 30000ms)</li>
 *   <li>maxAttempts: 최대 전달 시도 횟수, 소진 시 DLQ (기본 5)</li>
 *   <li>dlqEnabled: DLQ 전송 여부, false면 로그 후 ack (기본 true)</li>
 * </ul>
 *
 * <p>같은 주문에 대한 이벤트가 한 배치에서 동시에 처리될 수 있습니다. 충돌은 저장소의 조건부 쓰기가
 * 감지하고 {@code CONCURRENT_UPDATE} 재시도로 이어집니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상)
 * @param concurrency 동시 처리 스레드 수 (1 이상)
 * @param maxProcessingTimeMs 배치 처리 제한 시간 (밀리초, 양수)
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param dlqEnabled DLQ 전송 여부
 */
public record RunnerConfig(
    int batchSize,
    int concurrency,
    long maxProcessingTimeMs,
    int maxAttempts,
    boolean dlqEnabled
) {

    /**
     * 기본 설정 생성자.
     */
    public RunnerConfig() {
        this(10, 5, 30000, 5, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RunnerConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (maxProcessingTimeMs <= 0) {
            throw new IllegalArgumentException(
                "maxProcessingTimeMs must be positive (current: " + maxProcessingTimeMs + ")");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
    }

    public RunnerConfig withBatchSize(int batchSize) {
        return new RunnerConfig(batchSize, concurrency, maxProcessingTimeMs, maxAttempts, dlqEnabled);
    }

    public RunnerConfig withConcurrency(int concurrency) {
        return new RunnerConfig(batchSize, concurrency, maxProcessingTimeMs, maxAttempts, dlqEnabled);
    }

    public RunnerConfig withMaxProcessingTimeMs(long maxProcessingTimeMs) {
        return new RunnerConfig(batchSize, concurrency, maxProcessingTimeMs, maxAttempts, dlqEnabled);
    }

    public RunnerConfig withMaxAttempts(int maxAttempts) {
        return new RunnerConfig(batchSize, concurrency, maxProcessingTimeMs, maxAttempts, dlqEnabled);
    }

    public RunnerConfig withDlqEnabled(boolean dlqEnabled) {
        return new RunnerConfig(batchSize, concurrency, maxProcessingTimeMs, maxAttempts, dlqEnabled);
    }
}
