package com.ryuqq.orderevents.adapter.runner;

/**
 * ChangeFinalizer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms)</li>
 *   <li>batchSize: 한 번에 재발행할 pending 변경 수 (기본 100)</li>
 * </ul>
 *
 * <p>scanIntervalMs가 짧을수록 발행 실패 후 알림 지연이 줄지만 정상 처리 중인 변경과 겹쳐 중복 발행이
 * 늘어납니다. 수신 측은 eventId로 중복을 제거해야 합니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수)
 * @param batchSize 배치 크기 (1 이상)
 */
public record FinalizerConfig(long scanIntervalMs, int batchSize) {

    public FinalizerConfig() {
        this(60000, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FinalizerConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException("scanIntervalMs must be positive (current: " + scanIntervalMs + ")");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
    }

    public FinalizerConfig withScanIntervalMs(long scanIntervalMs) {
        return new FinalizerConfig(scanIntervalMs, batchSize);
    }

    public FinalizerConfig withBatchSize(int batchSize) {
        return new FinalizerConfig(scanIntervalMs, batchSize);
    }
}
