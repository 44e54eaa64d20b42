package com.ryuqq.orderevents.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 재전달 지연 계산기 (Exponential Backoff with Jitter).
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(attempt-1), maxDelay)
 * delay = min(exponential + exponential * jitterFactor * random[0,1), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=500ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 500-550ms</li>
 *   <li>attempt=2: 1000-1100ms</li>
 *   <li>attempt=3: 2000-2200ms</li>
 * </ul>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=500ms, maxDelay=60000ms, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(500, 60000, 0.1);
    }

    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 첫 재전달 지연 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재전달 지연 계산.
     *
     * @param attempt 실패한 전달의 시도 번호 (1부터 시작)
     * @return 재전달 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        // 큰 attempt에서 shift overflow 방지
        int shift = Math.min(attempt - 1, MAX_SHIFT);
        long exponential = Math.min(baseDelayMs << shift, maxDelayMs);
        if (exponential < 0) {
            exponential = maxDelayMs;
        }
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
