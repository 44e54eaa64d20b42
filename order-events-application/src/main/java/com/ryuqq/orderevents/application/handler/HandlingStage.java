package com.ryuqq.orderevents.application.handler;

/**
 * 이벤트 처리 단계.
 *
 * <pre>
 * RECEIVED → NORMALIZED → LOADED → TRANSITIONED → PERSISTED → PUBLISHED → DONE
 *     └──────────┴───────────┴──────────┴─────────────┴───────────┴──► FAILED
 * </pre>
 *
 * <p>모든 처리 결과는 도달한 단계와 함께 로그에 남습니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public enum HandlingStage {

    RECEIVED,
    NORMALIZED,
    LOADED,
    TRANSITIONED,
    PERSISTED,
    PUBLISHED,
    DONE,
    FAILED
}
