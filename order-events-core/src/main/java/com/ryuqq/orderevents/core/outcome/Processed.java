package com.ryuqq.orderevents.core.outcome;

import com.ryuqq.orderevents.core.model.OrderId;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 처리 완료 결과.
 *
 * <p>changed가 비어 있으면 멱등 재처리(no-op)였음을 뜻합니다.
 * published는 이번 처리에서 OrderModified 이벤트를 하나 이상 발행했는지를 나타냅니다.</p>
 *
 * @param orderId 대상 주문
 * @param changed 변경된 최상위 필드 이름 (이름순, 읽기 전용)
 * @param published 발행 여부
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record Processed(
    OrderId orderId,
    Set<String> changed,
    boolean published
) implements HandlingOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException orderId 또는 changed가 null인 경우
     */
    public Processed {
        if (orderId == null) {
            throw new IllegalArgumentException("orderId cannot be null");
        }
        if (changed == null) {
            throw new IllegalArgumentException("changed cannot be null");
        }
        changed = Collections.unmodifiableSet(new TreeSet<>(changed));
    }

    /**
     * 변경 없는 처리인지 확인.
     *
     * @return changed가 비어 있으면 true
     */
    public boolean isNoOp() {
        return changed.isEmpty();
    }
}
