package com.ryuqq.orderevents.core.statemachine;

import com.ryuqq.orderevents.core.model.Order;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 이벤트 하나를 적용한 결과.
 *
 * @param previous 적용 전 주문 (저장소에서 읽은 그대로)
 * @param updated 적용 후 주문 (변경이 없으면 previous와 동일)
 * @param changedFields 변경된 최상위 필드 이름 (이름순)
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record TransitionResult(
    Order previous,
    Order updated,
    Set<String> changedFields
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 서로 다른 주문인 경우
     */
    public TransitionResult {
        if (previous == null || updated == null) {
            throw new IllegalArgumentException("Orders cannot be null (previous: " + previous + ", updated: " + updated + ")");
        }
        if (!previous.orderId().equals(updated.orderId())) {
            throw new IllegalArgumentException("previous and updated must describe the same order");
        }
        if (changedFields == null) {
            throw new IllegalArgumentException("changedFields cannot be null");
        }
        changedFields = Collections.unmodifiableSet(new TreeSet<>(changedFields));
    }

    /**
     * 변경이 없는 전이인지 확인.
     *
     * @return changedFields가 비어 있으면 true
     */
    public boolean isNoOp() {
        return changedFields.isEmpty();
    }
}
