package com.ryuqq.orderevents.core.contract;

import com.ryuqq.orderevents.core.model.JsonValues;

import java.util.List;
import java.util.Map;

/**
 * OrderModified 이벤트의 detail.
 *
 * <p>{@code changed}는 이전/이후 상태에서 값이 다른 최상위 필드 이름만 (이름순으로) 담습니다.
 * 변경되지 않은 필드는 포함되지 않습니다.</p>
 *
 * @param changed 변경된 최상위 필드 이름 목록 (이름순)
 * @param oldImage 변경 전 주문 (JSON 형태 필드 맵, 중첩 값까지 읽기 전용)
 * @param newImage 변경 후 주문 (JSON 형태 필드 맵, 중첩 값까지 읽기 전용)
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record ChangeDetail(
    List<String> changed,
    Map<String, Object> oldImage,
    Map<String, Object> newImage
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public ChangeDetail {
        if (changed == null) {
            throw new IllegalArgumentException("changed cannot be null");
        }
        if (oldImage == null) {
            throw new IllegalArgumentException("oldImage cannot be null");
        }
        if (newImage == null) {
            throw new IllegalArgumentException("newImage cannot be null");
        }
        changed = List.copyOf(changed);
        oldImage = JsonValues.immutableCopy(oldImage);
        newImage = JsonValues.immutableCopy(newImage);
    }
}
