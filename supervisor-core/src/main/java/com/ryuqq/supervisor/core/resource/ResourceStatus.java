package com.ryuqq.supervisor.core.resource;

import com.ryuqq.supervisor.core.spi.ExternalHandle;
import com.ryuqq.supervisor.core.state.ResourceState;

/**
 * SupervisedResource의 관찰 가능한 상태 스냅샷 (불변 record).
 *
 * <p>세 값은 항상 하나의 인스턴스로 함께 교체되므로, 한 번 읽은 스냅샷 안에서는 아래 불변식이
 * 성립합니다:</p>
 * <ul>
 *   <li>message는 state가 FAIL일 때만 non-null (메시지 없는 FAIL은 "invalid state")</li>
 *   <li>handle은 state가 NONE이면 null</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 * @param state 상태
 * @param message 상태 진단 메시지
 * @param handle 현재 외부 핸들
 */
public record ResourceStatus(ResourceState state, String message, ExternalHandle handle) {

    /**
     * 실행 중이 아닌 초기 상태.
     */
    public static final ResourceStatus NONE = new ResourceStatus(ResourceState.NONE, null, null);

    /**
     * Compact constructor (불변식 정규화).
     *
     * @throws IllegalArgumentException state가 null인 경우
     */
    public ResourceStatus {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (state == ResourceState.FAIL) {
            message = message != null ? message : ResourceState.FAIL.defaultErrorMessage();
        } else {
            message = null;
        }
        if (state == ResourceState.NONE) {
            handle = null;
        }
    }
}
