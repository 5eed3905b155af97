package com.ryuqq.supervisor.core.resource;

import com.ryuqq.supervisor.core.state.ResourceProperty;
import com.ryuqq.supervisor.core.state.ResourceState;

import java.util.Set;

/**
 * 리소스 속성 변경 알림.
 *
 * @param source 변경된 리소스
 * @param changedProperties 변경된 속성 (비어있지 않음)
 * @param previousState 이전 상태
 * @param currentState 현재 상태
 * @param <P> 파라미터 ID 타입
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public record ResourceChangeEvent<P>(
    SupervisedResource<P> source,
    Set<ResourceProperty> changedProperties,
    ResourceState previousState,
    ResourceState currentState
) {

    public ResourceChangeEvent {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        changedProperties = Set.copyOf(changedProperties);
    }

    /**
     * 특정 속성이 변경되었는지 확인.
     *
     * @param property 확인할 속성
     * @return 변경되었으면 true
     */
    public boolean isChanged(ResourceProperty property) {
        return changedProperties.contains(property);
    }
}
