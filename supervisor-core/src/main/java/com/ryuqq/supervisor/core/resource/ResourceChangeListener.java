package com.ryuqq.supervisor.core.resource;

/**
 * 리소스 변경 알림 수신자.
 *
 * <p>알림은 보통 리소스 락 밖에서 전달됩니다. 파일 저장 시작 알림(SAVING 전이)만은
 * 저장 중인 스레드에서 락을 잡은 채 동기 전달되며, 이때 다른 스레드에서 호출된
 * 게이트 작업은 락을 기다리지 않고 "busy saving"으로 즉시 반환됩니다.</p>
 *
 * @param <P> 파라미터 ID 타입
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourceChangeListener<P> {

    void onChange(ResourceChangeEvent<P> event);
}
