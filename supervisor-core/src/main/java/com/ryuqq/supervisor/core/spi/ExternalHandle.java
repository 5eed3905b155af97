package com.ryuqq.supervisor.core.spi;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 감독 대상 외부 리소스(예: OS 프로세스)에 대한 살아있는 참조.
 *
 * <p>구현체는 호스트 환경의 프로세스/리소스 API를 감쌉니다. 조회 메서드는 빠르게 반환해야 하며
 * 예외를 던지지 않는 것이 원칙입니다. 이미 종료된 핸들에 대해서도 호출될 수 있습니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public interface ExternalHandle {

    /**
     * 핸들 식별자. 같은 외부 리소스를 가리키는 두 핸들은 같은 id를 반환합니다.
     *
     * @return 식별자 (예: PID 문자열)
     */
    String id();

    /**
     * 핸들 클래스 키 (예: 확장자를 제외한 실행 파일 이름).
     *
     * @return 클래스 키
     */
    String classKey();

    /**
     * 제품 이름 (알 수 없으면 empty).
     *
     * @return 제품 이름
     */
    Optional<String> productName();

    /**
     * 실행 파일 경로 (알 수 없으면 empty).
     *
     * @return 실행 파일 절대 경로
     */
    Optional<Path> executablePath();

    /**
     * 외부 리소스가 아직 살아있는지 확인.
     *
     * @return 살아있으면 true
     */
    boolean isAlive();

    /**
     * 메인 윈도우 핸들. 윈도우가 없으면 0.
     *
     * @return 윈도우 핸들 값
     */
    long mainWindowHandle();

    /**
     * 캐시된 정보를 갱신합니다. 기본 구현은 아무것도 하지 않습니다.
     */
    default void refresh() {
    }

    /**
     * 정상 종료를 요청합니다.
     *
     * @return 요청이 전달되었으면 true
     */
    boolean requestExit();

    /**
     * 강제 종료합니다.
     */
    void terminate();

    /**
     * 종료될 때까지 대기합니다.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초, 음수면 무제한)
     * @return 대기 중 종료되었으면 true
     */
    boolean waitForExit(long timeoutMs);
}
