package com.ryuqq.supervisor.core.spi;

import java.util.List;

/**
 * 클래스 키로 현재 존재하는 외부 핸들을 찾는 SPI.
 *
 * <p>열거는 비용이 큰 작업일 수 있습니다. 여러 리소스가 동시에 폴링하는 경우
 * 스케줄러 쪽 스캐너가 결과를 짧게 캐시합니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HandleFinder {

    /**
     * 클래스 키에 해당하는 현재 핸들 목록 조회.
     *
     * @param classKey 핸들 클래스 키
     * @return 핸들 목록 (없으면 빈 리스트, null 아님)
     */
    List<ExternalHandle> find(String classKey);
}
