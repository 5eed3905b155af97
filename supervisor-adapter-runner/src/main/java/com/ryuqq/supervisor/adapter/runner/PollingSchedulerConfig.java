package com.ryuqq.supervisor.adapter.runner;

/**
 * PollingScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>poolLimit: 최대 워커 수 (기본 가용 프로세서 수, 1~1024)</li>
 *   <li>resourceIntervalMs: 리소스 하나를 갱신한 뒤 워커가 쉬는 시간 (기본 10ms)</li>
 *   <li>handleCacheIntervalMs: 핸들 목록 캐시 유지 시간 (기본 100ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>리소스가 많고 갱신 지연이 중요: poolLimit 증가</li>
 *   <li>핸들 열거 비용이 큼: handleCacheIntervalMs 증가</li>
 *   <li>CPU 절약: resourceIntervalMs 증가</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 * @param poolLimit 최대 워커 수 (1 이상 1024 이하)
 * @param resourceIntervalMs 리소스당 대기 시간 (밀리초, 양수여야 함)
 * @param handleCacheIntervalMs 핸들 캐시 유지 시간 (밀리초, 0 이상, 0이면 캐시하지 않음)
 */
public record PollingSchedulerConfig(
    int poolLimit,
    long resourceIntervalMs,
    long handleCacheIntervalMs
) {

    public static final int MAX_POOL_LIMIT = 1024;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: poolLimit=가용 프로세서 수, resourceIntervalMs=10ms, handleCacheIntervalMs=100ms</p>
     */
    public PollingSchedulerConfig() {
        this(defaultPoolLimit(), 10, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PollingSchedulerConfig {
        if (poolLimit <= 0 || poolLimit > MAX_POOL_LIMIT) {
            throw new IllegalArgumentException(
                "poolLimit must be between 1 and " + MAX_POOL_LIMIT + " (current: " + poolLimit + ")"
            );
        }
        if (resourceIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "resourceIntervalMs must be positive (current: " + resourceIntervalMs + ")"
            );
        }
        if (handleCacheIntervalMs < 0) {
            throw new IllegalArgumentException(
                "handleCacheIntervalMs must not be negative (current: " + handleCacheIntervalMs + ")"
            );
        }
    }

    /**
     * poolLimit만 변경한 새 인스턴스 생성.
     */
    public PollingSchedulerConfig withPoolLimit(int poolLimit) {
        return new PollingSchedulerConfig(poolLimit, resourceIntervalMs, handleCacheIntervalMs);
    }

    /**
     * resourceIntervalMs만 변경한 새 인스턴스 생성.
     */
    public PollingSchedulerConfig withResourceIntervalMs(long resourceIntervalMs) {
        return new PollingSchedulerConfig(poolLimit, resourceIntervalMs, handleCacheIntervalMs);
    }

    /**
     * handleCacheIntervalMs만 변경한 새 인스턴스 생성.
     */
    public PollingSchedulerConfig withHandleCacheIntervalMs(long handleCacheIntervalMs) {
        return new PollingSchedulerConfig(poolLimit, resourceIntervalMs, handleCacheIntervalMs);
    }

    private static int defaultPoolLimit() {
        int processors = Runtime.getRuntime().availableProcessors();
        return Math.max(1, Math.min(MAX_POOL_LIMIT, processors));
    }
}
