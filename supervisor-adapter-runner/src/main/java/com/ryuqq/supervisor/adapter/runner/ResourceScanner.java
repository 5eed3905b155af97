package com.ryuqq.supervisor.adapter.runner;

import com.ryuqq.supervisor.core.spi.ExternalHandle;
import com.ryuqq.supervisor.core.spi.HandleFinder;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 클래스 키별 핸들 목록을 잠시 캐시하는 스캐너.
 *
 * <p>여러 워커가 같은 클래스 키의 리소스를 연달아 갱신해도 캐시 유지 시간마다 한 번만
 * 실제 열거가 일어나도록 합니다. 유지 시간이 지나면 키별이 아니라 캐시 전체를 비웁니다.</p>
 *
 * <p><strong>동시성:</strong> 캐시와 타임스탬프는 하나의 락으로 보호됩니다. 캐시는 핸들
 * 스냅샷만 담고 리소스를 참조하지 않습니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class ResourceScanner {

    private final HandleFinder finder;
    private final long cacheIntervalNanos;
    private final LongSupplier nanoClock;

    private final Object lock = new Object();
    private final Map<String, List<ExternalHandle>> cache = new HashMap<>();
    private long bucketStartNanos;
    private boolean bucketStarted;

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param finder 핸들 검색기
     * @param cacheIntervalMs 캐시 유지 시간 (밀리초)
     */
    public ResourceScanner(HandleFinder finder, long cacheIntervalMs) {
        this(finder, cacheIntervalMs, System::nanoTime);
    }

    /**
     * 생성자 (커스텀 시계 주입).
     *
     * @param finder 핸들 검색기
     * @param cacheIntervalMs 캐시 유지 시간 (밀리초, 0 이상)
     * @param nanoClock 단조 증가 나노초 시계
     * @throws IllegalArgumentException 의존성이 null이거나 유지 시간이 음수인 경우
     */
    public ResourceScanner(HandleFinder finder, long cacheIntervalMs, LongSupplier nanoClock) {
        if (finder == null) {
            throw new IllegalArgumentException("finder cannot be null");
        }
        if (cacheIntervalMs < 0) {
            throw new IllegalArgumentException(
                "cacheIntervalMs must not be negative (current: " + cacheIntervalMs + ")"
            );
        }
        if (nanoClock == null) {
            throw new IllegalArgumentException("nanoClock cannot be null");
        }
        this.finder = finder;
        this.cacheIntervalNanos = TimeUnit.MILLISECONDS.toNanos(cacheIntervalMs);
        this.nanoClock = nanoClock;
    }

    /**
     * 클래스 키에 해당하는 현재 핸들 목록.
     *
     * @param classKey 핸들 클래스 키
     * @return 불변 핸들 목록 (캐시 유지 시간 안에서는 같은 목록)
     * @throws IllegalArgumentException classKey가 null인 경우
     */
    public List<ExternalHandle> handlesFor(String classKey) {
        if (classKey == null) {
            throw new IllegalArgumentException("classKey cannot be null");
        }

        synchronized (lock) {
            long now = nanoClock.getAsLong();
            if (!bucketStarted || now - bucketStartNanos >= cacheIntervalNanos) {
                cache.clear();
                bucketStartNanos = now;
                bucketStarted = true;
            }

            List<ExternalHandle> handles = cache.get(classKey);
            if (handles == null) {
                List<ExternalHandle> found = finder.find(classKey);
                handles = found == null ? List.of() : List.copyOf(found);
                cache.put(classKey, handles);
            }
            return handles;
        }
    }

    /**
     * 캐시를 비웁니다. 다음 조회는 항상 새로 열거합니다.
     */
    public void clear() {
        synchronized (lock) {
            cache.clear();
            bucketStarted = false;
        }
    }
}
