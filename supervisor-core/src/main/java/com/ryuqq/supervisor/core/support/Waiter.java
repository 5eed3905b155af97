package com.ryuqq.supervisor.core.support;

import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 조건이 만족될 때까지 폴링하는 대기 유틸리티.
 *
 * <p><strong>폴링 흐름:</strong></p>
 * <pre>
 * value = getter()
 * while (!predicate(value) &amp;&amp; (timeout &lt; 0 || 경과 시간 &lt; timeout)):
 *     sleep(pollingIntervalMs)
 *     value = getter()
 * return value
 * </pre>
 *
 * <p>타임아웃 시 마지막으로 관찰한 값을 반환합니다. 타임아웃이 음수면 무제한 대기합니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class Waiter {

    /**
     * 폴링 간격 (밀리초).
     */
    public static final long POLLING_INTERVAL_MS = 5;

    private Waiter() {
    }

    /**
     * getter의 값이 predicate를 만족할 때까지 대기.
     *
     * @param getter 값 조회 함수
     * @param predicate 완료 조건
     * @param timeoutMs 최대 대기 시간 (밀리초, 음수면 무제한)
     * @param <T> 값 타입
     * @return 조건을 만족한 값, 타임아웃 시 마지막 값
     * @throws IllegalArgumentException getter 또는 predicate가 null인 경우
     * @throws RuntimeException 대기 중 인터럽트 발생 시
     */
    public static <T> T waitUntil(Supplier<? extends T> getter, Predicate<? super T> predicate, long timeoutMs) {
        if (getter == null) {
            throw new IllegalArgumentException("getter cannot be null");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }

        long startTimeNanos = System.nanoTime();
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);

        T value = getter.get();
        while (!predicate.test(value)
            && (timeoutMs < 0 || System.nanoTime() - startTimeNanos < timeoutNanos)) {
            sleep(POLLING_INTERVAL_MS);
            value = getter.get();
        }
        return value;
    }

    /**
     * 조건이 true가 될 때까지 대기.
     *
     * @param condition 완료 조건
     * @param timeoutMs 최대 대기 시간 (밀리초, 음수면 무제한)
     * @return 조건이 true가 되었으면 true, 타임아웃이면 false
     */
    public static boolean waitUntil(BooleanSupplier condition, long timeoutMs) {
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
        return waitUntil(condition::getAsBoolean, Boolean::booleanValue, timeoutMs);
    }

    /**
     * Sleep.
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * RuntimeException으로 래핑하여 던집니다.</p>
     *
     * @param millis 대기 시간 (밀리초)
     * @throws RuntimeException sleep 중 인터럽트 발생 시
     */
    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Waiting interrupted", e);
        }
    }
}
