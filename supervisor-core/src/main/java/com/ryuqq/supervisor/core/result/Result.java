package com.ryuqq.supervisor.core.result;

import java.util.function.Function;

/**
 * 값과 진단 메시지의 쌍.
 *
 * <p>예상 가능한 실패(상태 게이트, 검증 실패, 훅 실패)는 예외 대신 이 record로 보고합니다.
 * 프로그래밍 오류(필수 인자 null)만 즉시 예외를 던집니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>message는 주목할 일이 있었을 때만 non-null (실패, "already running" 같은 비치명적 성공 포함)</li>
 *   <li>실패 시 value는 타입의 기본값 (참조 타입은 null, Boolean 결과는 false)</li>
 * </ul>
 *
 * @param value 결과 값 (null 가능)
 * @param message 진단 메시지 (null 가능)
 * @param <T> 값 타입
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public record Result<T>(
    T value,
    String message
) {

    /**
     * 메시지 없는 결과 생성.
     *
     * @param value 결과 값
     * @param <T> 값 타입
     * @return Result 인스턴스
     */
    public static <T> Result<T> of(T value) {
        return new Result<>(value, null);
    }

    /**
     * 값과 메시지를 함께 가진 결과 생성.
     *
     * @param value 결과 값
     * @param message 진단 메시지
     * @param <T> 값 타입
     * @return Result 인스턴스
     */
    public static <T> Result<T> of(T value, String message) {
        return new Result<>(value, message);
    }

    /**
     * 값 없이 메시지만 가진 실패 결과 생성.
     *
     * @param message 실패 메시지
     * @param <T> 값 타입
     * @return value가 null인 Result
     */
    public static <T> Result<T> fail(String message) {
        return new Result<>(null, message);
    }

    /**
     * 메시지 존재 여부.
     *
     * @return message가 null이 아니면 true
     */
    public boolean hasMessage() {
        return message != null;
    }

    /**
     * 값을 변환한 새 결과. 메시지는 유지됩니다.
     *
     * @param mapper 변환 함수 (value가 null이면 호출되지 않음)
     * @param <R> 변환된 값 타입
     * @return 변환된 Result
     */
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        R mapped = value == null ? null : mapper.apply(value);
        return new Result<>(mapped, message);
    }
}
