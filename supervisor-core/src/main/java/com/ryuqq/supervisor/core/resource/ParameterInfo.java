package com.ryuqq.supervisor.core.resource;

import com.ryuqq.supervisor.core.result.Result;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 파라미터 메타데이터.
 *
 * <p>협력자가 정적 설정으로 제공하며, 파라미터 설정 훅이 호출되기 전에
 * 코어가 값 범위 검증과 자릿수 반올림에 사용합니다.</p>
 *
 * @param id 파라미터 ID
 * @param displayName 표시 이름 (검증 메시지에 사용)
 * @param digits 소수점 이하 자릿수 (0 이상)
 * @param defaultValue 기본값 (min 이상 max 이하)
 * @param minValue 최솟값
 * @param maxValue 최댓값 (min 이상)
 * @param <P> 파라미터 ID 타입
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public record ParameterInfo<P>(
    P id,
    String displayName,
    int digits,
    BigDecimal defaultValue,
    BigDecimal minValue,
    BigDecimal maxValue
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 필드가 null이거나 범위가 맞지 않는 경우
     */
    public ParameterInfo {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (displayName == null) {
            throw new IllegalArgumentException("displayName cannot be null");
        }
        if (digits < 0) {
            throw new IllegalArgumentException(
                "digits must not be negative (current: " + digits + ")"
            );
        }
        if (defaultValue == null || minValue == null || maxValue == null) {
            throw new IllegalArgumentException("defaultValue, minValue and maxValue cannot be null");
        }
        if (minValue.compareTo(maxValue) > 0) {
            throw new IllegalArgumentException(
                "minValue must not exceed maxValue (current: " + minValue + " > " + maxValue + ")"
            );
        }
        if (defaultValue.compareTo(minValue) < 0 || defaultValue.compareTo(maxValue) > 0) {
            throw new IllegalArgumentException(
                "defaultValue must be within [" + minValue + ", " + maxValue + "] (current: " + defaultValue + ")"
            );
        }
    }

    /**
     * 값 검증 및 자릿수 반올림.
     *
     * <p>반올림(HALF_UP) 후의 값이 범위 안에 있어야 합니다.</p>
     *
     * @param value 설정하려는 값 (null 가능)
     * @return 성공 시 반올림된 값, 실패 시 범위와 실제 값을 담은 메시지
     */
    public Result<BigDecimal> normalize(BigDecimal value) {
        if (value == null) {
            return Result.fail(displayName + " value cannot be null");
        }
        BigDecimal rounded = value.setScale(digits, RoundingMode.HALF_UP);
        if (rounded.compareTo(minValue) < 0 || rounded.compareTo(maxValue) > 0) {
            return Result.fail(
                displayName + " must be between " + minValue.toPlainString() + " and "
                    + maxValue.toPlainString() + " (actual: " + value.toPlainString() + ")"
            );
        }
        return Result.of(rounded);
    }
}
