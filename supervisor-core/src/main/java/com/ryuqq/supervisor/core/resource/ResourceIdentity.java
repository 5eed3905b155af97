package com.ryuqq.supervisor.core.resource;

import com.ryuqq.supervisor.core.spi.ExternalHandle;

/**
 * 감독 대상 리소스의 불변 식별 정보.
 *
 * <p>외부 핸들 중 어떤 것이 이 리소스인지 판별하는 기준입니다.</p>
 *
 * <p><strong>판별 규칙:</strong></p>
 * <ul>
 *   <li>핸들이 살아있어야 함</li>
 *   <li>productName이 지정된 경우 핸들의 제품 이름과 일치해야 함</li>
 * </ul>
 *
 * @param classKey 핸들 클래스 키 (예: 실행 파일 이름, 공백 불가)
 * @param productName 제품 이름 (null이면 제품 이름 비교 생략)
 * @param displayName 표시 이름 (null이면 productName, 그것도 없으면 classKey)
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public record ResourceIdentity(
    String classKey,
    String productName,
    String displayName
) {

    /**
     * Compact constructor (유효성 검증 및 표시 이름 기본값).
     *
     * @throws IllegalArgumentException classKey가 null이거나 공백인 경우
     */
    public ResourceIdentity {
        if (classKey == null || classKey.isBlank()) {
            throw new IllegalArgumentException("classKey cannot be null or blank");
        }
        if (displayName == null) {
            displayName = productName != null ? productName : classKey;
        }
    }

    /**
     * 클래스 키만으로 식별 정보 생성.
     *
     * @param classKey 핸들 클래스 키
     * @return ResourceIdentity 인스턴스
     */
    public static ResourceIdentity of(String classKey) {
        return new ResourceIdentity(classKey, null, null);
    }

    /**
     * 클래스 키와 제품 이름으로 식별 정보 생성.
     *
     * @param classKey 핸들 클래스 키
     * @param productName 제품 이름
     * @return ResourceIdentity 인스턴스
     */
    public static ResourceIdentity of(String classKey, String productName) {
        return new ResourceIdentity(classKey, productName, null);
    }

    /**
     * 핸들이 이 리소스를 가리키는지 확인.
     *
     * @param handle 외부 핸들 (null 가능)
     * @return 살아있고 제품 이름이 일치하면 true
     */
    public boolean matches(ExternalHandle handle) {
        if (handle == null || !handle.isAlive()) {
            return false;
        }
        return productName == null || productName.equals(handle.productName().orElse(null));
    }
}
