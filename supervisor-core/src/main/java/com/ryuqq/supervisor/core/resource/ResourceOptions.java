package com.ryuqq.supervisor.core.resource;

/**
 * SupervisedResource 동작 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>canSaveBlankText: 공백 텍스트 저장 허용 여부 (기본 false)</li>
 *   <li>hasCharacters: 캐릭터 선택 기능 지원 여부 (기본 false)</li>
 *   <li>textLengthLimit: 텍스트 최대 길이 (기본 Integer.MAX_VALUE)</li>
 *   <li>standardTimeoutMs: 기동/종료 확인 대기 시간 (기본 1500ms, 음수면 무제한)</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 * @param canSaveBlankText 공백 텍스트 저장 허용 여부
 * @param hasCharacters 캐릭터 기능 지원 여부
 * @param textLengthLimit 텍스트 최대 길이 (양수여야 함)
 * @param standardTimeoutMs 표준 대기 시간 (밀리초, 음수면 무제한)
 */
public record ResourceOptions(
    boolean canSaveBlankText,
    boolean hasCharacters,
    int textLengthLimit,
    long standardTimeoutMs
) {

    /**
     * 표준 대기 시간 기본값 (밀리초).
     */
    public static final long DEFAULT_STANDARD_TIMEOUT_MS = 1500;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: canSaveBlankText=false, hasCharacters=false,
     * textLengthLimit=Integer.MAX_VALUE, standardTimeoutMs=1500ms</p>
     */
    public ResourceOptions() {
        this(false, false, Integer.MAX_VALUE, DEFAULT_STANDARD_TIMEOUT_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException textLengthLimit가 양수가 아닌 경우
     */
    public ResourceOptions {
        if (textLengthLimit <= 0) {
            throw new IllegalArgumentException(
                "textLengthLimit must be positive (current: " + textLengthLimit + ")"
            );
        }
    }

    /**
     * canSaveBlankText만 변경한 새 인스턴스 생성.
     */
    public ResourceOptions withCanSaveBlankText(boolean canSaveBlankText) {
        return new ResourceOptions(canSaveBlankText, hasCharacters, textLengthLimit, standardTimeoutMs);
    }

    /**
     * hasCharacters만 변경한 새 인스턴스 생성.
     */
    public ResourceOptions withHasCharacters(boolean hasCharacters) {
        return new ResourceOptions(canSaveBlankText, hasCharacters, textLengthLimit, standardTimeoutMs);
    }

    /**
     * textLengthLimit만 변경한 새 인스턴스 생성.
     */
    public ResourceOptions withTextLengthLimit(int textLengthLimit) {
        return new ResourceOptions(canSaveBlankText, hasCharacters, textLengthLimit, standardTimeoutMs);
    }

    /**
     * standardTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public ResourceOptions withStandardTimeoutMs(long standardTimeoutMs) {
        return new ResourceOptions(canSaveBlankText, hasCharacters, textLengthLimit, standardTimeoutMs);
    }
}
