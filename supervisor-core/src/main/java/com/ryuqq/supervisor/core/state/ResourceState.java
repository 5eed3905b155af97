package com.ryuqq.supervisor.core.state;

/**
 * 감독 대상 리소스의 상태.
 *
 * <p>상태는 probe 훅이 분류하거나 작업의 직접적인 부수효과로만 바뀝니다.
 * 추측으로 전이하지 않습니다.</p>
 *
 * <p><strong>사용 가능성 순서:</strong></p>
 * <pre>
 * NONE      실행 중 아님
 * FAIL      probe가 분류 실패 (진단 메시지 보유)
 * STARTUP   존재하지만 아직 준비 안 됨
 * CLEANUP   종료 처리 중
 * IDLE      준비 완료, 작업 없음
 * ACTIVE    주 동작 수행 중
 * BLOCKING  일시적으로 모든 작업 거부 (예: 모달 대화상자)
 * SAVING    파일 저장 중 (BLOCKING보다 우선)
 * </pre>
 *
 * <p>파생 predicate({@link #isAlive()}, {@link #canOperate()})는 항상 상태 값에서
 * 계산되며 따로 캐시하지 않습니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public enum ResourceState {

    /**
     * 실행 중 아님.
     */
    NONE("not running"),

    /**
     * 상태 분류 실패.
     */
    FAIL("invalid state"),

    /**
     * 기동 중.
     */
    STARTUP("still starting"),

    /**
     * 종료 처리 중.
     */
    CLEANUP("shutting down"),

    /**
     * 대기 (작업 가능).
     */
    IDLE(null),

    /**
     * 주 동작 수행 중.
     */
    ACTIVE("cannot process while active"),

    /**
     * 리소스가 작업을 막고 있음.
     */
    BLOCKING("blocked by the resource"),

    /**
     * 파일 저장 중.
     */
    SAVING("busy saving");

    private final String defaultErrorMessage;

    ResourceState(String defaultErrorMessage) {
        this.defaultErrorMessage = defaultErrorMessage;
    }

    /**
     * 리소스가 살아있는지 확인.
     *
     * @return NONE, FAIL, STARTUP, CLEANUP이 아니면 true
     */
    public boolean isAlive() {
        return this != NONE && this != FAIL && this != STARTUP && this != CLEANUP;
    }

    /**
     * 텍스트/파라미터 작업이 가능한 상태인지 확인.
     *
     * @return IDLE 또는 ACTIVE인 경우 true
     */
    public boolean canOperate() {
        return this == IDLE || this == ACTIVE;
    }

    /**
     * 이 상태에서 작업이 거부될 때 쓰는 기본 메시지.
     *
     * @return 상태별 메시지 (IDLE은 null)
     */
    public String defaultErrorMessage() {
        return defaultErrorMessage;
    }
}
