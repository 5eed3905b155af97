package com.ryuqq.supervisor.core.resource;

import com.ryuqq.supervisor.core.result.Result;
import com.ryuqq.supervisor.core.spi.ExternalHandle;
import com.ryuqq.supervisor.core.state.ResourceState;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 제품별 협력자가 구현하는 probe 및 동작 훅.
 *
 * <p>{@link SupervisedResource}가 상태 게이트를 통과한 경우에만, 리소스 락을 잡은 상태로
 * 호출합니다. 훅은 같은 리소스의 public 메서드를 다시 호출하면 안 됩니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>{@link #probe}: 살아있는 핸들을 정확히 하나의 상태로 분류</li>
 *   <li>동작 훅: 자기 효과가 확인되거나 실패할 때까지 블로킹</li>
 *   <li>{@link #parameterInfos()}: 파라미터 검증용 정적 메타데이터</li>
 * </ul>
 *
 * <p>캐릭터 관련 훅은 선택 기능이며, 기본 구현은 "not supported"를 반환합니다.</p>
 *
 * @param <P> 파라미터 ID 타입
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public interface ResourceOperations<P> {

    /**
     * 기능 미지원 메시지.
     */
    String NOT_SUPPORTED = "not supported";

    /**
     * 핸들의 현재 상태 분류.
     *
     * <p>null이 아니고 살아있는 핸들에 대해서만 호출됩니다. FAIL 이외의 상태에 붙은 메시지는
     * 버려집니다.</p>
     *
     * @param handle 외부 핸들
     * @return 상태와 (FAIL인 경우) 진단 메시지
     */
    Result<ResourceState> probe(ExternalHandle handle);

    /**
     * 주 동작 시작. 시작이 확인될 때까지 블로킹합니다.
     */
    Result<Boolean> speak(ExternalHandle handle);

    /**
     * 주 동작 정지.
     */
    Result<Boolean> stop(ExternalHandle handle);

    /**
     * 파일 저장.
     *
     * @param handle 외부 핸들
     * @param file 절대 경로 (상위 디렉토리는 생성 및 쓰기 확인 완료)
     * @return 실제 저장된 경로
     */
    Result<String> saveFile(ExternalHandle handle, Path file);

    Result<String> getText(ExternalHandle handle);

    /**
     * 텍스트 설정.
     *
     * @param handle 외부 핸들
     * @param text null이 아니고 길이 제한 안으로 잘린 텍스트
     */
    Result<Boolean> setText(ExternalHandle handle, String text);

    Result<Map<P, BigDecimal>> getParameters(ExternalHandle handle);

    /**
     * 파라미터 설정.
     *
     * @param handle 외부 핸들
     * @param values 범위 검증과 반올림을 통과한 값만 포함
     * @return 파라미터별 설정 결과
     */
    Result<Map<P, Result<Boolean>>> setParameters(ExternalHandle handle, Map<P, BigDecimal> values);

    default Result<List<String>> getAvailableCharacters(ExternalHandle handle) {
        return Result.fail(NOT_SUPPORTED);
    }

    default Result<String> getCharacter(ExternalHandle handle) {
        return Result.fail(NOT_SUPPORTED);
    }

    default Result<Boolean> setCharacter(ExternalHandle handle, String character) {
        return Result.of(false, NOT_SUPPORTED);
    }

    /**
     * 파라미터 메타데이터. 기본은 빈 리스트입니다.
     */
    default List<ParameterInfo<P>> parameterInfos() {
        return List.of();
    }

    /**
     * 종료 요청 직전에 호출됩니다. 기본 구현은 아무것도 하지 않습니다.
     */
    default void onExiting(ExternalHandle handle) {
    }
}
