package com.ryuqq.supervisor.core.resource;

import com.ryuqq.supervisor.core.result.Result;
import com.ryuqq.supervisor.core.spi.ExternalHandle;
import com.ryuqq.supervisor.core.spi.HandleFinder;
import com.ryuqq.supervisor.core.spi.HandleLauncher;
import com.ryuqq.supervisor.core.state.ResourceProperty;
import com.ryuqq.supervisor.core.state.ResourceState;
import com.ryuqq.supervisor.core.support.Waiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 외부 리소스 하나를 감싸는 상태 머신 겸 작업 게이트웨이.
 *
 * <p>외부에서 제멋대로 바뀌는 리소스를 안전하게 조작할 수 있는 객체로 만듭니다.
 * 모든 작업(update 포함)은 리소스당 하나의 배타 락으로 직렬화되고,
 * 예상 가능한 실패는 {@link Result}로 보고합니다.</p>
 *
 * <p><strong>상태 게이트:</strong></p>
 * <pre>
 * text/parameter/character, speak, stop, saveFile   canOperate() 필요
 * getProcessFilePath                                  NONE, FAIL 이외
 * runProcess                                          NONE만 (FAIL은 오류, 그 외는 "already running")
 * exitProcess                                         FAIL, BLOCKING, SAVING이면 오류
 * </pre>
 *
 * <p><strong>변경 알림과 교착 회피:</strong></p>
 * <ul>
 *   <li>상태 갱신으로 생긴 알림은 락 밖에서 발행</li>
 *   <li>예외: saveFile의 SAVING 전이 알림은 락을 잡은 채 동기 발행하며,
 *       그동안 updatingDuringSave 플래그가 설정됨</li>
 *   <li>플래그가 설정된 동안 게이트 작업과 exitProcess는 락 없이 상태 오류를 반환하고,
 *       update는 즉시 반환하며, getProcessFilePath/runProcess는 일회용 락 객체를 사용</li>
 * </ul>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>호출자가 부른 작업에서 훅이 던진 예외는 실패 Result로 변환</li>
 *   <li>{@link #update()}에서 발생한 예외는 호출자(스케줄러)에게 전파</li>
 *   <li>필수 인자 null은 IllegalArgumentException</li>
 * </ul>
 *
 * @param <P> 파라미터 ID 타입
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class SupervisedResource<P> {

    private static final Logger log = LoggerFactory.getLogger(SupervisedResource.class);

    private final ResourceIdentity identity;
    private final ResourceOperations<P> operations;
    private final HandleFinder finder;
    private final HandleLauncher launcher;
    private final ResourceOptions options;

    private final Object lock = new Object();
    private final List<ResourceChangeListener<P>> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean updatingDuringSave = false;
    private volatile ResourceStatus status = ResourceStatus.NONE;

    /**
     * 생성자 (기본 옵션 사용).
     *
     * @param identity 식별 정보
     * @param operations 제품별 훅
     * @param finder 핸들 검색기
     * @param launcher 실행 파일 기동기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SupervisedResource(
        ResourceIdentity identity,
        ResourceOperations<P> operations,
        HandleFinder finder,
        HandleLauncher launcher
    ) {
        this(identity, operations, finder, launcher, new ResourceOptions());
    }

    /**
     * 생성자.
     *
     * @param identity 식별 정보
     * @param operations 제품별 훅
     * @param finder 핸들 검색기
     * @param launcher 실행 파일 기동기
     * @param options 동작 옵션
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SupervisedResource(
        ResourceIdentity identity,
        ResourceOperations<P> operations,
        HandleFinder finder,
        HandleLauncher launcher,
        ResourceOptions options
    ) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        if (finder == null) {
            throw new IllegalArgumentException("finder cannot be null");
        }
        if (launcher == null) {
            throw new IllegalArgumentException("launcher cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        this.identity = identity;
        this.operations = operations;
        this.finder = finder;
        this.launcher = launcher;
        this.options = options;
    }

    // ============================================================
    // 관찰
    // ============================================================

    public ResourceIdentity identity() {
        return identity;
    }

    public ResourceOptions options() {
        return options;
    }

    public List<ParameterInfo<P>> parameterInfos() {
        return operations.parameterInfos();
    }

    public ResourceState getState() {
        return status.state();
    }

    /**
     * 상태, 상태 메시지, 핸들을 한 시점의 값으로 함께 반환합니다.
     *
     * <p>getState()와 getStateMessage()를 따로 읽으면 그 사이에 상태가 바뀔 수 있습니다.</p>
     */
    public ResourceStatus getStatus() {
        return status;
    }

    /**
     * 상태 진단 메시지. FAIL 상태에서만 non-null입니다.
     */
    public String getStateMessage() {
        return status.message();
    }

    public boolean isAlive() {
        return status.state().isAlive();
    }

    public boolean canOperate() {
        return status.state().canOperate();
    }

    /**
     * 현재 외부 핸들. 상태가 NONE이면 null입니다.
     */
    public ExternalHandle getHandle() {
        return status.handle();
    }

    /**
     * 메인 윈도우 핸들. 살아있지 않으면 0.
     */
    public long getMainWindowHandle() {
        ResourceStatus current = status;
        ExternalHandle target = current.handle();
        if (target == null || !current.state().isAlive() || !target.isAlive()) {
            return 0L;
        }
        return target.mainWindowHandle();
    }

    public void addChangeListener(ResourceChangeListener<P> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    public boolean removeChangeListener(ResourceChangeListener<P> listener) {
        return listeners.remove(listener);
    }

    // ============================================================
    // 상태 갱신
    // ============================================================

    /**
     * 핸들 검색기로 핸들을 찾아 상태를 갱신합니다.
     *
     * <p>파일 저장 알림 처리 중에는 즉시 반환합니다 (저장 중인 호출자가 전이를 소유).</p>
     *
     * @throws RuntimeException 검색기 또는 probe 훅이 던진 예외
     */
    public void update() {
        updateWith(null);
    }

    /**
     * 주어진 후보 핸들 중에서 이 리소스의 핸들을 골라 상태를 갱신합니다.
     *
     * <p>스케줄러가 여러 리소스에 걸쳐 핸들 열거 비용을 나누기 위해 사용합니다.</p>
     *
     * @param candidates 후보 핸들 목록
     * @throws IllegalArgumentException candidates가 null인 경우
     * @throws RuntimeException probe 훅이 던진 예외
     */
    public void update(List<? extends ExternalHandle> candidates) {
        if (candidates == null) {
            throw new IllegalArgumentException("candidates cannot be null");
        }
        updateWith(candidates);
    }

    private void updateWith(List<? extends ExternalHandle> candidates) {
        if (updatingDuringSave) {
            return;
        }

        Runnable notification;
        synchronized (lock) {
            notification = updateImpl(candidates);
        }
        publish(notification);
    }

    // ============================================================
    // 게이트 작업 (canOperate 필요)
    // ============================================================

    public Result<String> getText() {
        return gated(null, "getText", operations::getText);
    }

    /**
     * 텍스트 설정. null은 빈 문자열로, 길이 제한을 넘으면 서로게이트 쌍을 깨지 않게 자릅니다.
     */
    public Result<Boolean> setText(String text) {
        String value = truncate(text == null ? "" : text, options.textLengthLimit());
        return gated(false, "setText", target -> operations.setText(target, value));
    }

    public Result<Map<P, BigDecimal>> getParameters() {
        return gated(null, "getParameters", operations::getParameters);
    }

    /**
     * 지정한 ID의 파라미터만 조회.
     *
     * @param ids 조회할 파라미터 ID
     * @return 요청한 ID 중 조회된 것만 담은 맵
     * @throws IllegalArgumentException ids가 null인 경우
     */
    public Result<Map<P, BigDecimal>> getParameters(Collection<P> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        return getParameters().map(all -> {
            Map<P, BigDecimal> selected = new LinkedHashMap<>();
            for (P id : ids) {
                if (all.containsKey(id)) {
                    selected.put(id, all.get(id));
                }
            }
            return selected;
        });
    }

    /**
     * 파라미터 설정.
     *
     * <p>알 수 없는 ID는 조용히 무시되어 결과 맵에 포함되지 않습니다. null 또는 범위 밖의 값은
     * 훅을 거치지 않고 실패 결과가 되며, 나머지 값은 자릿수에 맞게 반올림되어 훅에 전달됩니다.</p>
     *
     * @param values 파라미터 ID와 값 (null이면 빈 결과)
     * @return 파라미터별 설정 결과
     */
    public Result<Map<P, Result<Boolean>>> setParameters(Map<P, BigDecimal> values) {
        return gated(null, "setParameters", target -> {
            Map<P, Result<Boolean>> results = new LinkedHashMap<>();
            if (values == null) {
                return Result.of(results);
            }

            Map<P, ParameterInfo<P>> infos = new LinkedHashMap<>();
            for (ParameterInfo<P> info : operations.parameterInfos()) {
                infos.put(info.id(), info);
            }

            Map<P, BigDecimal> accepted = new LinkedHashMap<>();
            for (Map.Entry<P, BigDecimal> entry : values.entrySet()) {
                ParameterInfo<P> info = infos.get(entry.getKey());
                if (info == null) {
                    continue;
                }
                Result<BigDecimal> normalized = info.normalize(entry.getValue());
                if (normalized.value() == null) {
                    results.put(entry.getKey(), Result.of(false, normalized.message()));
                } else {
                    accepted.put(entry.getKey(), normalized.value());
                }
            }

            if (accepted.isEmpty()) {
                return Result.of(results);
            }

            Result<Map<P, Result<Boolean>>> applied = orFailure(operations.setParameters(target, accepted), null);
            if (applied.value() != null) {
                results.putAll(applied.value());
            } else {
                for (P id : accepted.keySet()) {
                    results.put(id, Result.of(false, applied.message()));
                }
            }
            return Result.of(results, applied.message());
        });
    }

    public Result<List<String>> getAvailableCharacters() {
        if (!options.hasCharacters()) {
            return Result.fail(ResourceOperations.NOT_SUPPORTED);
        }
        return gated(null, "getAvailableCharacters", operations::getAvailableCharacters);
    }

    public Result<String> getCharacter() {
        if (!options.hasCharacters()) {
            return Result.fail(ResourceOperations.NOT_SUPPORTED);
        }
        return gated(null, "getCharacter", operations::getCharacter);
    }

    public Result<Boolean> setCharacter(String character) {
        if (!options.hasCharacters()) {
            return Result.of(false, ResourceOperations.NOT_SUPPORTED);
        }
        String value = character == null ? "" : character;
        return gated(false, "setCharacter", target -> operations.setCharacter(target, value));
    }

    /**
     * 주 동작 시작.
     *
     * <p>ACTIVE 상태면 먼저 정지시키고, 정지에 실패하면 시작하지 않습니다.
     * 시작이 확인된 뒤 상태를 다시 probe합니다.</p>
     */
    public Result<Boolean> speak() {
        if (updatingDuringSave) {
            return stateError(false);
        }

        Result<Boolean> result;
        Runnable notification;
        synchronized (lock) {
            if (!status.state().canOperate()) {
                return stateError(false);
            }

            try {
                ExternalHandle target = status.handle();
                if (status.state() == ResourceState.ACTIVE) {
                    Result<Boolean> stopped = orFailure(operations.stop(target), false);
                    if (!Boolean.TRUE.equals(stopped.value())) {
                        return Result.of(false, stopped.message());
                    }
                }
                result = orFailure(operations.speak(target), false);
                notification = updateByCurrentHandle();
            } catch (RuntimeException e) {
                return fault(false, "speak", e);
            }
        }
        publish(notification);
        return result;
    }

    /**
     * 주 동작 정지. 이미 IDLE이면 훅을 부르지 않고 "already stopped"로 성공합니다.
     */
    public Result<Boolean> stop() {
        if (updatingDuringSave) {
            return stateError(false);
        }

        Result<Boolean> result;
        Runnable notification;
        synchronized (lock) {
            if (!status.state().canOperate()) {
                return stateError(false);
            }
            if (status.state() == ResourceState.IDLE) {
                return Result.of(true, "already stopped");
            }

            try {
                result = orFailure(operations.stop(status.handle()), false);
                notification = updateByCurrentHandle();
            } catch (RuntimeException e) {
                return fault(false, "stop", e);
            }
        }
        publish(notification);
        return result;
    }

    /**
     * 파일 저장.
     *
     * <p><strong>처리 순서:</strong></p>
     * <ol>
     *   <li>절대 경로 해석 (실패 시 경로 검증 메시지)</li>
     *   <li>ACTIVE면 정지</li>
     *   <li>공백 텍스트 금지 시 현재 텍스트 확인</li>
     *   <li>SAVING으로 전이하고 락을 잡은 채 알림 발행</li>
     *   <li>저장 디렉토리 생성 및 쓰기 권한 확인</li>
     *   <li>저장 훅 호출</li>
     *   <li>상태 재확인 (SAVING 전이 이후에는 실패 경로에서도 수행)</li>
     * </ol>
     *
     * @param filePath 저장할 파일 경로 (상대 경로는 작업 디렉토리 기준)
     * @return 실제 저장된 경로
     * @throws IllegalArgumentException filePath가 null인 경우
     */
    public Result<String> saveFile(String filePath) {
        if (filePath == null) {
            throw new IllegalArgumentException("filePath cannot be null");
        }
        if (updatingDuringSave) {
            return stateError(null);
        }

        Result<String> result;
        Runnable notification = null;
        synchronized (lock) {
            if (!status.state().canOperate()) {
                return stateError(null);
            }

            Path fullPath = resolve(filePath);
            if (fullPath == null || fullPath.getParent() == null) {
                return Result.fail("invalid save file path");
            }

            try {
                result = saveFileLocked(fullPath);
            } catch (RuntimeException e) {
                result = fault(null, "saveFile", e);
            } finally {
                if (status.state() == ResourceState.SAVING) {
                    notification = reprobeAfterSave();
                }
            }
        }
        publish(notification);
        return result;
    }

    private Result<String> saveFileLocked(Path fullPath) {
        ExternalHandle target = status.handle();

        if (status.state() == ResourceState.ACTIVE) {
            Result<Boolean> stopped = orFailure(operations.stop(target), false);
            if (!Boolean.TRUE.equals(stopped.value())) {
                return Result.fail(stopped.message());
            }
        }

        if (!options.canSaveBlankText()) {
            Result<String> text = orFailure(operations.getText(target), null);
            if (text.value() == null) {
                return Result.fail(text.message());
            }
            if (text.value().isBlank()) {
                return Result.fail("cannot save blank text");
            }
        }

        Runnable savingNotification = updateProperties(ResourceState.SAVING, null, target);
        updatingDuringSave = true;
        try {
            publish(savingNotification);
        } finally {
            updatingDuringSave = false;
        }

        Result<Boolean> directory = createSaveDirectory(fullPath.getParent());
        if (!Boolean.TRUE.equals(directory.value())) {
            return Result.fail(directory.message());
        }

        return orFailure(operations.saveFile(target, fullPath), null);
    }

    // ============================================================
    // 프로세스 수명 주기
    // ============================================================

    /**
     * 실행 파일 경로 조회.
     *
     * @return 실행 파일 경로, 조회할 수 없으면 실패 Result
     */
    public Result<Path> getProcessFilePath() {
        boolean duringSave = updatingDuringSave;
        Object monitor = duringSave ? new Object() : lock;

        synchronized (monitor) {
            ResourceState current = status.state();
            if (!duringSave && (current == ResourceState.NONE || current == ResourceState.FAIL)) {
                return stateError(null);
            }

            ExternalHandle target = status.handle();
            if (target != null) {
                try {
                    Optional<Path> path = target.executablePath();
                    if (path.isPresent()) {
                        return Result.of(path.get());
                    }
                } catch (RuntimeException e) {
                    log.debug("Failed to read executable path of {}", identity.displayName(), e);
                }
            }
        }
        return Result.fail("could not retrieve executable path");
    }

    /**
     * 실행 파일을 기동하고 이 리소스의 핸들임을 확인합니다.
     *
     * <p>이미 실행 중이면 아무것도 하지 않고 "already running"으로 성공합니다.</p>
     *
     * @param executablePath 실행 파일 경로
     * @return 기동 확인 결과
     * @throws IllegalArgumentException executablePath가 null인 경우
     */
    public Result<Boolean> runProcess(String executablePath) {
        if (executablePath == null) {
            throw new IllegalArgumentException("executablePath cannot be null");
        }

        boolean duringSave = updatingDuringSave;
        Object monitor = duringSave ? new Object() : lock;

        Result<Boolean> result;
        Runnable notification = null;
        synchronized (monitor) {
            ResourceState current = status.state();
            if (duringSave || (current != ResourceState.NONE && current != ResourceState.FAIL)) {
                return Result.of(true, "already running");
            }
            if (current == ResourceState.FAIL) {
                return stateError(false);
            }

            if (executablePath.isBlank()) {
                return Result.of(false, "invalid executable path");
            }
            Path executable = resolve(executablePath);
            if (executable == null) {
                return Result.of(false, "invalid executable path");
            }
            if (!Files.isRegularFile(executable)) {
                return Result.of(false, "executable not found");
            }

            try {
                long timeoutMs = options.standardTimeoutMs();
                Result<ExternalHandle> launched = orFailure(launcher.launch(executable, timeoutMs), null);
                ExternalHandle started = launched.value();
                if (started == null) {
                    return Result.of(false, launched.message() != null ? launched.message() : "failed to launch process");
                }

                if (!identity.matches(started)) {
                    if (!started.requestExit()) {
                        started.terminate();
                    }
                    return Result.of(false, "launched process is not the supervised target");
                }
                log.info("Launched {} ({})", identity.displayName(), executable);

                Waiter.waitUntil(() -> locate(null) != null, timeoutMs);
                notification = updateImpl(null);

                result = switch (status.state()) {
                    case NONE -> Result.of(false, "could not confirm startup");
                    case CLEANUP -> Result.of(false, "another instance may already be running");
                    case FAIL -> stateError(false);
                    default -> Result.of(true);
                };
            } catch (RuntimeException e) {
                return fault(false, "runProcess", e);
            }
        }
        publish(notification);
        return result;
    }

    /**
     * 외부 리소스 종료.
     *
     * <p>반환 값은 3가지입니다:</p>
     * <ul>
     *   <li>true: 종료 확인 (NONE이었으면 "already exited")</li>
     *   <li>null: 종료를 요청했으나 리소스가 보류함 (대기 후 BLOCKING/SAVING 관찰)</li>
     *   <li>false: 실패</li>
     * </ul>
     *
     * <p>종료 후 STARTUP 또는 IDLE이 관찰되면 "종료 직후 재기동됨"으로 보고 성공 처리합니다.
     * 이는 검증된 보장이 아닌 근사치입니다.</p>
     */
    public Result<Boolean> exitProcess() {
        if (updatingDuringSave) {
            return stateError(false);
        }

        Result<Boolean> result;
        Runnable notification;
        synchronized (lock) {
            switch (status.state()) {
                case NONE:
                    return Result.of(true, "already exited");
                case STARTUP:
                case CLEANUP:
                case IDLE:
                case ACTIVE:
                    break;
                default:
                    return stateError(false);
            }

            try {
                ExternalHandle target = status.handle();
                if (target != null && target.isAlive()) {
                    operations.onExiting(target);

                    if (status.state() != ResourceState.CLEANUP && !target.requestExit()) {
                        return Result.of(false, "failed to request exit");
                    }

                    Boolean done = Waiter.waitUntil(
                        () -> checkExited(target),
                        exited -> exited == null || exited,
                        options.standardTimeoutMs()
                    );
                    if (Boolean.FALSE.equals(done)) {
                        return Result.of(false, "timed out waiting for exit");
                    }
                }

                notification = updateImpl(null);

                result = switch (status.state()) {
                    case FAIL -> stateError(false);
                    case BLOCKING, SAVING -> Result.of(null, "exit deferred by the resource");
                    default -> Result.of(true);
                };
            } catch (RuntimeException e) {
                return fault(false, "exitProcess", e);
            }
        }
        publish(notification);
        if (Boolean.TRUE.equals(result.value())) {
            log.info("Exited {}", identity.displayName());
        }
        return result;
    }

    @Override
    public String toString() {
        return "SupervisedResource[" + identity.displayName() + ", " + status.state() + "]";
    }

    // ============================================================
    // 내부 구현
    // ============================================================

    private <T> Result<T> gated(T failureValue, String operation, Function<ExternalHandle, Result<T>> action) {
        if (updatingDuringSave) {
            return stateError(failureValue);
        }

        synchronized (lock) {
            if (!status.state().canOperate()) {
                return stateError(failureValue);
            }
            try {
                return orFailure(action.apply(status.handle()), failureValue);
            } catch (RuntimeException e) {
                return fault(failureValue, operation, e);
            }
        }
    }

    /**
     * 현재 상태로 작업할 수 없음을 나타내는 메시지. 상태 메시지가 있으면 그것을 우선합니다.
     */
    private String stateErrorMessage() {
        ResourceStatus current = status;
        if (current.state() == ResourceState.IDLE) {
            return null;
        }
        String message = current.message();
        return message != null ? message : current.state().defaultErrorMessage();
    }

    private <T> Result<T> stateError(T value) {
        return Result.of(value, stateErrorMessage());
    }

    private <T> Result<T> fault(T value, String operation, RuntimeException e) {
        log.warn("{} failed on {}", operation, identity.displayName(), e);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName() + " occurred";
        return Result.of(value, message);
    }

    private static <T> Result<T> orFailure(Result<T> result, T failureValue) {
        return result != null ? result : Result.of(failureValue, "operation returned no result");
    }

    private ExternalHandle locate(List<? extends ExternalHandle> candidates) {
        List<? extends ExternalHandle> handles = candidates != null ? candidates : finder.find(identity.classKey());
        if (handles == null) {
            return null;
        }
        for (ExternalHandle candidate : handles) {
            if (identity.matches(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private Runnable updateImpl(List<? extends ExternalHandle> candidates) {
        return updateByHandle(locate(candidates));
    }

    private Runnable updateByCurrentHandle() {
        ExternalHandle current = status.handle();
        if (current != null) {
            current.refresh();
        }
        return updateByHandle(current != null && current.isAlive() ? current : null);
    }

    private Runnable updateByHandle(ExternalHandle target) {
        if (target == null) {
            return updateProperties(ResourceState.NONE, null, null);
        }
        Result<ResourceState> probed = operations.probe(target);
        if (probed == null || probed.value() == null) {
            String message = probed != null ? probed.message() : null;
            return updateProperties(ResourceState.FAIL, message, target);
        }
        return updateProperties(probed.value(), probed.message(), target);
    }

    private Runnable reprobeAfterSave() {
        try {
            return updateByCurrentHandle();
        } catch (RuntimeException e) {
            log.warn("Probe after save failed on {}", identity.displayName(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName() + " occurred";
            return updateProperties(ResourceState.FAIL, message, status.handle());
        }
    }

    /**
     * 값을 바꾸고 변경 알림을 발행할 Runnable을 반환합니다. 변경이 없으면 null.
     *
     * <p>락을 잡은 상태에서만 호출합니다.</p>
     */
    private Runnable updateProperties(ResourceState newState, String message, ExternalHandle target) {
        ResourceStatus old = status;
        ResourceState stateOld = old.state();
        boolean aliveOld = stateOld.isAlive();
        boolean canOperateOld = stateOld.canOperate();
        String messageOld = old.message();
        ExternalHandle handleOld = old.handle();
        long windowOld = getMainWindowHandle();

        status = new ResourceStatus(newState, message, target);
        String newMessage = status.message();

        EnumSet<ResourceProperty> changed = EnumSet.noneOf(ResourceProperty.class);
        if (newState != stateOld) {
            changed.add(ResourceProperty.STATE);
        }
        if (newState.isAlive() != aliveOld) {
            changed.add(ResourceProperty.ALIVE);
        }
        if (newState.canOperate() != canOperateOld) {
            changed.add(ResourceProperty.CAN_OPERATE);
        }
        if (!Objects.equals(newMessage, messageOld)) {
            changed.add(ResourceProperty.STATE_MESSAGE);
        }
        if (!sameHandle(status.handle(), handleOld)) {
            changed.add(ResourceProperty.HANDLE);
        }
        if (getMainWindowHandle() != windowOld) {
            changed.add(ResourceProperty.MAIN_WINDOW_HANDLE);
        }

        if (changed.isEmpty()) {
            return null;
        }
        if (newState != stateOld) {
            log.debug("{} state changed: {} → {}", identity.displayName(), stateOld, newState);
        }

        ResourceChangeEvent<P> event = new ResourceChangeEvent<>(this, changed, stateOld, newState);
        return () -> fireChange(event);
    }

    private static boolean sameHandle(ExternalHandle a, ExternalHandle b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        return Objects.equals(a.id(), b.id());
    }

    private void publish(Runnable notification) {
        if (notification != null) {
            notification.run();
        }
    }

    private void fireChange(ResourceChangeEvent<P> event) {
        for (ResourceChangeListener<P> listener : listeners) {
            try {
                listener.onChange(event);
            } catch (RuntimeException e) {
                log.warn("Change listener failed on {}", identity.displayName(), e);
            }
        }
    }

    private Boolean checkExited(ExternalHandle target) {
        if (target.waitForExit(0)) {
            return true;
        }
        Result<ResourceState> probed = operations.probe(target);
        ResourceState current = probed != null ? probed.value() : null;
        if (current == ResourceState.NONE) {
            return true;
        }
        if (current == ResourceState.BLOCKING || current == ResourceState.SAVING) {
            return null;
        }
        return false;
    }

    private static Path resolve(String path) {
        if (path.isBlank()) {
            return null;
        }
        try {
            return Paths.get(path).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            log.debug("Invalid path: {}", path, e);
            return null;
        }
    }

    private static String truncate(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        int end = limit;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    /**
     * 저장 디렉토리를 만들고, 사용되지 않은 가장 작은 숫자 이름의 임시 파일로 쓰기 권한을 확인합니다.
     * 임시 파일은 항상 삭제합니다.
     */
    static Result<Boolean> createSaveDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to create save directory {}", directory, e);
            return Result.of(false, "could not create save directory");
        }

        Path scratch = null;
        for (long i = 0; scratch == null || Files.exists(scratch); i++) {
            scratch = directory.resolve(Long.toString(i));
        }

        try {
            Files.write(scratch, new byte[] {0});
        } catch (IOException | RuntimeException e) {
            log.debug("Save directory {} is not writable", directory, e);
            return Result.of(false, "no write permission for save directory");
        } finally {
            try {
                Files.deleteIfExists(scratch);
            } catch (IOException e) {
                log.debug("Failed to delete scratch file {}", scratch, e);
            }
        }
        return Result.of(true);
    }
}
