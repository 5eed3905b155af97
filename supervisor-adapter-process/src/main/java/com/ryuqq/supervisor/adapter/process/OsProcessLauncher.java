package com.ryuqq.supervisor.adapter.process;

import com.ryuqq.supervisor.core.result.Result;
import com.ryuqq.supervisor.core.spi.ExternalHandle;
import com.ryuqq.supervisor.core.spi.HandleLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * {@link ProcessBuilder}로 실행 파일을 기동하는 {@link HandleLauncher}.
 *
 * <p><strong>기동 확인:</strong></p>
 * <ul>
 *   <li>프로세스 시작 후 startGraceMs 동안 대기 (표준 타임아웃이 더 짧으면 그 값)</li>
 *   <li>그 사이 종료되면 종료 코드를 담은 실패 Result</li>
 *   <li>살아있으면 {@link OsProcessHandle} 반환</li>
 * </ul>
 *
 * <p>표준 입출력은 버립니다. 소유 확인(제품 이름 비교)은 호출자가 수행합니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class OsProcessLauncher implements HandleLauncher {

    private static final Logger log = LoggerFactory.getLogger(OsProcessLauncher.class);

    /**
     * 기동 유예 시간 기본값 (밀리초).
     */
    public static final long DEFAULT_START_GRACE_MS = 200;

    private final long startGraceMs;
    private final Function<ProcessHandle, Optional<String>> productNameResolver;

    /**
     * 기본 설정 생성자 (유예 200ms, 제품 이름 알 수 없음).
     */
    public OsProcessLauncher() {
        this(DEFAULT_START_GRACE_MS, process -> Optional.empty());
    }

    /**
     * 생성자.
     *
     * @param startGraceMs 기동 유예 시간 (밀리초, 0 이상)
     * @param productNameResolver 제품 이름 resolver
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public OsProcessLauncher(long startGraceMs, Function<ProcessHandle, Optional<String>> productNameResolver) {
        if (startGraceMs < 0) {
            throw new IllegalArgumentException(
                "startGraceMs must not be negative (current: " + startGraceMs + ")"
            );
        }
        if (productNameResolver == null) {
            throw new IllegalArgumentException("productNameResolver cannot be null");
        }
        this.startGraceMs = startGraceMs;
        this.productNameResolver = productNameResolver;
    }

    @Override
    public Result<ExternalHandle> launch(Path executable, long timeoutMs) {
        if (executable == null) {
            throw new IllegalArgumentException("executable cannot be null");
        }

        Process process;
        try {
            process = new ProcessBuilder(executable.toString())
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        } catch (IOException | SecurityException e) {
            log.warn("Failed to launch {}", executable, e);
            return Result.fail("failed to launch process: " + e.getMessage());
        }

        long graceMs = timeoutMs < 0 ? startGraceMs : Math.min(startGraceMs, timeoutMs);
        try {
            if (process.waitFor(graceMs, TimeUnit.MILLISECONDS)) {
                return Result.fail("process exited during startup (exit code " + process.exitValue() + ")");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            return Result.fail("launch interrupted");
        }

        log.info("Launched {} (pid {})", executable, process.pid());
        return Result.of(new OsProcessHandle(process.toHandle(), productNameResolver));
    }
}
