package com.ryuqq.supervisor.core.spi;

import com.ryuqq.supervisor.core.result.Result;

import java.nio.file.Path;

/**
 * 실행 파일을 기동하고 생성된 핸들을 돌려주는 SPI.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HandleLauncher {

    /**
     * 실행 파일 기동.
     *
     * @param executable 실행 파일 절대 경로
     * @param timeoutMs 기동 확인 대기 시간 (밀리초, 음수면 무제한)
     * @return 성공 시 핸들, 실패 시 메시지를 가진 Result
     */
    Result<ExternalHandle> launch(Path executable, long timeoutMs);
}
