package com.ryuqq.supervisor.adapter.process;

import com.ryuqq.supervisor.core.spi.ExternalHandle;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * {@link ProcessHandle} 기반 {@link ExternalHandle} 구현체.
 *
 * <p><strong>매핑:</strong></p>
 * <ul>
 *   <li>id: PID</li>
 *   <li>classKey: 실행 파일 이름에서 마지막 확장자를 뺀 것</li>
 *   <li>productName: 주입된 resolver가 결정 (JDK는 제품 정보를 제공하지 않음)</li>
 *   <li>mainWindowHandle: 항상 0 (윈도우 식별은 범위 밖)</li>
 *   <li>requestExit: {@link ProcessHandle#destroy()}, terminate: {@link ProcessHandle#destroyForcibly()}</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class OsProcessHandle implements ExternalHandle {

    private final ProcessHandle process;
    private final Function<ProcessHandle, Optional<String>> productNameResolver;

    /**
     * 생성자.
     *
     * @param process OS 프로세스 핸들
     * @param productNameResolver 제품 이름 resolver
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public OsProcessHandle(ProcessHandle process, Function<ProcessHandle, Optional<String>> productNameResolver) {
        if (process == null) {
            throw new IllegalArgumentException("process cannot be null");
        }
        if (productNameResolver == null) {
            throw new IllegalArgumentException("productNameResolver cannot be null");
        }
        this.process = process;
        this.productNameResolver = productNameResolver;
    }

    /**
     * 실행 파일 경로에서 클래스 키를 계산합니다.
     *
     * @param executable 실행 파일 경로
     * @return 파일 이름에서 마지막 확장자를 뺀 문자열
     */
    public static String classKeyOf(Path executable) {
        Path fileName = executable.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    @Override
    public String id() {
        return Long.toString(process.pid());
    }

    @Override
    public String classKey() {
        return executablePath().map(OsProcessHandle::classKeyOf).orElse("");
    }

    @Override
    public Optional<String> productName() {
        return productNameResolver.apply(process);
    }

    @Override
    public Optional<Path> executablePath() {
        Optional<String> command = process.info().command();
        if (command.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Paths.get(command.get()));
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public long mainWindowHandle() {
        return 0L;
    }

    @Override
    public boolean requestExit() {
        return process.destroy();
    }

    @Override
    public void terminate() {
        process.destroyForcibly();
    }

    @Override
    public boolean waitForExit(long timeoutMs) {
        if (!process.isAlive()) {
            return true;
        }
        if (process.equals(ProcessHandle.current())) {
            // onExit is not allowed for the current process, which cannot exit while we wait
            if (timeoutMs < 0) {
                throw new IllegalStateException("cannot wait for the current process to exit");
            }
            return false;
        }
        CompletableFuture<ProcessHandle> exit = process.onExit();
        try {
            if (timeoutMs < 0) {
                exit.get();
            } else {
                exit.get(timeoutMs, TimeUnit.MILLISECONDS);
            }
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Waiting for exit interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to wait for process " + process.pid(), e.getCause());
        }
    }

    public long pid() {
        return process.pid();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OsProcessHandle)) {
            return false;
        }
        return process.equals(((OsProcessHandle) o).process);
    }

    @Override
    public int hashCode() {
        return process.hashCode();
    }

    @Override
    public String toString() {
        return "OsProcessHandle[pid=" + process.pid() + "]";
    }
}
