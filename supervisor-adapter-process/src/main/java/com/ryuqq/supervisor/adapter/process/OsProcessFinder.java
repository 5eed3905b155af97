package com.ryuqq.supervisor.adapter.process;

import com.ryuqq.supervisor.core.spi.ExternalHandle;
import com.ryuqq.supervisor.core.spi.HandleFinder;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link ProcessHandle#allProcesses()}로 클래스 키가 일치하는 프로세스를 찾는 {@link HandleFinder}.
 *
 * <p>명령 경로를 읽을 수 없는 프로세스(권한 부족 등)는 건너뜁니다.
 * 전체 프로세스 열거는 비용이 크므로 스케줄러의 스캐너 캐시와 함께 사용합니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class OsProcessFinder implements HandleFinder {

    private final Function<ProcessHandle, Optional<String>> productNameResolver;

    /**
     * 생성자 (제품 이름을 알 수 없음).
     */
    public OsProcessFinder() {
        this(process -> Optional.empty());
    }

    /**
     * 생성자.
     *
     * @param productNameResolver 제품 이름 resolver
     * @throws IllegalArgumentException productNameResolver가 null인 경우
     */
    public OsProcessFinder(Function<ProcessHandle, Optional<String>> productNameResolver) {
        if (productNameResolver == null) {
            throw new IllegalArgumentException("productNameResolver cannot be null");
        }
        this.productNameResolver = productNameResolver;
    }

    @Override
    public List<ExternalHandle> find(String classKey) {
        if (classKey == null) {
            throw new IllegalArgumentException("classKey cannot be null");
        }
        return ProcessHandle.allProcesses()
            .filter(ProcessHandle::isAlive)
            .filter(process -> classKey.equals(classKeyOf(process)))
            .map(process -> (ExternalHandle) new OsProcessHandle(process, productNameResolver))
            .collect(Collectors.toList());
    }

    private static String classKeyOf(ProcessHandle process) {
        Optional<String> command = process.info().command();
        if (command.isEmpty()) {
            return null;
        }
        try {
            return OsProcessHandle.classKeyOf(Paths.get(command.get()));
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
