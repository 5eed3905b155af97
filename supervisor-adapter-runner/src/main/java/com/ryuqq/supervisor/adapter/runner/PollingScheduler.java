package com.ryuqq.supervisor.adapter.runner;

import com.ryuqq.supervisor.application.runtime.UpdateScheduler;
import com.ryuqq.supervisor.core.resource.SupervisedResource;
import com.ryuqq.supervisor.core.spi.HandleFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polling Scheduler 구현체.
 *
 * <p>등록된 SupervisedResource들을 제한된 수의 워커 루프로 라운드 로빈 순회하며 갱신합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>리소스 등록/해제와 라운드 로빈 커서 관리</li>
 *   <li>워커 수를 min(poolLimit, 등록 수)로 유지 (등록 시 증가, 해제 시 감소)</li>
 *   <li>ResourceScanner를 통한 핸들 열거 비용 공유</li>
 *   <li>리소스별 마지막 예외 기록</li>
 * </ul>
 *
 * <p><strong>워커 루프:</strong></p>
 * <pre>
 * while (!cancelled):
 *   1. 레지스트리 락 안에서 다음 리소스 선택 (비어 있으면 이번 tick 건너뜀)
 *   2. scanner.handlesFor(classKey) → 후보 핸들
 *   3. resource.update(handles) ← 스케줄러 락 밖에서 호출
 *   4. 예외나 Error 발생 시 lastErrors에 기록하고 계속 진행 (VirtualMachineError만 워커를 끝냄)
 *   5. resourceIntervalMs 동안 대기 (취소 신호로 즉시 깨어남)
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>레지스트리 락: 리소스 목록, 커서, 워커 목록 보호</li>
 *   <li>에러 락: lastErrors 맵만 보호</li>
 *   <li>초과 워커는 레지스트리 락 안에서 취소하고 락 밖에서 종료를 기다립니다</li>
 *   <li>워커 스레드 자신에서 close/unregister를 호출해도 자기 자신은 기다리지 않습니다</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class PollingScheduler implements UpdateScheduler {

    private static final Logger log = LoggerFactory.getLogger(PollingScheduler.class);

    private final PollingSchedulerConfig config;
    private final ResourceScanner scanner;
    private final ExecutorService workerExecutor;

    private final Object registryLock = new Object();
    private final List<SupervisedResource<?>> registry = new ArrayList<>();
    private final List<Worker> workers = new ArrayList<>();
    private int cursor;
    private boolean closed;

    private final Object errorLock = new Object();
    private final Map<SupervisedResource<?>, Throwable> lastErrors = new HashMap<>();

    /**
     * 생성자 (기본 ResourceScanner 사용).
     *
     * @param finder 핸들 검색기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PollingScheduler(HandleFinder finder, PollingSchedulerConfig config) {
        this(checkedScanner(finder, config), config);
    }

    /**
     * 생성자 (커스텀 ResourceScanner 주입).
     *
     * @param scanner 핸들 스캐너
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PollingScheduler(ResourceScanner scanner, PollingSchedulerConfig config) {
        if (scanner == null) {
            throw new IllegalArgumentException("scanner cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.scanner = scanner;
        this.config = config;
        this.workerExecutor = Executors.newCachedThreadPool(new WorkerThreadFactory());
        log.info("PollingScheduler started (poolLimit={}, resourceIntervalMs={})",
            config.poolLimit(), config.resourceIntervalMs());
    }

    private static ResourceScanner checkedScanner(HandleFinder finder, PollingSchedulerConfig config) {
        if (finder == null) {
            throw new IllegalArgumentException("finder cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new ResourceScanner(finder, config.handleCacheIntervalMs());
    }

    // ============================================================
    // 1. 등록 / 해제
    // ============================================================

    @Override
    public boolean register(SupervisedResource<?> resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }

        synchronized (registryLock) {
            if (closed) {
                throw new IllegalStateException("scheduler is closed");
            }
            if (indexOf(resource) >= 0) {
                return false;
            }
            registry.add(resource);

            int target = Math.min(config.poolLimit(), registry.size());
            while (workers.size() < target) {
                Worker worker = new Worker();
                workers.add(worker);
                workerExecutor.execute(() -> runWorker(worker));
            }
        }
        log.debug("Registered {}", resource);
        return true;
    }

    @Override
    public boolean unregister(SupervisedResource<?> resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }

        List<Worker> excess = new ArrayList<>();
        synchronized (registryLock) {
            int index = indexOf(resource);
            if (index < 0) {
                return false;
            }
            registry.remove(index);
            if (index < cursor) {
                cursor--;
            }
            if (cursor >= registry.size()) {
                cursor = 0;
            }

            int target = Math.min(config.poolLimit(), registry.size());
            while (workers.size() > target) {
                Worker worker = workers.remove(workers.size() - 1);
                worker.cancel();
                excess.add(worker);
            }
        }

        // 락 밖에서 종료 대기
        awaitAll(excess);

        synchronized (errorLock) {
            lastErrors.remove(resource);
        }
        log.debug("Unregistered {}", resource);
        return true;
    }

    @Override
    public Optional<Throwable> getLastError(SupervisedResource<?> resource) {
        synchronized (errorLock) {
            return Optional.ofNullable(lastErrors.get(resource));
        }
    }

    public int registeredCount() {
        synchronized (registryLock) {
            return registry.size();
        }
    }

    public int workerCount() {
        synchronized (registryLock) {
            return workers.size();
        }
    }

    // ============================================================
    // 2. 종료
    // ============================================================

    /**
     * 레지스트리를 비우고 모든 워커를 취소한 뒤 종료를 기다립니다.
     *
     * <p>여러 번 호출해도 안전합니다. 워커 스레드에서 호출되면 그 워커 자신은 기다리지 않습니다.</p>
     */
    @Override
    public void close() {
        List<Worker> cancelled;
        synchronized (registryLock) {
            if (closed) {
                return;
            }
            closed = true;
            registry.clear();
            cursor = 0;
            cancelled = new ArrayList<>(workers);
            workers.clear();
            cancelled.forEach(Worker::cancel);
        }

        awaitAll(cancelled);
        workerExecutor.shutdown();
        scanner.clear();
        synchronized (errorLock) {
            lastErrors.clear();
        }
        log.info("PollingScheduler closed ({} workers stopped)", cancelled.size());
    }

    // ============================================================
    // 3. 워커 루프
    // ============================================================

    private void runWorker(Worker worker) {
        worker.thread = Thread.currentThread();
        try {
            while (!worker.isCancelled()) {
                SupervisedResource<?> resource = next();
                if (resource != null) {
                    updateOnce(resource);
                }
                if (worker.sleep(config.resourceIntervalMs())) {
                    break;
                }
            }
        } finally {
            if (!worker.isCancelled()) {
                // 비정상 종료: 다음 register에서 워커를 다시 채울 수 있도록 목록에서 제거
                synchronized (registryLock) {
                    workers.remove(worker);
                }
                log.error("Polling worker {} stopped abnormally", Thread.currentThread().getName());
            }
            worker.exited.countDown();
        }
    }

    private SupervisedResource<?> next() {
        synchronized (registryLock) {
            if (registry.isEmpty()) {
                return null;
            }
            if (cursor >= registry.size()) {
                cursor = 0;
            }
            SupervisedResource<?> resource = registry.get(cursor);
            cursor = (cursor + 1) % registry.size();
            return resource;
        }
    }

    private void updateOnce(SupervisedResource<?> resource) {
        try {
            resource.update(scanner.handlesFor(resource.identity().classKey()));
        } catch (VirtualMachineError e) {
            recordError(resource, e);
            throw e;
        } catch (Throwable e) {
            recordError(resource, e);
        }
    }

    private void recordError(SupervisedResource<?> resource, Throwable e) {
        Throwable previous;
        synchronized (registryLock) {
            // 해제된 리소스의 예외는 기록하지 않음
            if (indexOf(resource) < 0) {
                return;
            }
            synchronized (errorLock) {
                previous = lastErrors.put(resource, e);
            }
        }
        if (previous == null) {
            log.warn("Update failed on {}", resource, e);
        } else {
            log.debug("Update failed again on {}", resource, e);
        }
    }

    private int indexOf(SupervisedResource<?> resource) {
        for (int i = 0; i < registry.size(); i++) {
            if (registry.get(i) == resource) {
                return i;
            }
        }
        return -1;
    }

    private static void awaitAll(List<Worker> stopping) {
        Thread current = Thread.currentThread();
        for (Worker worker : stopping) {
            if (worker.thread == current) {
                continue;
            }
            worker.awaitExit();
        }
    }

    /**
     * 워커 하나의 취소 신호와 종료 신호.
     */
    private static final class Worker {

        private final CountDownLatch cancelled = new CountDownLatch(1);
        private final CountDownLatch exited = new CountDownLatch(1);
        private volatile Thread thread;

        void cancel() {
            cancelled.countDown();
        }

        boolean isCancelled() {
            return cancelled.getCount() == 0;
        }

        /**
         * 취소되거나 시간이 지날 때까지 대기.
         *
         * @return 취소되었으면 true
         */
        boolean sleep(long millis) {
            try {
                return cancelled.await(millis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return true;
            }
        }

        void awaitExit() {
            try {
                exited.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Waiting for worker exit interrupted", e);
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "supervisor-poller-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
