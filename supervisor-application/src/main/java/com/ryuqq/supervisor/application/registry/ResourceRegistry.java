package com.ryuqq.supervisor.application.registry;

import com.ryuqq.supervisor.application.runtime.UpdateScheduler;
import com.ryuqq.supervisor.core.resource.SupervisedResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 키별 SupervisedResource 레지스트리.
 *
 * <p>애플리케이션의 composition root가 소유하는 명시적 객체입니다. 전역 캐시를 두지 않고,
 * 필요한 곳에 이 레지스트리를 주입합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>키마다 리소스를 한 번만 생성 (getOrCreate)</li>
 *   <li>스케줄러가 주어지면 생성한 리소스를 등록, 제거 시 등록 해제</li>
 *   <li>close 시 등록했던 리소스를 모두 해제 (스케줄러 자체는 닫지 않음)</li>
 * </ul>
 *
 * @param <K> 키 타입 (예: 제품 식별자)
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class ResourceRegistry<K> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResourceRegistry.class);

    private final UpdateScheduler scheduler;
    private final Map<K, SupervisedResource<?>> resources = new LinkedHashMap<>();
    private final Object lock = new Object();

    /**
     * 스케줄러 없이 생성.
     */
    public ResourceRegistry() {
        this.scheduler = null;
    }

    /**
     * 생성자.
     *
     * @param scheduler 생성한 리소스를 등록할 스케줄러
     * @throws IllegalArgumentException scheduler가 null인 경우
     */
    public ResourceRegistry(UpdateScheduler scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
    }

    /**
     * 키에 해당하는 리소스를 반환하고, 없으면 생성합니다.
     *
     * @param key 키
     * @param factory 리소스 생성 함수 (키당 최대 한 번 호출)
     * @return 등록된 리소스
     * @throws IllegalArgumentException key 또는 factory가 null이거나 factory가 null을 반환한 경우
     */
    public SupervisedResource<?> getOrCreate(K key, Supplier<? extends SupervisedResource<?>> factory) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }

        synchronized (lock) {
            SupervisedResource<?> existing = resources.get(key);
            if (existing != null) {
                return existing;
            }
            SupervisedResource<?> created = factory.get();
            if (created == null) {
                throw new IllegalArgumentException("factory returned null for key " + key);
            }
            resources.put(key, created);
            if (scheduler != null) {
                scheduler.register(created);
            }
            log.debug("Registered resource {} for key {}", created, key);
            return created;
        }
    }

    public Optional<SupervisedResource<?>> find(K key) {
        synchronized (lock) {
            return Optional.ofNullable(resources.get(key));
        }
    }

    /**
     * 리소스를 제거하고 스케줄러에서 등록 해제합니다.
     *
     * @param key 키
     * @return 제거된 리소스
     */
    public Optional<SupervisedResource<?>> remove(K key) {
        SupervisedResource<?> removed;
        synchronized (lock) {
            removed = resources.remove(key);
        }
        if (removed != null && scheduler != null) {
            scheduler.unregister(removed);
        }
        return Optional.ofNullable(removed);
    }

    public Set<K> keys() {
        synchronized (lock) {
            return Set.copyOf(resources.keySet());
        }
    }

    public int size() {
        synchronized (lock) {
            return resources.size();
        }
    }

    /**
     * 모든 리소스를 제거하고 등록 해제합니다. 여러 번 호출해도 안전합니다.
     */
    @Override
    public void close() {
        List<SupervisedResource<?>> removed;
        synchronized (lock) {
            removed = List.copyOf(resources.values());
            resources.clear();
        }
        if (scheduler != null) {
            removed.forEach(scheduler::unregister);
        }
    }
}
