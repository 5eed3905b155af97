package com.ryuqq.supervisor.adapter.inmemory.handle;

import com.ryuqq.supervisor.core.result.Result;
import com.ryuqq.supervisor.core.spi.ExternalHandle;
import com.ryuqq.supervisor.core.spi.HandleFinder;
import com.ryuqq.supervisor.core.spi.HandleLauncher;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory implementation of {@link HandleFinder} and {@link HandleLauncher}.
 *
 * <p>Acts as a simulated process table. Programs are installed by executable path; launching
 * an installed path creates a new {@link InMemoryHandle} and adds it to the table. Handles can
 * also be added directly to simulate processes started outside the supervisor.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>programs:</strong> ConcurrentHashMap&lt;Path, Function&gt; - installed executables</li>
 *   <li><strong>handles:</strong> CopyOnWriteArrayList&lt;InMemoryHandle&gt; - the process table</li>
 * </ul>
 *
 * <p>{@link #findCount()} counts enumerations so tests can verify that a scanner amortizes
 * lookups across resources.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public class InMemoryHandleRegistry implements HandleFinder, HandleLauncher {

    private final ConcurrentHashMap<Path, Function<Path, InMemoryHandle>> programs = new ConcurrentHashMap<>();
    private final List<InMemoryHandle> handles = new CopyOnWriteArrayList<>();
    private final AtomicInteger findCount = new AtomicInteger();
    private final AtomicInteger launchCount = new AtomicInteger();

    /**
     * Installs a program that launches handles with the given class key and product name.
     *
     * @param executable executable path (normalized to an absolute path)
     * @param classKey class key of launched handles
     * @param productName product name of launched handles (nullable)
     */
    public void install(Path executable, String classKey, String productName) {
        install(executable, path -> new InMemoryHandle(classKey, productName, path));
    }

    /**
     * Installs a program with a custom handle factory.
     *
     * @param executable executable path (normalized to an absolute path)
     * @param factory creates the handle for each launch
     */
    public void install(Path executable, Function<Path, InMemoryHandle> factory) {
        if (executable == null) {
            throw new IllegalArgumentException("executable cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        programs.put(normalize(executable), factory);
    }

    /**
     * Adds a running handle to the process table.
     *
     * @param handle handle to add
     * @return the same handle
     */
    public InMemoryHandle add(InMemoryHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        handles.add(handle);
        return handle;
    }

    @Override
    public List<ExternalHandle> find(String classKey) {
        findCount.incrementAndGet();
        List<ExternalHandle> found = new ArrayList<>();
        for (InMemoryHandle handle : handles) {
            if (handle.isAlive() && handle.classKey().equals(classKey)) {
                found.add(handle);
            }
        }
        return found;
    }

    @Override
    public Result<ExternalHandle> launch(Path executable, long timeoutMs) {
        if (executable == null) {
            throw new IllegalArgumentException("executable cannot be null");
        }
        Function<Path, InMemoryHandle> factory = programs.get(normalize(executable));
        if (factory == null) {
            return Result.fail("no program installed at " + executable);
        }
        launchCount.incrementAndGet();
        return Result.of(add(factory.apply(normalize(executable))));
    }

    /**
     * Live handles of every class key.
     */
    public List<InMemoryHandle> liveHandles() {
        List<InMemoryHandle> live = new ArrayList<>();
        for (InMemoryHandle handle : handles) {
            if (handle.isAlive()) {
                live.add(handle);
            }
        }
        return live;
    }

    public int findCount() {
        return findCount.get();
    }

    public int launchCount() {
        return launchCount.get();
    }

    /**
     * Kills every handle and empties the table and installed programs.
     */
    public void clear() {
        handles.forEach(InMemoryHandle::kill);
        handles.clear();
        programs.clear();
        findCount.set(0);
        launchCount.set(0);
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
