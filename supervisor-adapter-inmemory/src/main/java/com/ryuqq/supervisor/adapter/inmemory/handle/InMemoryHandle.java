package com.ryuqq.supervisor.adapter.inmemory.handle;

import com.ryuqq.supervisor.core.spi.ExternalHandle;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link ExternalHandle} simulating an external process.
 *
 * <p>All attributes are mutable so tests can script what the supervisor observes:
 * liveness, product name, main window handle and how the simulated process reacts to an
 * exit request.</p>
 *
 * <p><strong>Exit Policies:</strong></p>
 * <ul>
 *   <li>{@link ExitPolicy#ACCEPT}: exit request is delivered and the process dies at once</li>
 *   <li>{@link ExitPolicy#REFUSE}: exit request cannot be delivered ({@link #requestExit()} returns false)</li>
 *   <li>{@link ExitPolicy#IGNORE}: exit request is delivered but the process keeps running</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No real process behind it</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public class InMemoryHandle implements ExternalHandle {

    private static final AtomicLong SEQUENCE = new AtomicLong(1000);

    /**
     * Reaction of the simulated process to an exit request.
     */
    public enum ExitPolicy {
        ACCEPT,
        REFUSE,
        IGNORE
    }

    private final String id;
    private final String classKey;
    private final CountDownLatch exited = new CountDownLatch(1);
    private final AtomicInteger exitRequests = new AtomicInteger();

    private volatile String productName;
    private volatile Path executablePath;
    private volatile long mainWindowHandle;
    private volatile ExitPolicy exitPolicy = ExitPolicy.ACCEPT;
    private volatile boolean alive = true;

    /**
     * Creates a live handle with a generated id.
     *
     * @param classKey handle class key
     * @param productName product name (nullable)
     * @param executablePath executable path (nullable)
     * @throws IllegalArgumentException if classKey is null
     */
    public InMemoryHandle(String classKey, String productName, Path executablePath) {
        if (classKey == null) {
            throw new IllegalArgumentException("classKey cannot be null");
        }
        long number = SEQUENCE.incrementAndGet();
        this.id = Long.toString(number);
        this.classKey = classKey;
        this.productName = productName;
        this.executablePath = executablePath;
        this.mainWindowHandle = number;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String classKey() {
        return classKey;
    }

    @Override
    public Optional<String> productName() {
        return Optional.ofNullable(productName);
    }

    @Override
    public Optional<Path> executablePath() {
        return Optional.ofNullable(executablePath);
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public long mainWindowHandle() {
        return mainWindowHandle;
    }

    @Override
    public boolean requestExit() {
        exitRequests.incrementAndGet();
        switch (exitPolicy) {
            case ACCEPT:
                kill();
                return true;
            case IGNORE:
                return true;
            default:
                return false;
        }
    }

    @Override
    public void terminate() {
        kill();
    }

    @Override
    public boolean waitForExit(long timeoutMs) {
        if (!alive) {
            return true;
        }
        try {
            if (timeoutMs < 0) {
                exited.await();
                return true;
            }
            return exited.await(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Waiting for exit interrupted", e);
        }
    }

    /**
     * Simulates the process dying on its own.
     */
    public void kill() {
        alive = false;
        exited.countDown();
    }

    public void setProductName(String productName) {
        this.productName = productName;
    }

    public void setExecutablePath(Path executablePath) {
        this.executablePath = executablePath;
    }

    public void setMainWindowHandle(long mainWindowHandle) {
        this.mainWindowHandle = mainWindowHandle;
    }

    public void setExitPolicy(ExitPolicy exitPolicy) {
        if (exitPolicy == null) {
            throw new IllegalArgumentException("exitPolicy cannot be null");
        }
        this.exitPolicy = exitPolicy;
    }

    /**
     * Number of exit requests received so far.
     */
    public int exitRequestCount() {
        return exitRequests.get();
    }

    @Override
    public String toString() {
        return "InMemoryHandle[" + classKey + "#" + id + (alive ? "" : ", exited") + "]";
    }
}
