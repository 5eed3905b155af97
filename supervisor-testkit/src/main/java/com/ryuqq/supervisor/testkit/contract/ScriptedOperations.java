package com.ryuqq.supervisor.testkit.contract;

import com.ryuqq.supervisor.core.resource.ParameterInfo;
import com.ryuqq.supervisor.core.resource.ResourceOperations;
import com.ryuqq.supervisor.core.result.Result;
import com.ryuqq.supervisor.core.spi.ExternalHandle;
import com.ryuqq.supervisor.core.state.ResourceState;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable {@link ResourceOperations} for contract tests.
 *
 * <p>Simulates a resource whose state is set by the test. Every hook records how many hooks
 * were running at the same time, so tests can assert that a resource never runs two hooks
 * concurrently.</p>
 *
 * <p><strong>Behavior:</strong></p>
 * <ul>
 *   <li>probe: returns the scripted state (IDLE by default) or a scripted failure</li>
 *   <li>speak: moves the scripted state to ACTIVE; stop: back to IDLE</li>
 *   <li>saveFile: writes the current text to the file and returns its path</li>
 *   <li>parameters: kept in memory, seeded with each parameter's default value</li>
 * </ul>
 *
 * @param <P> parameter id type
 * @author Supervisor Team
 * @since 1.0.0
 */
public class ScriptedOperations<P> implements ResourceOperations<P> {

    private final List<ParameterInfo<P>> parameterInfos;
    private final Map<P, BigDecimal> parameters = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private volatile ResourceState state = ResourceState.IDLE;
    private volatile String probeFailure;
    private volatile RuntimeException probeException;
    private volatile Error probeError;
    private volatile String text = "hello";
    private volatile long hookDelayMs;

    public ScriptedOperations() {
        this(List.of());
    }

    /**
     * @param parameterInfos parameter metadata exposed by {@link #parameterInfos()}
     */
    public ScriptedOperations(List<ParameterInfo<P>> parameterInfos) {
        if (parameterInfos == null) {
            throw new IllegalArgumentException("parameterInfos cannot be null");
        }
        this.parameterInfos = List.copyOf(parameterInfos);
        for (ParameterInfo<P> info : this.parameterInfos) {
            parameters.put(info.id(), info.defaultValue());
        }
    }

    // ============================================================
    // Scripting
    // ============================================================

    public void setState(ResourceState state) {
        this.state = state;
        this.probeFailure = null;
        this.probeException = null;
        this.probeError = null;
    }

    /**
     * Makes probe return a failure with the given message.
     */
    public void failProbe(String message) {
        this.probeFailure = message;
    }

    /**
     * Makes probe throw the given exception.
     */
    public void throwOnProbe(RuntimeException exception) {
        this.probeException = exception;
    }

    /**
     * Makes probe throw the given error.
     */
    public void throwErrorOnProbe(Error error) {
        this.probeError = error;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    /**
     * Delay applied inside every hook, to widen race windows.
     */
    public void setHookDelayMs(long hookDelayMs) {
        this.hookDelayMs = hookDelayMs;
    }

    public int callCount(String hook) {
        AtomicInteger count = calls.get(hook);
        return count == null ? 0 : count.get();
    }

    /**
     * Largest number of hooks observed running at the same time.
     */
    public int maxConcurrentHooks() {
        return maxInFlight.get();
    }

    public BigDecimal parameter(P id) {
        return parameters.get(id);
    }

    // ============================================================
    // Hooks
    // ============================================================

    @Override
    public Result<ResourceState> probe(ExternalHandle handle) {
        enter("probe");
        try {
            Error error = probeError;
            if (error != null) {
                throw error;
            }
            RuntimeException exception = probeException;
            if (exception != null) {
                throw exception;
            }
            String failure = probeFailure;
            if (failure != null) {
                return Result.fail(failure);
            }
            return Result.of(state);
        } finally {
            exit();
        }
    }

    @Override
    public Result<Boolean> speak(ExternalHandle handle) {
        enter("speak");
        try {
            state = ResourceState.ACTIVE;
            return Result.of(true);
        } finally {
            exit();
        }
    }

    @Override
    public Result<Boolean> stop(ExternalHandle handle) {
        enter("stop");
        try {
            state = ResourceState.IDLE;
            return Result.of(true);
        } finally {
            exit();
        }
    }

    @Override
    public Result<String> saveFile(ExternalHandle handle, Path file) {
        enter("saveFile");
        try {
            Files.writeString(file, text);
            return Result.of(file.toString());
        } catch (IOException e) {
            return Result.fail("could not write " + file + ": " + e.getMessage());
        } finally {
            exit();
        }
    }

    @Override
    public Result<String> getText(ExternalHandle handle) {
        enter("getText");
        try {
            return Result.of(text);
        } finally {
            exit();
        }
    }

    @Override
    public Result<Boolean> setText(ExternalHandle handle, String text) {
        enter("setText");
        try {
            this.text = text;
            return Result.of(true);
        } finally {
            exit();
        }
    }

    @Override
    public Result<Map<P, BigDecimal>> getParameters(ExternalHandle handle) {
        enter("getParameters");
        try {
            return Result.of(new LinkedHashMap<>(parameters));
        } finally {
            exit();
        }
    }

    @Override
    public Result<Map<P, Result<Boolean>>> setParameters(ExternalHandle handle, Map<P, BigDecimal> values) {
        enter("setParameters");
        try {
            Map<P, Result<Boolean>> results = new LinkedHashMap<>();
            values.forEach((id, value) -> {
                parameters.put(id, value);
                results.put(id, Result.of(true));
            });
            return Result.of(results);
        } finally {
            exit();
        }
    }

    @Override
    public List<ParameterInfo<P>> parameterInfos() {
        return parameterInfos;
    }

    private void enter(String hook) {
        calls.computeIfAbsent(hook, key -> new AtomicInteger()).incrementAndGet();
        int running = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(running, Math::max);
        long delay = hookDelayMs;
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                inFlight.decrementAndGet();
                throw new RuntimeException("Hook delay interrupted", e);
            }
        }
    }

    private void exit() {
        inFlight.decrementAndGet();
    }
}
