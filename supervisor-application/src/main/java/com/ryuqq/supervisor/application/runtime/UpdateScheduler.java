package com.ryuqq.supervisor.application.runtime;

import com.ryuqq.supervisor.core.resource.SupervisedResource;

import java.util.Optional;

/**
 * Polling runtime that keeps registered resources fresh.
 *
 * <p>This interface defines what a background runtime offers to the composition root:
 * registering resources for periodic {@link SupervisedResource#update(java.util.List)} calls and
 * inspecting the faults those calls raised.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * worker loop (one per pool slot):
 *   while (not cancelled):
 *     1. Pick the next registered resource round-robin (skip tick if none)
 *     2. Look up current handles for its class key (shared, briefly cached)
 *     3. resource.update(handles) outside any scheduler lock
 *     4. On exception or error: record as last error for that resource, keep looping
 *     5. Sleep the per-resource interval
 * </pre>
 *
 * <p><strong>Error Handling Strategy:</strong></p>
 * <ul>
 *   <li>A fault in one resource's update, {@link Error}s included, never stops a worker or other
 *       resources; only a {@link VirtualMachineError} ends the worker that hit it</li>
 *   <li>The most recent fault per resource is kept until the resource is unregistered</li>
 * </ul>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <ul>
 *   <li>{@link #close()} cancels and awaits every worker and is idempotent</li>
 *   <li>Registering after close throws {@link IllegalStateException}</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public interface UpdateScheduler extends AutoCloseable {

    /**
     * Registers a resource for periodic updates.
     *
     * @param resource resource to register
     * @return false if it was already registered
     * @throws IllegalArgumentException if resource is null
     * @throws IllegalStateException if the scheduler is closed
     */
    boolean register(SupervisedResource<?> resource);

    /**
     * Stops updating a resource.
     *
     * @param resource resource to unregister
     * @return false if it was not registered
     * @throws IllegalArgumentException if resource is null
     */
    boolean unregister(SupervisedResource<?> resource);

    /**
     * Most recent exception or error thrown out of the resource's update, if any.
     *
     * @param resource registered resource
     * @return last error, or empty
     */
    Optional<Throwable> getLastError(SupervisedResource<?> resource);

    /**
     * Clears the registry, cancels and awaits all workers. Idempotent.
     */
    @Override
    void close();
}
