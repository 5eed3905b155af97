/**
 * Polling runtime port.
 *
 * <p>{@link com.ryuqq.supervisor.application.runtime.UpdateScheduler} is implemented by
 * supervisor-adapter-runner.</p>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.application.runtime;
