/**
 * In-memory handle adapter implementation package.
 *
 * <p>This package provides reference implementations of the handle SPIs for testing and
 * for running the supervisor without real external processes.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.supervisor.adapter.inmemory.handle.InMemoryHandle}:
 *       Scriptable {@link com.ryuqq.supervisor.core.spi.ExternalHandle}</li>
 *   <li>{@link com.ryuqq.supervisor.adapter.inmemory.handle.InMemoryHandleRegistry}:
 *       Simulated process table implementing both finder and launcher</li>
 * </ul>
 *
 * @see com.ryuqq.supervisor.core.spi.HandleFinder
 * @see com.ryuqq.supervisor.core.spi.HandleLauncher
 * @author Supervisor Team
 * @since 1.0.0
 */
package com.ryuqq.supervisor.adapter.inmemory.handle;
