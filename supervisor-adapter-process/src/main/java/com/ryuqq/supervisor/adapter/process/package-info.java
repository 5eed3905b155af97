/**
 * Operating system process adapter.
 *
 * <p>Implements the handle SPIs over {@link java.lang.ProcessHandle} and
 * {@link java.lang.ProcessBuilder}. Window and control identification are out of scope, so
 * {@link com.ryuqq.supervisor.adapter.process.OsProcessHandle#mainWindowHandle()} is always 0
 * and product names come from an injected resolver.</p>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.adapter.process;
