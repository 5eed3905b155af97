/**
 * Small helpers shared by the core.
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.core.support;
