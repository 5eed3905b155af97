/**
 * Composition-root registry of supervised resources.
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.application.registry;
