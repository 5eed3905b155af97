/**
 * Contract test infrastructure for supervised resources.
 *
 * <p>{@link com.ryuqq.supervisor.testkit.contract.AbstractSupervisedResourceTest} wires a
 * {@link com.ryuqq.supervisor.testkit.contract.ScriptedOperations} resource against the
 * in-memory process table.</p>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.testkit.contract;
