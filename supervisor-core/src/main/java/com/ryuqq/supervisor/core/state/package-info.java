/**
 * Resource state model.
 *
 * <p>{@link com.ryuqq.supervisor.core.state.ResourceState} is a closed enum with derived
 * predicates. {@link com.ryuqq.supervisor.core.state.ResourceProperty} names the observable
 * properties reported by change notifications.</p>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.core.state;
