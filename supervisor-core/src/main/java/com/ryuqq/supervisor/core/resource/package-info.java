/**
 * Supervised resource gateway.
 *
 * <p>{@link com.ryuqq.supervisor.core.resource.SupervisedResource} is the single concrete
 * state machine and operation gateway. Product-specific behavior is supplied through
 * {@link com.ryuqq.supervisor.core.resource.ResourceOperations}, one implementation per product.</p>
 *
 * <h2>Threading</h2>
 * <ul>
 *   <li>One exclusive lock per resource serializes every operation, including updates</li>
 *   <li>Change notifications are raised outside that lock, except the SAVING transition</li>
 *   <li>Hooks must not call back into public methods of the same resource</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.core.resource;
