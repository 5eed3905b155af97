/**
 * Value-or-message result type.
 *
 * <p>{@link com.ryuqq.supervisor.core.result.Result} is returned by every public operation of a
 * supervised resource. Expected failures never cross the API as exceptions.</p>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.core.result;
