/**
 * Contract-validated single units of work.
 *
 * <p>A {@link com.ryuqq.composer.core.unit.Unit} declares its contract once and implements a body
 * that receives an {@link com.ryuqq.composer.core.unit.Execution}. Aborting is an early return of
 * {@link com.ryuqq.composer.core.unit.Completion#HALTED}; it never leaves the invocation as an exception.</p>
 *
 * @since 1.0.0
 * @author Composer Team
 */
package com.ryuqq.composer.core.unit;
