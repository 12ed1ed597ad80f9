/**
 * Unit contract declaration.
 *
 * <p>A {@link com.ryuqq.composer.core.contract.Contract} fixes the ordered input keys (each
 * required or optional), the ordered result keys and an optional named
 * {@link com.ryuqq.composer.core.contract.Precondition}. It is declared through
 * {@link com.ryuqq.composer.core.contract.ContractBuilder}, possibly across several additive calls,
 * and is read-only once built.</p>
 *
 * @since 1.0.0
 * @author Composer Team
 */
package com.ryuqq.composer.core.contract;
