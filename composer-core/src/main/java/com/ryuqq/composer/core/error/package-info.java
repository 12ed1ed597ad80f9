/**
 * Configuration error hierarchy.
 *
 * <p>Everything in this package is a programmer error raised once at declaration, composition or
 * strict invocation time. Recoverable domain failures never appear here; they are carried by
 * {@link com.ryuqq.composer.core.model.Outcome}.</p>
 *
 * <h2>Exceptions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composer.core.error.ComposerException} - Base type</li>
 *   <li>{@link com.ryuqq.composer.core.error.ImplicitConfigurationException} - Unit invoked without a declared contract</li>
 *   <li>{@link com.ryuqq.composer.core.error.ReservedParameterException} - Reserved key passed to an accumulating composer</li>
 *   <li>{@link com.ryuqq.composer.core.error.UnproducedParameterException} - Chain cannot satisfy a required input</li>
 *   <li>{@link com.ryuqq.composer.core.error.UnknownRequirementException} - Bad textual requirement</li>
 *   <li>{@link com.ryuqq.composer.core.error.FailureException} - Domain failure raised by a strict entry point</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Composer Team
 */
package com.ryuqq.composer.core.error;
