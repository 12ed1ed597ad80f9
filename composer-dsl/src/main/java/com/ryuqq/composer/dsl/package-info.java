/**
 * Declarative unit definitions.
 *
 * <p>{@link com.ryuqq.composer.dsl.UnitCatalog} turns a lambda body into a
 * {@link com.ryuqq.composer.core.unit.Unit} whose contract is derived from
 * {@link com.ryuqq.composer.dsl.UnitOptions} and, optionally, from the components of an input record.</p>
 *
 * <h2>Definition order</h2>
 * <ol>
 *   <li>{@code unit(options)} marks the next definition</li>
 *   <li>{@code precondition(name, gate)} (optional) attaches a named precondition to the mark</li>
 *   <li>{@code define(...)} consumes the mark and registers the unit under its name</li>
 * </ol>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composer.dsl.DefinitionOrderException} - precondition or define without a mark</li>
 *   <li>{@link com.ryuqq.composer.dsl.DualParameterDefinitionException} - params declared twice</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Composer Team
 */
package com.ryuqq.composer.dsl;
