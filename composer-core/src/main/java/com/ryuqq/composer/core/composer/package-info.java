/**
 * Composition strategies built on units.
 *
 * <h2>Composers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composer.core.composer.IsolatedComposer} - Same input for every unit,
 *       independent invocations, never short-circuits, returns one outcome per registration</li>
 *   <li>{@link com.ryuqq.composer.core.composer.AccumulatingComposer} - Sequential invocations,
 *       state threaded and merged, short-circuits on the first failure</li>
 * </ul>
 *
 * <h2>Shared Machinery</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composer.core.composer.AroundScope} - Wraps the whole iteration once per call</li>
 *   <li>{@link com.ryuqq.composer.core.composer.FailureHandler} - Invoked per failed unit during lenient calls</li>
 *   <li>{@link com.ryuqq.composer.core.composer.Registration} - Append-only, fixed at build time</li>
 * </ul>
 *
 * <h2>Execution Model</h2>
 * <pre>
 * caller → composer.call(inputs)
 *   ↓ around(continuation)        (exactly once)
 *   ↓ for each registration
 *   ↓   unit.call(bound inputs)   (unit body may compose again)
 *   ↓ outcome collected (isolated) or merged (accumulating)
 * </pre>
 *
 * @since 1.0.0
 * @author Composer Team
 */
package com.ryuqq.composer.core.composer;
