/**
 * Data carried into and out of units.
 *
 * <ul>
 *   <li>{@link com.ryuqq.composer.core.model.Params} - Bound inputs of one invocation</li>
 *   <li>{@link com.ryuqq.composer.core.model.Outcome} - Data-shaped result with the reserved
 *       {@code successful} and {@code messages} keys</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Composer Team
 */
package com.ryuqq.composer.core.model;
