/**
 * Test fixtures for code built on composer-core.
 *
 * <h2>Fixtures</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composer.testkit.contract.AbstractComposerTest} - JUnit 5 base class with diagnostics capture</li>
 *   <li>{@link com.ryuqq.composer.testkit.contract.CapturingDiagnosticSink} - Records diagnostic lines with severity</li>
 *   <li>{@link com.ryuqq.composer.testkit.contract.RecordingUnit} - Configurable unit that records its invocations</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Composer Team
 */
package com.ryuqq.composer.testkit.contract;
