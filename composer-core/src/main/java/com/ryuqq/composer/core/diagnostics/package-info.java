/**
 * Process-wide diagnostic logging facade.
 *
 * <p>{@link com.ryuqq.composer.core.diagnostics.Diagnostics} holds one swappable
 * {@link com.ryuqq.composer.core.diagnostics.DiagnosticSink}. The default forwards to SLF4J;
 * a console sink and a null sink are provided for direct stderr output and suppression.</p>
 *
 * <h2>Scoped Override</h2>
 * <pre>
 * Outcome outcome = Diagnostics.silence(() -&gt; unit.call(inputs));
 * </pre>
 *
 * @since 1.0.0
 * @author Composer Team
 */
package com.ryuqq.composer.core.diagnostics;
