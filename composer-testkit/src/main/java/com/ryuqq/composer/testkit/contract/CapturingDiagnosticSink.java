package com.ryuqq.composer.testkit.contract;

import com.ryuqq.composer.core.diagnostics.DiagnosticSink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of DiagnosticSink for testing purposes.
 *
 * <p>Every diagnostic line is kept in emission order together with its severity,
 * so tests can assert on exactly what a unit or composer reported.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class CapturingDiagnosticSink implements DiagnosticSink {

    /**
     * Severity of a captured line.
     */
    public enum Severity {
        INFO, WARN, ERROR
    }

    /**
     * A captured diagnostic line.
     *
     * @param severity line severity
     * @param message line text without severity prefix
     */
    public record Entry(Severity severity, String message) {
    }

    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void info(String message) {
        entries.add(new Entry(Severity.INFO, message));
    }

    @Override
    public void warn(String message) {
        entries.add(new Entry(Severity.WARN, message));
    }

    @Override
    public void error(String message) {
        entries.add(new Entry(Severity.ERROR, message));
    }

    /**
     * Returns all captured lines in emission order.
     *
     * @return immutable snapshot
     */
    public List<Entry> entries() {
        return List.copyOf(entries);
    }

    public List<String> infos() {
        return messages(Severity.INFO);
    }

    public List<String> warnings() {
        return messages(Severity.WARN);
    }

    public List<String> errors() {
        return messages(Severity.ERROR);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Clears all captured lines.
     */
    public void clear() {
        entries.clear();
    }

    private List<String> messages(Severity severity) {
        List<String> messages = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.severity() == severity) {
                messages.add(entry.message());
            }
        }
        return messages;
    }
}
