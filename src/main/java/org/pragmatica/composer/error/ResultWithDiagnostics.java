package org.pragmatica.composer.error;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Value of an operation together with the diagnostics reported while computing it.
 *
 * <p>When the operation completes cleanly, {@code diagnostics} is empty. When it meets
 * recoverable problems, {@code value} is still present but may be incomplete: the
 * offending elements contributed nothing.
 *
 * @param value       The computed value
 * @param diagnostics Diagnostics reported along the way
 */
public record ResultWithDiagnostics<T>(T value, List<Diagnostic> diagnostics) {
    public ResultWithDiagnostics {
        checkNotNull(value);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Create a clean result.
     */
    public static <T> ResultWithDiagnostics<T> success(T value) {
        return new ResultWithDiagnostics<>(value, List.of());
    }

    public static <T> ResultWithDiagnostics<T> of(T value, Diagnostics diagnostics) {
        return new ResultWithDiagnostics<>(value, diagnostics.reported());
    }

    /**
     * Check if the operation completed without any diagnostics.
     */
    public boolean isClean() {
        return diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        return errorCount() > 0;
    }

    /**
     * Format all diagnostics, one block per diagnostic.
     */
    public String formatDiagnostics() {
        if (diagnostics.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format());
        }
        return sb.toString();
    }

    public int errorCount() {
        return (int) diagnostics.stream()
                                .filter(d -> d.severity() == Diagnostic.Severity.ERROR)
                                .count();
    }

    public int warningCount() {
        return (int) diagnostics.stream()
                                .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
                                .count();
    }
}
