package org.pragmatica.composer.error;

/**
 * How recoverable diagnostics are treated by the {@code Composer} facade.
 */
public enum RecoveryPolicy {
    /**
     * Return the (possibly incomplete) value together with its diagnostics.
     */
    LENIENT,

    /**
     * Escalate any warning or error diagnostic to a fatal {@link CompositionError.Escalated}.
     */
    STRICT
}
