package org.pragmatica.composer;

import org.pragmatica.composer.error.RecoveryPolicy;

/**
 * Composer configuration options.
 */
public record ComposerConfig(
    RecoveryPolicy recovery,
    boolean logDiagnostics
) {
    public static final ComposerConfig DEFAULT = new ComposerConfig(
        RecoveryPolicy.LENIENT,
        true
    );
}
