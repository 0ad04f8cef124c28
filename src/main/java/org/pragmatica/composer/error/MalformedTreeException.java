package org.pragmatica.composer.error;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Raised when a tree or table is structurally malformed. Callers typically abort the compilation.
 */
public final class MalformedTreeException extends Exception {
    private static final long serialVersionUID = 1L;

    private final transient CompositionError error;

    public MalformedTreeException(CompositionError error) {
        super(checkNotNull(error).message());
        this.error = error;
    }

    public CompositionError error() {
        return error;
    }
}
