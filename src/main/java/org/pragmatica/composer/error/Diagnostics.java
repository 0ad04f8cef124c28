package org.pragmatica.composer.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable collector for diagnostics reported during a single operation.
 * Each reported diagnostic is also written to the log unless logging is disabled.
 */
public final class Diagnostics {
    private static final Logger LOG = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Diagnostic> reported = new ArrayList<>();
    private final boolean logging;

    private Diagnostics(boolean logging) {
        this.logging = logging;
    }

    public static Diagnostics create() {
        return new Diagnostics(true);
    }

    public static Diagnostics create(boolean logging) {
        return new Diagnostics(logging);
    }

    public void report(Diagnostic diagnostic) {
        reported.add(diagnostic);
        if (logging) {
            log(diagnostic);
        }
    }

    public List<Diagnostic> reported() {
        return List.copyOf(reported);
    }

    public boolean isEmpty() {
        return reported.isEmpty();
    }

    public boolean hasSignificant() {
        return reported.stream()
                       .anyMatch(Diagnostic::isSignificant);
    }

    private static void log(Diagnostic diagnostic) {
        switch (diagnostic.severity()) {
            case ERROR -> LOG.error(diagnostic.formatSimple());
            case WARNING -> LOG.warn(diagnostic.formatSimple());
            case INFO -> LOG.debug(diagnostic.formatSimple());
        }
    }
}
