package org.pragmatica.composer.error;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Advisory message produced while traversing or resolving a tree.
 * Diagnostics never abort an operation; the operation contributes nothing for the
 * offending element and carries on.
 *
 * <p>Example output:
 * <pre>
 * warning[W0201]: unresolved group reference 'filters'
 *   --> composon inputs
 *    = help: group references are resolved by a later pass
 * </pre>
 *
 * @param severity Severity level
 * @param code     Diagnostic code (e.g., "W0201")
 * @param message  Primary message
 * @param origin   Operation that reported the diagnostic
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    String origin,
    List<String> notes
) {
    public static final String UNSUPPORTED_ALTERNATIVES = "W0101";
    public static final String ILLEGAL_LEFT_HAND_SIDE = "E0102";
    public static final String UNRESOLVED_GROUP_REF = "W0201";
    public static final String ILLEGAL_COMPOSITION = "E0202";
    public static final String EMPTY_SCOPE = "I0203";
    public static final String SKIPPED_NODE = "I0301";

    public Diagnostic {
        checkNotNull(severity);
        checkNotNull(code);
        checkNotNull(message);
        checkNotNull(origin);
        notes = List.copyOf(notes);
    }

    /**
     * Diagnostic severity levels.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic error(String code, String message, String origin) {
        return new Diagnostic(Severity.ERROR, code, message, origin, List.of());
    }

    public static Diagnostic warning(String code, String message, String origin) {
        return new Diagnostic(Severity.WARNING, code, message, origin, List.of());
    }

    public static Diagnostic info(String code, String message, String origin) {
        return new Diagnostic(Severity.INFO, code, message, origin, List.of());
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, origin, newNotes);
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Whether this diagnostic counts against {@link RecoveryPolicy#STRICT}.
     */
    public boolean isSignificant() {
        return severity != Severity.INFO;
    }

    /**
     * Multi-line format with origin and notes.
     */
    public String format() {
        var sb = new StringBuilder();
        sb.append(severity.display())
          .append("[")
          .append(code)
          .append("]: ")
          .append(message)
          .append("\n");
        sb.append("  --> ")
          .append(origin)
          .append("\n");
        for (var note : notes) {
            sb.append("   = ")
              .append(note)
              .append("\n");
        }
        return sb.toString();
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        return String.format("%s: %s[%s]: %s", origin, severity.display(), code, message);
    }
}
