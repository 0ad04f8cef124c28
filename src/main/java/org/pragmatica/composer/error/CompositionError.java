package org.pragmatica.composer.error;

import org.pragmatica.composer.table.EntryType;
import org.pragmatica.composer.tree.Kind;

import java.util.List;

/**
 * Structural error that no recovery policy can continue past.
 * Raised through {@link MalformedTreeException}.
 */
public sealed interface CompositionError {
    String message();

    /**
     * Zipped application over sequences of different lengths.
     */
    record LengthMismatch(int left, int right) implements CompositionError {
        @Override
        public String message() {
            return "Cannot zip sequences of unequal length (" + left + " vs " + right + ")";
        }
    }

    /**
     * Couplet operation applied to a node that is not a couplet.
     */
    record NotACouplet(Kind found) implements CompositionError {
        @Override
        public String message() {
            return "Expected a couplet, found " + found;
        }
    }

    /**
     * Couplet whose left-hand side has a shape the operation cannot handle.
     */
    record InvalidLeftHandSide(Kind found) implements CompositionError {
        @Override
        public String message() {
            return "Invalid left-hand side in couplet: " + found;
        }
    }

    /**
     * Entry type and payload shape disagree.
     */
    record EntryShape(EntryType type, String reason) implements CompositionError {
        @Override
        public String message() {
            return "Malformed " + type + " entry: " + reason;
        }
    }

    /**
     * Composon input/output extraction applied to something other than a composon or nest.
     */
    record NotAComposition(EntryType found) implements CompositionError {
        @Override
        public String message() {
            return "Expected a composon or nest entry, found " + found;
        }
    }

    /**
     * Diagnostics escalated under {@link RecoveryPolicy#STRICT}.
     */
    record Escalated(List<Diagnostic> diagnostics) implements CompositionError {
        public Escalated {
            diagnostics = List.copyOf(diagnostics);
        }

        @Override
        public String message() {
            var first = diagnostics.isEmpty()
                        ? "no diagnostics"
                        : diagnostics.get(0)
                                     .formatSimple();
            return diagnostics.size() + " diagnostic(s) escalated under strict recovery, first: " + first;
        }
    }
}
