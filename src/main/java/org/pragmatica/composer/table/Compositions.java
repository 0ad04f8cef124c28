package org.pragmatica.composer.table;

import org.pragmatica.composer.error.CompositionError;
import org.pragmatica.composer.error.Diagnostic;
import org.pragmatica.composer.error.Diagnostics;
import org.pragmatica.composer.error.MalformedTreeException;

/**
 * Input and output extraction for composons.
 *
 * <p>Data flows into the last stage of a nested composition and out of its first stage, so
 * inputs are taken from the innermost (tail) entry of a nested path or nest and outputs from
 * the outermost (head) entry.
 */
public final class Compositions {
    private Compositions() {}

    public static Table inputs(Entry entry, Diagnostics diagnostics) throws MalformedTreeException {
        return io(entry, true, diagnostics);
    }

    public static Table outputs(Entry entry, Diagnostics diagnostics) throws MalformedTreeException {
        return io(entry, false, diagnostics);
    }

    private static Table io(Entry entry, boolean isInput, Diagnostics diagnostics) throws MalformedTreeException {
        if (!isComposition(entry)) {
            throw new MalformedTreeException(new CompositionError.NotAComposition(entry.type()));
        }
        var origin = isInput ? "composon inputs" : "composon outputs";
        var result = Table.empty();
        for (var e : ((Entry.Scope) entry).table()) {
            var contribution = switch (e.type()) {
                case MANIFOLD, POSITIONAL, DEREF -> Table.of(e);
                case PATH, NEST -> nestedEnd((Entry.Scope) e, isInput, origin, diagnostics);
                case GROUP_REF -> group((Entry.GroupRefEntry) e, origin, diagnostics);
                case COMPOSON -> {
                    diagnostics.report(Diagnostic.error(Diagnostic.ILLEGAL_COMPOSITION,
                                                        "illegal " + e.type() + " entry in composition",
                                                        origin));
                    yield Table.empty();
                }
            };
            result = Table.join(result, contribution);
        }
        return result;
    }

    /**
     * Inputs of the innermost stage or outputs of the outermost stage of a nested scope.
     */
    private static Table nestedEnd(Entry.Scope scope,
                                   boolean isInput,
                                   String origin,
                                   Diagnostics diagnostics) throws MalformedTreeException {
        var nested = scope.table();
        var end = isInput ? nested.tail() : nested.head();
        if (end.isEmpty()) {
            diagnostics.report(Diagnostic.info(Diagnostic.EMPTY_SCOPE,
                                               "empty " + scope.type() + " contributes nothing",
                                               origin));
            return Table.empty();
        }
        if (!isComposition(end.get())) {
            diagnostics.report(Diagnostic.error(Diagnostic.ILLEGAL_COMPOSITION,
                                                scope.type() + " ends in a " + end.get().type() + " entry",
                                                origin));
            return Table.empty();
        }
        return io(end.get(), isInput, diagnostics);
    }

    private static Table group(Entry.GroupRefEntry ref, String origin, Diagnostics diagnostics) {
        if (ref.isResolved()) {
            var entries = Table.empty();
            ref.resolution()
               .get()
               .forEach(entries::add);
            return entries;
        }
        diagnostics.report(Diagnostic.warning(Diagnostic.UNRESOLVED_GROUP_REF,
                                              "unresolved group reference '" + ref.value() + "'",
                                              origin)
                                     .withHelp("group references are resolved by a later pass"));
        return Table.empty();
    }

    private static boolean isComposition(Entry entry) {
        return entry instanceof Entry.ComposonEntry || entry instanceof Entry.NestEntry;
    }
}
