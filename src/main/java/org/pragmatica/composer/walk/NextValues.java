package org.pragmatica.composer.walk;

import org.pragmatica.composer.error.Diagnostic;
import org.pragmatica.composer.error.Diagnostics;
import org.pragmatica.composer.tree.Node;
import org.pragmatica.composer.tree.Sequence;

/**
 * Stock state-advance functions for scoped traversals.
 */
public final class NextValues {
    private NextValues() {}

    /**
     * State is invariant across recursion.
     */
    public static <S> NextValue<S> never() {
        return (into, state) -> state;
    }

    /**
     * Move the cursor to the next sibling on every descent.
     */
    public static NextValue<Sequence.Cursor> always() {
        return (into, cursor) -> cursor.next();
    }

    /**
     * Consume one level of qualification when descending into a qualified path.
     *
     * <p>If {@code into} is a qualified path and the couplet's left-hand side still has more
     * than one segment, the result is a copy of the couplet whose left-hand side lost its head
     * segment. Otherwise the couplet is passed down unchanged. Alternatives cannot be consumed
     * this way; they are reported and do not advance.
     */
    public static NextValue<Node.Couplet> ifPath(Diagnostics diagnostics) {
        return (into, couplet) -> {
            if (!(into instanceof Node.QualifiedPath) || Couplets.leftHandSideLength(couplet) <= 1) {
                return couplet;
            }
            var lhs = couplet.lhs();
            if (lhs instanceof Node.QualifiedName name) {
                return couplet.withLhs(new Node.QualifiedName(name.children()
                                                                  .rest()));
            }
            if (lhs instanceof Node.Alternatives) {
                diagnostics.report(Diagnostic.warning(Diagnostic.UNSUPPORTED_ALTERNATIVES,
                                                      "cannot advance through a list of alternatives",
                                                      "path state advance"));
            }
            return couplet;
        };
    }
}
