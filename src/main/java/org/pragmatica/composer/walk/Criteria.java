package org.pragmatica.composer.walk;

import org.pragmatica.composer.error.Diagnostics;
import org.pragmatica.composer.tree.Kind;
import org.pragmatica.composer.tree.Label;
import org.pragmatica.composer.tree.Node;

import java.util.EnumSet;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stock selection criteria for the traversal combinators.
 */
public final class Criteria {
    private Criteria() {}

    /**
     * Accept every node; filtering with it flattens.
     */
    public static Predicate<Node> all() {
        return node -> true;
    }

    public static Predicate<Node> isManifold() {
        return ofKind(Kind.MANIFOLD);
    }

    public static Predicate<Node> isQualifiedPath() {
        return ofKind(Kind.QUALIFIED_PATH);
    }

    public static Predicate<Node> isType() {
        return ofKind(Kind.TYPE);
    }

    public static Predicate<Node> isComposon() {
        return ofKind(Kind.COMPOSON);
    }

    public static Predicate<Node> isGroupRef() {
        return ofKind(Kind.GROUP_REF);
    }

    public static Predicate<Node> ofKind(Kind first, Kind... rest) {
        var kinds = EnumSet.of(first, rest);
        return node -> node != null && kinds.contains(node.kind());
    }

    /**
     * Couplets whose left-hand side label matches {@code label}.
     */
    public static Predicate<Node> hasLabel(Label label, Diagnostics diagnostics) {
        checkNotNull(label);
        return node -> node instanceof Node.Couplet couplet
                       && Couplets.label(couplet.lhs(), diagnostics)
                                  .map(label::matches)
                                  .orElse(false);
    }

    /**
     * Scoped criterion: the visited couplet names the same thing as the state couplet.
     */
    public static BiPredicate<Node, Node.Couplet> sameLeftHandSide(Diagnostics diagnostics) {
        return (node, couplet) -> Couplets.sameLeftHandSide(node, couplet, diagnostics);
    }

    /**
     * Lift a plain criterion into a scoped one that ignores the state.
     */
    public static <S> BiPredicate<Node, S> ignoringState(Predicate<Node> criterion) {
        return (node, state) -> criterion.test(node);
    }
}
