package org.pragmatica.composer.walk;

import com.google.common.collect.ImmutableList;
import org.pragmatica.composer.error.Diagnostic;
import org.pragmatica.composer.error.Diagnostics;
import org.pragmatica.composer.tree.Node;
import org.pragmatica.composer.tree.Sequence;

import java.util.List;

/**
 * Stock recursion rules.
 */
public final class RecursionRules {
    private RecursionRules() {}

    /**
     * Never recurse - flat, single-level traversal.
     */
    public static RecursionRule none() {
        return node -> List.of();
    }

    /**
     * Recurse into sequence-shaped nodes only.
     */
    public static RecursionRule branches() {
        return node -> node instanceof Node.Branch branch
                       ? List.of(branch.children())
                       : List.of();
    }

    /**
     * Recurse into sequence-shaped nodes and into both sides of couplets. A sequence-shaped side
     * yields its children; a terminal right-hand side yields itself, so bound terms are visited.
     */
    public static RecursionRule full() {
        return RecursionRules::descend;
    }

    /**
     * Like {@link #full()}, but a couplet bearing a manifold yields only the manifold;
     * its qualifier is not visited.
     */
    public static RecursionRule most() {
        return node -> node instanceof Node.Couplet couplet && couplet.rhs() instanceof Node.ManifoldNode manifold
                       ? List.of(Sequence.of(manifold))
                       : descend(node);
    }

    /**
     * Recurse into composon, nest and deref bodies and into the remainder of qualified paths.
     * Group references cannot be expanded yet; they are reported and yield nothing.
     */
    public static RecursionRule composition(Diagnostics diagnostics) {
        return node -> switch (node.kind()) {
            case COMPOSON, NEST, DEREF -> List.of(((Node.Branch) node).children());
            case QUALIFIED_PATH -> remainder((Node.Couplet) node);
            case GROUP_REF -> {
                diagnostics.report(unresolved((Node.GroupRef) node));
                yield List.of();
            }
            default -> List.of();
        };
    }

    /**
     * Scope-aware rule keyed by the couplet being processed.
     * A nest is always entered. A qualified path is entered only while the couplet's
     * left-hand side is fully consumed or names the same scope; otherwise the path
     * shadows the binding and yields nothing.
     */
    public static ScopedRecursionRule<Node.Couplet> path(Diagnostics diagnostics) {
        return (node, couplet) -> {
            if (node instanceof Node.Nest nest) {
                return List.of(nest.children());
            }
            if (node instanceof Node.QualifiedPath path) {
                return Couplets.leftHandSideLength(couplet) == 1
                       || Couplets.sameLeftHandSide(path, couplet, diagnostics)
                       ? remainder(path)
                       : List.of();
            }
            return List.of();
        };
    }

    private static List<Sequence> descend(Node node) {
        if (node instanceof Node.Branch branch) {
            return List.of(branch.children());
        }
        if (node instanceof Node.Couplet couplet) {
            var result = ImmutableList.<Sequence>builder();
            if (couplet.lhs() instanceof Node.Branch lhs) {
                result.add(lhs.children());
            }
            result.add(couplet.rhs() instanceof Node.Branch rhs
                       ? rhs.children()
                       : Sequence.of(couplet.rhs()));
            return result.build();
        }
        return List.of();
    }

    private static List<Sequence> remainder(Node.Couplet couplet) {
        return couplet.rhs() instanceof Node.Branch rhs
               ? List.of(rhs.children())
               : List.of();
    }

    private static Diagnostic unresolved(Node.GroupRef ref) {
        return Diagnostic.warning(Diagnostic.UNRESOLVED_GROUP_REF,
                                  "unresolved group reference '" + ref.value() + "'",
                                  "composition recursion")
                         .withHelp("group references are resolved by a later pass");
    }
}
