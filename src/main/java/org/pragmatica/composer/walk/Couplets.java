package org.pragmatica.composer.walk;

import org.pragmatica.composer.error.CompositionError;
import org.pragmatica.composer.error.Diagnostic;
import org.pragmatica.composer.error.Diagnostics;
import org.pragmatica.composer.error.MalformedTreeException;
import org.pragmatica.composer.tree.Label;
import org.pragmatica.composer.tree.Node;
import org.pragmatica.composer.tree.Sequence;

import java.util.Optional;

/**
 * Operations on the left-hand side of couplets.
 */
public final class Couplets {
    private Couplets() {}

    /**
     * Derive the comparable label of a left-hand side.
     * Alternatives and illegal shapes are reported and give no label.
     */
    public static Optional<Label> label(Node lhs, Diagnostics diagnostics) {
        if (lhs instanceof Node.Name name) {
            return Optional.of(Label.of(name.value()));
        }
        if (lhs instanceof Node.LabelNode labelNode) {
            return Optional.of(labelNode.label());
        }
        if (lhs instanceof Node.QualifiedName qualified) {
            return qualified.children()
                            .head()
                            .flatMap(Couplets::segmentLabel);
        }
        if (lhs instanceof Node.Alternatives) {
            diagnostics.report(Diagnostic.warning(Diagnostic.UNSUPPORTED_ALTERNATIVES,
                                                  "recursion into a list of alternatives is not supported",
                                                  "label comparison")
                                         .withHelp("split the couplet before scoped traversal"));
            return Optional.empty();
        }
        diagnostics.report(Diagnostic.error(Diagnostic.ILLEGAL_LEFT_HAND_SIDE,
                                            "illegal left-hand side " + lhs.kind(),
                                            "label comparison"));
        return Optional.empty();
    }

    private static Optional<Label> segmentLabel(Node segment) {
        if (segment instanceof Node.LabelNode labelNode) {
            return Optional.of(labelNode.label());
        }
        if (segment instanceof Node.Name name) {
            return Optional.of(Label.of(name.value()));
        }
        return Optional.empty();
    }

    /**
     * Whether the left-hand sides of two couplets name the same thing.
     */
    public static boolean sameLeftHandSide(Node a, Node b, Diagnostics diagnostics) {
        if (!(a instanceof Node.Couplet left) || !(b instanceof Node.Couplet right)) {
            return false;
        }
        var leftLabel = label(left.lhs(), diagnostics);
        var rightLabel = label(right.lhs(), diagnostics);
        return leftLabel.isPresent()
               && rightLabel.isPresent()
               && leftLabel.get()
                           .matches(rightLabel.get());
    }

    /**
     * Number of segments (or alternatives) in a couplet's left-hand side; singular sides count as one.
     */
    public static int leftHandSideLength(Node.Couplet couplet) {
        return couplet.lhs() instanceof Node.Branch branch
               ? branch.children()
                       .size()
               : 1;
    }

    /**
     * Split a couplet whose left-hand side lists alternatives into one couplet per alternative.
     * Each result shares the original right-hand side. Couplets with a singular left-hand side
     * are returned unchanged.
     *
     * @throws MalformedTreeException if {@code node} is not a couplet or its left-hand side has another shape
     */
    public static Sequence splitCouplet(Node node) throws MalformedTreeException {
        if (!(node instanceof Node.Couplet couplet)) {
            throw new MalformedTreeException(new CompositionError.NotACouplet(node.kind()));
        }
        var lhs = couplet.lhs();
        return switch (lhs.kind()) {
            case ALTERNATIVES -> {
                var result = Sequence.empty();
                for (var alternative : ((Node.Alternatives) lhs).children()) {
                    result.add(couplet.withLhs(alternative));
                }
                yield result;
            }
            case QUALIFIED_NAME, LABEL, NAME -> Sequence.of(couplet);
            default -> throw new MalformedTreeException(new CompositionError.InvalidLeftHandSide(lhs.kind()));
        };
    }
}
