package org.pragmatica.composer.walk;

import org.pragmatica.composer.tree.Node;
import org.pragmatica.composer.tree.Sequence;

import java.util.List;

/**
 * Reports the child sequences of a node that a traversal should descend into.
 */
@FunctionalInterface
public interface RecursionRule {
    /**
     * @param node the node being visited
     * @return child sequences eligible for traversal, empty if none
     */
    List<Sequence> children(Node node);
}
