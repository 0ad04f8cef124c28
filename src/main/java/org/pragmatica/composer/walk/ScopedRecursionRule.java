package org.pragmatica.composer.walk;

import org.pragmatica.composer.tree.Node;
import org.pragmatica.composer.tree.Sequence;

import java.util.List;

/**
 * Recursion rule that also sees the state threaded through a scoped traversal.
 */
@FunctionalInterface
public interface ScopedRecursionRule<S> {
    List<Sequence> children(Node node, S state);
}
