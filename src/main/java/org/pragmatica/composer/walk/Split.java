package org.pragmatica.composer.walk;

import org.pragmatica.composer.error.MalformedTreeException;
import org.pragmatica.composer.tree.Node;
import org.pragmatica.composer.tree.Sequence;

/**
 * One-to-many transform: {@code a -> [b]}.
 */
@FunctionalInterface
public interface Split {
    /**
     * @param node the node to split
     * @return the nodes replacing it, in order
     * @throws MalformedTreeException if the node cannot be split
     */
    Sequence apply(Node node) throws MalformedTreeException;
}
