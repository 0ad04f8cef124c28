package org.pragmatica.composer.walk;

import org.pragmatica.composer.tree.Node;

/**
 * Step of a stateful zip: consumes one pair and the running state, returns the next state.
 */
@FunctionalInterface
public interface ZipStep<S> {
    S apply(Node x, Node y, S state);
}
