package org.pragmatica.composer.walk;

import org.pragmatica.composer.tree.Node;

/**
 * Computes the state used below {@code into} from the state used at its level.
 */
@FunctionalInterface
public interface NextValue<S> {
    S next(Node into, S state);
}
