package org.pragmatica.composer.tree;

/**
 * Opaque function descriptor carried by manifold nodes.
 * The front end owns and moves these values around but never interprets them.
 */
public interface Manifold {}
