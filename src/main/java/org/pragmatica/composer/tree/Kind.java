package org.pragmatica.composer.tree;

/**
 * Closed set of node kinds, each with the payload shape it carries.
 */
public enum Kind {
    LIST(Shape.SEQUENCE),
    NEST(Shape.SEQUENCE),
    COMPOSON(Shape.SEQUENCE),
    DEREF(Shape.SEQUENCE),
    ALTERNATIVES(Shape.SEQUENCE),
    QUALIFIED_NAME(Shape.SEQUENCE),

    QUALIFIED_PATH(Shape.COUPLET),
    BINDING(Shape.COUPLET),
    TYPE(Shape.COUPLET),

    POSITIONAL(Shape.TERMINAL),
    GROUP_REF(Shape.TERMINAL),
    NAME(Shape.TERMINAL),
    LABEL(Shape.TERMINAL),
    MANIFOLD(Shape.TERMINAL);

    /**
     * Payload shape of a node kind.
     */
    public enum Shape {
        /**
         * Holds a nested {@link Sequence}.
         */
        SEQUENCE,
        /**
         * Holds a left-hand and a right-hand node.
         */
        COUPLET,
        /**
         * Holds a string or an opaque payload.
         */
        TERMINAL
    }

    private final Shape shape;

    Kind(Shape shape) {
        this.shape = shape;
    }

    public Shape shape() {
        return shape;
    }
}
