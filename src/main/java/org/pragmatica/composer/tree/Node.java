package org.pragmatica.composer.tree;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Term of the composition language - a closed sum over the node kinds.
 *
 * <p>Every kind carries exactly the payload its {@link Kind.Shape} requires:
 * branches hold a nested {@link Sequence}, couplets hold a left/right pair,
 * leaves hold a string or an opaque payload.
 */
public sealed interface Node {
    /**
     * The kind tag of this node.
     */
    Kind kind();

    /**
     * Node holding a nested sequence.
     */
    sealed interface Branch extends Node {
        Sequence children();
    }

    /**
     * Node pairing a left-hand qualifier with a right-hand body.
     */
    sealed interface Couplet extends Node {
        Node lhs();

        Node rhs();

        /**
         * Copy of this couplet with the left-hand side replaced; the right-hand side is shared.
         */
        Couplet withLhs(Node lhs);
    }

    /**
     * Terminal node.
     */
    sealed interface Leaf extends Node {}

    // === Branches ===

    /**
     * Plain list wrapper, also used as the right-hand branch of a qualified path.
     */
    record ListNode(Sequence children) implements Branch {
        public ListNode {
            checkNotNull(children);
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }
    }

    /**
     * Anonymous grouping, transparent to path-qualified lookup.
     */
    record Nest(Sequence children) implements Branch {
        public Nest {
            checkNotNull(children);
        }

        @Override
        public Kind kind() {
            return Kind.NEST;
        }
    }

    /**
     * One stage of a function composition.
     */
    record Composon(Sequence children) implements Branch {
        public Composon {
            checkNotNull(children);
        }

        @Override
        public Kind kind() {
            return Kind.COMPOSON;
        }
    }

    /**
     * Dereference of a bound value within a composition.
     */
    record Deref(Sequence children) implements Branch {
        public Deref {
            checkNotNull(children);
        }

        @Override
        public Kind kind() {
            return Kind.DEREF;
        }
    }

    /**
     * List of alternative left-hand sides: {@code a, b = ...}
     */
    record Alternatives(Sequence children) implements Branch {
        public Alternatives {
            checkNotNull(children);
        }

        @Override
        public Kind kind() {
            return Kind.ALTERNATIVES;
        }
    }

    /**
     * Dotted name {@code a.b.c}; segments are {@link LabelNode}s.
     */
    record QualifiedName(Sequence children) implements Branch {
        public QualifiedName {
            checkNotNull(children);
        }

        public static QualifiedName of(String... segments) {
            var sequence = Sequence.empty();
            for (var segment : segments) {
                sequence.add(new LabelNode(Label.of(segment)));
            }
            return new QualifiedName(sequence);
        }

        @Override
        public Kind kind() {
            return Kind.QUALIFIED_NAME;
        }
    }

    // === Couplets ===

    /**
     * Qualified path: head qualifier over the remaining sequence.
     */
    record QualifiedPath(Node lhs, Node rhs) implements Couplet {
        public QualifiedPath {
            checkNotNull(lhs);
            checkNotNull(rhs);
        }

        @Override
        public Kind kind() {
            return Kind.QUALIFIED_PATH;
        }

        @Override
        public QualifiedPath withLhs(Node lhs) {
            return new QualifiedPath(lhs, rhs);
        }
    }

    /**
     * Binding of a name, label, qualified name or alternatives to a body.
     */
    record Binding(Node lhs, Node rhs) implements Couplet {
        public Binding {
            checkNotNull(lhs);
            checkNotNull(rhs);
        }

        @Override
        public Kind kind() {
            return Kind.BINDING;
        }

        @Override
        public Binding withLhs(Node lhs) {
            return new Binding(lhs, rhs);
        }
    }

    /**
     * Type declaration.
     */
    record TypeDecl(Node lhs, Node rhs) implements Couplet {
        public TypeDecl {
            checkNotNull(lhs);
            checkNotNull(rhs);
        }

        @Override
        public Kind kind() {
            return Kind.TYPE;
        }

        @Override
        public TypeDecl withLhs(Node lhs) {
            return new TypeDecl(lhs, rhs);
        }
    }

    // === Leaves ===

    /**
     * Reference to an argument by position.
     */
    record Positional(String value) implements Leaf {
        public Positional {
            checkNotNull(value);
        }

        @Override
        public Kind kind() {
            return Kind.POSITIONAL;
        }
    }

    /**
     * Reference to a named group of compositions, pending resolution.
     */
    record GroupRef(String value) implements Leaf {
        public GroupRef {
            checkNotNull(value);
        }

        @Override
        public Kind kind() {
            return Kind.GROUP_REF;
        }
    }

    /**
     * Bare name.
     */
    record Name(String value) implements Leaf {
        public Name {
            checkNotNull(value);
        }

        @Override
        public Kind kind() {
            return Kind.NAME;
        }
    }

    record LabelNode(Label label) implements Leaf {
        public LabelNode {
            checkNotNull(label);
        }

        @Override
        public Kind kind() {
            return Kind.LABEL;
        }
    }

    record ManifoldNode(Manifold manifold) implements Leaf {
        public ManifoldNode {
            checkNotNull(manifold);
        }

        @Override
        public Kind kind() {
            return Kind.MANIFOLD;
        }
    }
}
