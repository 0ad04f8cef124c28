package org.pragmatica.composer.table;

import org.pragmatica.composer.error.CompositionError;
import org.pragmatica.composer.error.MalformedTreeException;
import org.pragmatica.composer.tree.Manifold;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Symbol table entry. Recursive types ({@link EntryType#isRecursive()}) are {@link Scope}s
 * holding a nested {@link Table}; all other types are {@link Terminal}s holding a payload.
 */
public sealed interface Entry {
    /**
     * Identifier, empty for anonymous entries.
     */
    Optional<Id> id();

    EntryType type();

    /**
     * Independent copy; scopes are copied recursively.
     */
    Entry copy();

    /**
     * Entry holding a nested table.
     */
    sealed interface Scope extends Entry {
        Table table();
    }

    /**
     * Entry holding a terminal payload.
     */
    sealed interface Terminal extends Entry {}

    /**
     * Build a scope entry of the given type.
     *
     * @throws MalformedTreeException if {@code type} is not recursive
     */
    static Scope scope(Optional<Id> id, EntryType type, Table table) throws MalformedTreeException {
        checkNotNull(table);
        return switch (type) {
            case PATH -> new PathEntry(id, table);
            case COMPOSON -> new ComposonEntry(id, table);
            case NEST -> new NestEntry(id, table);
            case DEREF -> new DerefEntry(id, table);
            case MANIFOLD, POSITIONAL, GROUP_REF ->
                throw new MalformedTreeException(new CompositionError.EntryShape(type, "terminal type cannot hold a nested table"));
        };
    }

    /**
     * Build a terminal entry of the given type: a {@link Manifold} for manifolds, a string otherwise.
     *
     * @throws MalformedTreeException if {@code type} is recursive or the payload has the wrong type
     */
    static Terminal terminal(Optional<Id> id, EntryType type, Object value) throws MalformedTreeException {
        if (type.isRecursive()) {
            throw new MalformedTreeException(new CompositionError.EntryShape(type, "recursive type requires a nested table"));
        }
        if (type == EntryType.MANIFOLD && value instanceof Manifold manifold) {
            return new ManifoldEntry(id, Optional.of(manifold));
        }
        if (type == EntryType.POSITIONAL && value instanceof String string) {
            return new PositionalEntry(id, string);
        }
        if (type == EntryType.GROUP_REF && value instanceof String string) {
            return new GroupRefEntry(id, string, Optional.empty());
        }
        var found = value == null
                    ? "null"
                    : value.getClass()
                           .getSimpleName();
        throw new MalformedTreeException(new CompositionError.EntryShape(type, "unexpected payload " + found));
    }

    // === Scopes ===

    record PathEntry(Optional<Id> id, Table table) implements Scope {
        public PathEntry {
            checkNotNull(id);
            checkNotNull(table);
        }

        @Override
        public EntryType type() {
            return EntryType.PATH;
        }

        @Override
        public PathEntry copy() {
            return new PathEntry(id, table.deepClone());
        }
    }

    record ComposonEntry(Optional<Id> id, Table table) implements Scope {
        public ComposonEntry {
            checkNotNull(id);
            checkNotNull(table);
        }

        @Override
        public EntryType type() {
            return EntryType.COMPOSON;
        }

        @Override
        public ComposonEntry copy() {
            return new ComposonEntry(id, table.deepClone());
        }
    }

    record NestEntry(Optional<Id> id, Table table) implements Scope {
        public NestEntry {
            checkNotNull(id);
            checkNotNull(table);
        }

        @Override
        public EntryType type() {
            return EntryType.NEST;
        }

        @Override
        public NestEntry copy() {
            return new NestEntry(id, table.deepClone());
        }
    }

    record DerefEntry(Optional<Id> id, Table table) implements Scope {
        public DerefEntry {
            checkNotNull(id);
            checkNotNull(table);
        }

        @Override
        public EntryType type() {
            return EntryType.DEREF;
        }

        @Override
        public DerefEntry copy() {
            return new DerefEntry(id, table.deepClone());
        }
    }

    // === Terminals ===

    /**
     * Manifold slot. Copies get a fresh empty slot: manifold state is never duplicated.
     */
    record ManifoldEntry(Optional<Id> id, Optional<Manifold> manifold) implements Terminal {
        public ManifoldEntry {
            checkNotNull(id);
            checkNotNull(manifold);
        }

        @Override
        public EntryType type() {
            return EntryType.MANIFOLD;
        }

        @Override
        public ManifoldEntry copy() {
            return new ManifoldEntry(id, Optional.empty());
        }
    }

    record PositionalEntry(Optional<Id> id, String value) implements Terminal {
        public PositionalEntry {
            checkNotNull(id);
            checkNotNull(value);
        }

        @Override
        public EntryType type() {
            return EntryType.POSITIONAL;
        }

        @Override
        public PositionalEntry copy() {
            return new PositionalEntry(id, value);
        }
    }

    /**
     * Reference to a named group. Unresolved until a resolution pass supplies the group's table.
     */
    record GroupRefEntry(Optional<Id> id, String value, Optional<Table> resolution) implements Terminal {
        public GroupRefEntry {
            checkNotNull(id);
            checkNotNull(value);
            checkNotNull(resolution);
        }

        public boolean isResolved() {
            return resolution.isPresent();
        }

        public GroupRefEntry resolve(Table group) {
            return new GroupRefEntry(id, value, Optional.of(group));
        }

        @Override
        public EntryType type() {
            return EntryType.GROUP_REF;
        }

        @Override
        public GroupRefEntry copy() {
            return new GroupRefEntry(id, value, resolution.map(Table::deepClone));
        }
    }
}
