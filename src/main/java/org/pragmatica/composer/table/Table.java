package org.pragmatica.composer.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Scoped symbol table mirroring the recursive shape of the node tree.
 *
 * <p>Entries are immutable; a table owns the ordered list holding them and may be extended
 * in place with {@link #add(Entry)} and {@link #join(Table, Table)}. Lookups always return
 * new tables referencing the matched entries.
 */
public final class Table implements Iterable<Entry> {
    private final List<Entry> entries;

    private Table(List<Entry> entries) {
        this.entries = entries;
    }

    public static Table empty() {
        return new Table(new ArrayList<>());
    }

    /**
     * Single-entry table.
     */
    public static Table of(Entry entry) {
        return empty().add(entry);
    }

    public static Table of(Entry... entries) {
        var table = empty();
        for (var entry : entries) {
            table.add(entry);
        }
        return table;
    }

    /**
     * Append an entry at the tail.
     */
    public Table add(Entry entry) {
        entries.add(checkNotNull(entry));
        return this;
    }

    /**
     * Splice {@code b} after the tail of {@code a}. Either side being empty is the identity;
     * otherwise {@code a} is extended in place and returned. After the call {@code b} is
     * logically merged into the result and should not be extended independently.
     */
    public static Table join(Table a, Table b) {
        if (b == null || b.isEmpty()) {
            return a == null ? empty() : a;
        }
        if (a == null || a.isEmpty()) {
            return b;
        }
        a.entries.addAll(b.entries);
        return a;
    }

    /**
     * Fully independent copy: nested tables are cloned, manifold slots come back empty.
     */
    public Table deepClone() {
        var clone = empty();
        for (var entry : entries) {
            clone.add(entry.copy());
        }
        return clone;
    }

    // === Lookup ===

    /**
     * Top-level entries matching both {@code id} and {@code type}.
     */
    public Table get(Id id, EntryType type) {
        var out = empty();
        for (var entry : entries) {
            if (matches(entry, id, type)) {
                out.add(entry);
            }
        }
        return out;
    }

    /**
     * Entries matching {@code id} and {@code type} anywhere in the table, in pre-order.
     * Every scope is searched regardless of its name.
     */
    public Table recursiveGet(Id id, EntryType type) {
        var out = empty();
        for (var entry : entries) {
            if (matches(entry, id, type)) {
                out.add(entry);
            }
            if (entry instanceof Entry.Scope scope) {
                out = join(out, scope.table()
                                     .recursiveGet(id, type));
            }
        }
        return out;
    }

    /**
     * Entries of {@code type} anywhere in the table, in pre-order, regardless of identifier.
     */
    public Table recursiveGetType(EntryType type) {
        var out = empty();
        for (var entry : entries) {
            if (entry.type() == type) {
                out.add(entry);
            }
            if (entry instanceof Entry.Scope scope) {
                out = join(out, scope.table()
                                     .recursiveGetType(type));
            }
        }
        return out;
    }

    /**
     * Path-qualified lookup.
     *
     * <p>At the base segment, entries matching the segment and type are returned together with
     * every match found by {@link #recursiveGet} inside the scopes of this level. Above the base,
     * a named scope is entered only when its id matches the current segment, which it consumes;
     * anonymous scopes are entered with the path unchanged. An anonymous scope never stands in
     * for a segment: {@code b.a.c} does not reach {@code c} through {@code (a.c)} wrapped in a nest.
     */
    public Table pathGet(Path path, EntryType type) {
        var out = empty();
        var segment = path.head();
        for (var entry : entries) {
            if (path.isBase()) {
                if (matches(entry, segment, type)) {
                    out.add(entry);
                }
                if (entry instanceof Entry.Scope scope) {
                    out = join(out, scope.table()
                                         .recursiveGet(segment, type));
                }
            } else if (entry instanceof Entry.Scope scope && entry.id().isEmpty()) {
                out = join(out, scope.table()
                                     .pathGet(path, type));
            } else if (entry instanceof Entry.Scope scope && matches(entry, segment)) {
                out = join(out, scope.table()
                                     .pathGet(path.rest(), type));
            }
        }
        return out;
    }

    /**
     * Union of path-qualified lookups, in selection order; duplicates are kept.
     */
    public Table selectionGet(Selection selection, EntryType type) {
        var out = empty();
        for (var path : selection.paths()) {
            out = join(out, pathGet(path, type));
        }
        return out;
    }

    /**
     * All entries in pre-order, scopes before their contents.
     */
    public List<Entry> flatten() {
        var out = new ArrayList<Entry>();
        for (var entry : entries) {
            out.add(entry);
            if (entry instanceof Entry.Scope scope) {
                out.addAll(scope.table()
                                .flatten());
            }
        }
        return out;
    }

    // === Access ===

    public Optional<Entry> head() {
        return entries.isEmpty()
               ? Optional.empty()
               : Optional.of(entries.get(0));
    }

    public Optional<Entry> tail() {
        return entries.isEmpty()
               ? Optional.empty()
               : Optional.of(entries.get(entries.size() - 1));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public Stream<Entry> stream() {
        return entries.stream();
    }

    @Override
    public Iterator<Entry> iterator() {
        return entries().iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Table other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    private static boolean matches(Entry entry, Id id, EntryType type) {
        return entry.type() == type
               && entry.id()
                       .map(own -> own.matches(id))
                       .orElse(false);
    }

    private static boolean matches(Entry scope, Id segment) {
        return scope.id()
                    .map(own -> own.matches(segment))
                    .orElse(false);
    }
}
