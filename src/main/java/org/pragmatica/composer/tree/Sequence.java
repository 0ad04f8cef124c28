package org.pragmatica.composer.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Ordered container of nodes.
 *
 * <p>A sequence exclusively owns its backing list. Nodes are immutable and may be
 * referenced from several sequences, but a container is never shared: use {@link #copy()}
 * to obtain a private view before handing a sequence to another owner.
 */
public final class Sequence implements Iterable<Node> {
    private final List<Node> nodes;

    private Sequence(List<Node> nodes) {
        this.nodes = nodes;
    }

    public static Sequence empty() {
        return new Sequence(new ArrayList<>());
    }

    public static Sequence of(Node... nodes) {
        var sequence = empty();
        for (var node : nodes) {
            sequence.add(node);
        }
        return sequence;
    }

    public static Sequence of(List<? extends Node> nodes) {
        var sequence = empty();
        nodes.forEach(sequence::add);
        return sequence;
    }

    /**
     * Append a node at the tail.
     */
    public Sequence add(Node node) {
        nodes.add(checkNotNull(node));
        return this;
    }

    /**
     * Append all nodes of {@code other} after the tail. An empty operand is a no-op.
     */
    public Sequence concat(Sequence other) {
        if (other != null && !other.isEmpty()) {
            nodes.addAll(other.nodes);
        }
        return this;
    }

    /**
     * Private container over the same node references.
     */
    public Sequence copy() {
        return new Sequence(new ArrayList<>(nodes));
    }

    /**
     * All nodes but the head, as a new sequence.
     */
    public Sequence rest() {
        return nodes.isEmpty()
               ? empty()
               : new Sequence(new ArrayList<>(nodes.subList(1, nodes.size())));
    }

    public Optional<Node> head() {
        return nodes.isEmpty()
               ? Optional.empty()
               : Optional.of(nodes.get(0));
    }

    public Optional<Node> tail() {
        return nodes.isEmpty()
               ? Optional.empty()
               : Optional.of(nodes.get(nodes.size() - 1));
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    /**
     * Replace the node at {@code index} in place.
     */
    public void set(int index, Node node) {
        nodes.set(index, checkNotNull(node));
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public Stream<Node> stream() {
        return nodes.stream();
    }

    public Cursor cursor() {
        return new Cursor(this, 0);
    }

    @Override
    public Iterator<Node> iterator() {
        return nodes().iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Sequence other && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return nodes.toString();
    }

    /**
     * Position within a sequence; advancing moves to the next sibling.
     */
    public record Cursor(Sequence sequence, int index) {
        public Cursor {
            checkNotNull(sequence);
            checkArgument(index >= 0, "negative cursor index");
        }

        public Optional<Node> current() {
            return index < sequence.size()
                   ? Optional.of(sequence.get(index))
                   : Optional.empty();
        }

        public boolean atEnd() {
            return index >= sequence.size();
        }

        public Cursor next() {
            return atEnd()
                   ? this
                   : new Cursor(sequence, index + 1);
        }
    }
}
