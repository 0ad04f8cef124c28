package org.pragmatica.composer;

import org.pragmatica.composer.tree.Label;
import org.pragmatica.composer.tree.Manifold;
import org.pragmatica.composer.tree.Node;
import org.pragmatica.composer.tree.Sequence;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-building helpers shared by the tests.
 */
public final class Fixtures {
    private Fixtures() {}

    /**
     * Manifold payload that records the effects attached to it.
     */
    public record Fn(String name, List<String> effects) implements Manifold {
        @Override
        public String toString() {
            return name;
        }
    }

    public static Fn fn(String name) {
        return new Fn(name, new ArrayList<>());
    }

    public static Node.ManifoldNode manifold(String name) {
        return new Node.ManifoldNode(fn(name));
    }

    public static Node.LabelNode label(String name) {
        return new Node.LabelNode(Label.of(name));
    }

    public static Node.Binding bind(String name, Node body) {
        return new Node.Binding(label(name), body);
    }

    /**
     * Binding with a dotted left-hand side: {@code bind(body, "a", "b", "c")} is {@code a.b.c = body}.
     */
    public static Node.Binding bindPath(Node body, String... segments) {
        return new Node.Binding(Node.QualifiedName.of(segments), body);
    }

    public static Node.QualifiedPath path(String name, Node... body) {
        return new Node.QualifiedPath(Node.QualifiedName.of(name), new Node.ListNode(Sequence.of(body)));
    }

    public static Node.Composon composon(Node... children) {
        return new Node.Composon(Sequence.of(children));
    }

    public static Node.Nest nest(Node... children) {
        return new Node.Nest(Sequence.of(children));
    }

    public static Node.Deref deref(Node... children) {
        return new Node.Deref(Sequence.of(children));
    }

    public static Node.ListNode list(Node... children) {
        return new Node.ListNode(Sequence.of(children));
    }

    public static Node.Alternatives alternatives(Node... options) {
        return new Node.Alternatives(Sequence.of(options));
    }
}
