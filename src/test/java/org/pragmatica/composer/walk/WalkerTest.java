package org.pragmatica.composer.walk;

import org.junit.jupiter.api.Test;
import org.pragmatica.composer.Fixtures.Fn;
import org.pragmatica.composer.error.CompositionError;
import org.pragmatica.composer.error.MalformedTreeException;
import org.pragmatica.composer.tree.Kind;
import org.pragmatica.composer.tree.Node;
import org.pragmatica.composer.tree.Sequence;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.composer.Fixtures.*;

/**
 * Tests for the traversal combinators.
 */
class WalkerTest {

    // f = F ; (G (H)) ; T :: int
    private final Node.ManifoldNode f = manifold("F");
    private final Node.ManifoldNode g = manifold("G");
    private final Node.ManifoldNode h = manifold("H");
    private final Node.Nest inner = nest(h);
    private final Node.Composon composon = composon(g, inner);
    private final Node.Binding binding = bind("f", f);
    private final Node.TypeDecl type = new Node.TypeDecl(label("T"), list(label("int")));
    private final Sequence root = Sequence.of(binding, composon, type);

    private static Fn fnOf(Node node) {
        return (Fn) ((Node.ManifoldNode) node).manifold();
    }

    // === Filters ===

    @Test
    void flatten_withFullRecursion_returnsPreOrder() {
        var flat = Walker.flatten(root, RecursionRules.full());

        assertThat(flat.nodes()).containsExactly(binding, f, composon, g, inner, h, type, label("int"));
    }

    @Test
    void flatten_withoutRecursion_returnsTopLevel() {
        assertEquals(root, Walker.flatten(root, RecursionRules.none()));
    }

    @Test
    void flatten_returnsNewContainer() {
        var flat = Walker.flatten(root, RecursionRules.none());

        flat.add(label("extra"));

        assertEquals(3, root.size());
    }

    @Test
    void filter_keepsNodeBeforeItsDescendants() {
        var seq = Walker.filter(root,
                                RecursionRules.full(),
                                Criteria.ofKind(Kind.COMPOSON, Kind.NEST, Kind.MANIFOLD));

        assertThat(seq.nodes()).containsExactly(f, composon, g, inner, h);
    }

    @Test
    void filter_withoutRecursion_seesTopLevelOnly() {
        assertThat(Walker.filter(root, Criteria.isManifold()).nodes()).isEmpty();
        assertThat(Walker.filter(root, Criteria.isType()).nodes()).containsExactly(type);
    }

    @Test
    void manifolds_findsBareAndBoundManifolds() {
        assertThat(Walker.manifolds(root).nodes()).containsExactly(f, g, h);
    }

    @Test
    void manifolds_findsManifoldBoundToName() {
        assertThat(Walker.manifolds(Sequence.of(binding)).nodes()).containsExactly(f);
    }

    @Test
    void manifolds_skipQualifierOfBoundManifold() {
        var qualified = bindPath(g, "a", "b");
        var seq = Sequence.of(qualified, composon(h));

        assertThat(Walker.manifolds(seq).nodes()).containsExactly(g, h);
        assertThat(Walker.flatten(seq, RecursionRules.most()).nodes()).doesNotContain(label("a"), label("b"));
        assertThat(Walker.flatten(seq, RecursionRules.full()).nodes()).contains(label("a"), label("b"));
    }

    @Test
    void qualifiedPaths_returnsTopLevelPaths() {
        var top = path("a", path("b"));
        var seq = Sequence.of(top, binding);

        assertThat(Walker.qualifiedPaths(seq).nodes()).containsExactly(top);
    }

    @Test
    void filterWith_passesStateToCriterion() {
        var seq = Sequence.of(bind("x", g), bind("y", h), g);

        var found = Walker.filterWith(seq,
                                      "y",
                                      (node, name) -> node instanceof Node.Binding b
                                                      && b.lhs().equals(label(name)));

        assertThat(found.nodes()).containsExactly(seq.get(1));
    }

    @Test
    void scopedFilter_siblingsShareStateChildrenSeeAdvancedState() {
        ScopedRecursionRule<Integer> byDepth = (node, depth) -> RecursionRules.branches().children(node);

        var atDepthOne = Walker.scopedFilter(root,
                                             0,
                                             byDepth,
                                             (node, depth) -> depth == 1,
                                             (into, depth) -> depth + 1);

        assertThat(atDepthOne.nodes()).containsExactly(g, inner);
    }

    @Test
    void scopedFilter_withInvariantState_matchesPlainFilter() {
        ScopedRecursionRule<String> rule = (node, state) -> RecursionRules.full().children(node);

        var scoped = Walker.scopedFilter(root,
                                         "ignored",
                                         rule,
                                         Criteria.ignoringState(Criteria.isManifold()),
                                         NextValues.never());

        assertEquals(Walker.filter(root, RecursionRules.full(), Criteria.isManifold()), scoped);
    }

    // === Modifiers ===

    @Test
    void apply_visitsTopLevelOnly() {
        var visited = new ArrayList<Node>();

        Walker.apply(root, visited::add);

        assertThat(visited).containsExactly(binding, composon, type);
    }

    @Test
    void modify_mutatesQualifyingNodesInPlace() {
        Walker.modify(root, RecursionRules.full(), Criteria.isManifold(), node -> fnOf(node).effects().add("seen"));

        assertThat(fnOf(f).effects()).containsExactly("seen");
        assertThat(fnOf(g).effects()).containsExactly("seen");
        assertThat(fnOf(h).effects()).containsExactly("seen");
    }

    @Test
    void modifyInContext_passesContextToEveryMutation() {
        var context = Sequence.of(type);
        var contexts = new ArrayList<Sequence>();

        Walker.modifyInContext(root,
                               context,
                               RecursionRules.full(),
                               Criteria.isManifold(),
                               (node, ctx) -> contexts.add(ctx));

        assertEquals(3, contexts.size());
        assertThat(contexts).allSatisfy(ctx -> assertSame(context, ctx));
    }

    @Test
    void scopedModify_mutatesWithStateOfItsLevel() {
        ScopedRecursionRule<Integer> byDepth = (node, depth) -> RecursionRules.branches().children(node);

        Walker.scopedModify(root,
                            0,
                            byDepth,
                            Criteria.ignoringState(Criteria.isManifold()),
                            (node, depth) -> fnOf(node).effects().add("depth " + depth),
                            (into, depth) -> depth + 1);

        assertThat(fnOf(g).effects()).containsExactly("depth 1");
        assertThat(fnOf(h).effects()).containsExactly("depth 2");
    }

    @Test
    void mapScoped_runsModifierOncePerParameter() {
        var params = Sequence.of(label("p"), label("q"));
        var calls = new ArrayList<String>();

        Walker.mapScoped(root, params, (xs, p) -> calls.add(xs.size() + ":" + p));

        assertThat(calls).containsExactly("3:" + label("p"), "3:" + label("q"));
    }

    @Test
    void reduceModify_pairsEveryLeftWithEveryRight() {
        var other = new Node.TypeDecl(label("U"), list());
        var seq = Sequence.of(binding, composon, type, other);

        Walker.reduceModify(seq,
                            RecursionRules.most(),
                            Criteria.isManifold(),
                            Criteria.isType(),
                            (m, t) -> fnOf(m).effects().add(((Node.LabelNode) ((Node.Couplet) t).lhs()).label().name()));

        assertThat(fnOf(f).effects()).containsExactly("T", "U");
        assertThat(fnOf(g).effects()).containsExactly("T", "U");
        assertThat(fnOf(h).effects()).containsExactly("T", "U");
    }

    // === Pairings ===

    @Test
    void crossApply_visitsCartesianProduct() {
        var pairs = new ArrayList<String>();

        Walker.crossApply(Sequence.of(label("a"), label("b")),
                          Sequence.of(label("x"), label("y")),
                          (x, y) -> pairs.add(x + "," + y));

        assertEquals(4, pairs.size());
        assertEquals(label("a") + "," + label("x"), pairs.get(0));
        assertEquals(label("b") + "," + label("y"), pairs.get(3));
    }

    @Test
    void crossApply_ternary_visitsEveryTriple() {
        var count = new AtomicInteger();
        var two = Sequence.of(label("a"), label("b"));

        Walker.crossApply(two, two, two, (x, y, z) -> count.incrementAndGet());

        assertEquals(8, count.get());
    }

    @Test
    void crossApply_withEmptySide_doesNothing() {
        var count = new AtomicInteger();

        Walker.crossApply(root, Sequence.empty(), (x, y) -> count.incrementAndGet());

        assertEquals(0, count.get());
    }

    @Test
    void zipApply_pairsByIndex() throws MalformedTreeException {
        var pairs = new ArrayList<List<Node>>();

        Walker.zipApply(Sequence.of(g, h), Sequence.of(label("a"), label("b")), (x, y) -> pairs.add(List.of(x, y)));

        assertThat(pairs).containsExactly(List.of(g, label("a")), List.of(h, label("b")));
    }

    @Test
    void zipApply_withUnequalLengths_failsBeforeApplyingAnything() {
        var count = new AtomicInteger();

        var thrown = assertThrows(MalformedTreeException.class,
                                  () -> Walker.zipApply(Sequence.of(g, h),
                                                        Sequence.of(label("a")),
                                                        (x, y) -> count.incrementAndGet()));

        assertEquals(0, count.get());
        assertEquals(new CompositionError.LengthMismatch(2, 1), thrown.error());
    }

    @Test
    void zipApply_stateful_threadsStateInOrder() throws MalformedTreeException {
        var result = Walker.zipApply(Sequence.of(label("a"), label("b")),
                                     Sequence.of(label("x"), label("y")),
                                     "",
                                     (x, y, acc) -> acc + x + y + ";");

        assertEquals(label("a") + "" + label("x") + ";" + label("b") + label("y") + ";", result);
    }

    @Test
    void zipApply_stateful_withUnequalLengths_fails() {
        assertThrows(MalformedTreeException.class,
                     () -> Walker.zipApply(Sequence.empty(), Sequence.of(g), 0, (x, y, n) -> n + 1));
    }

    @Test
    void accumulate_visitsEachQualifyingNodeOnce() {
        var names = Walker.accumulate(root,
                                      new ArrayList<String>(),
                                      RecursionRules.full(),
                                      Criteria.isManifold(),
                                      (node, acc) -> {
                                          acc.add(fnOf(node).name());
                                          return acc;
                                      });

        assertThat(names).containsExactly("F", "G", "H");
    }

    @Test
    void accumulate_withNoMatches_returnsInitial() {
        int total = Walker.accumulate(root, 42, RecursionRules.full(), Criteria.isGroupRef(), (node, n) -> n + 1);

        assertEquals(42, total);
    }

    // === Filtered modifiers ===

    @Test
    void filterApply_single_appliesToFilteredNodes() {
        var visited = new ArrayList<Node>();

        Walker.filterApply(root, Walker::manifolds, visited::add);

        assertThat(visited).containsExactly(f, g, h);
    }

    @Test
    void filterApply_pair_appliesAcrossBothFilters() {
        var pairs = new AtomicInteger();

        Walker.filterApply(root,
                           Walker::manifolds,
                           seq -> Walker.filter(seq, RecursionRules.full(), Criteria.isType()),
                           (m, t) -> pairs.incrementAndGet());

        assertEquals(3, pairs.get());
    }

    @Test
    void filterApply_triple_appliesAcrossAllFilters() {
        var triples = new AtomicInteger();

        Walker.filterApply(root,
                           Walker::manifolds,
                           Walker::manifolds,
                           seq -> Walker.filter(seq, Criteria.isType()),
                           (x, y, z) -> triples.incrementAndGet());

        assertEquals(9, triples.get());
    }

    // === Maps ===

    @Test
    void mapSplit_concatenatesResultsInOrder() throws MalformedTreeException {
        var split = new Node.Binding(alternatives(label("a"), label("b")), g);
        var plain = bind("c", h);

        var result = Walker.mapSplit(Sequence.of(split, plain), Couplets::splitCouplet);

        assertThat(result.nodes()).containsExactly(bind("a", g), bind("b", g), plain);
    }

    @Test
    void mapSplit_propagatesFailure() {
        assertThrows(MalformedTreeException.class, () -> Walker.mapSplit(Sequence.of(g), Couplets::splitCouplet));
    }
}
