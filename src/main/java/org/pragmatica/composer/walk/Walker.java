package org.pragmatica.composer.walk;

import org.pragmatica.composer.error.CompositionError;
import org.pragmatica.composer.error.MalformedTreeException;
import org.pragmatica.composer.tree.Node;
import org.pragmatica.composer.tree.Sequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Generic traversal combinators over node sequences.
 *
 * <p>Every combinator walks depth-first, left to right, and completes before returning.
 * Filters return new sequences holding references to the visited nodes; modifiers apply
 * their function to the caller's tree in place. Child sequences are chosen by a
 * {@link RecursionRule} (or {@link ScopedRecursionRule}), so the same combinator serves
 * flat, structural and scope-aware passes.
 *
 * <p>Example - wire every manifold to every type declaration:
 * <pre>{@code
 * Walker.reduceModify(root,
 *                     RecursionRules.most(),
 *                     Criteria.isManifold(),
 *                     Criteria.isType(),
 *                     (manifold, type) -> attach(manifold, type));
 * }</pre>
 */
public final class Walker {
    private static final Logger LOG = LoggerFactory.getLogger(Walker.class);

    private Walker() {}

    // === Filters ===

    /**
     * Collect every node satisfying {@code keep}, descending wherever {@code recurse} allows.
     * A node precedes its descendants in the result.
     */
    public static Sequence filter(Sequence seq, RecursionRule recurse, Predicate<Node> keep) {
        var result = Sequence.empty();
        collect(seq, recurse, keep, result);
        return result;
    }

    /**
     * Non-recursive filter.
     */
    public static Sequence filter(Sequence seq, Predicate<Node> keep) {
        return filter(seq, RecursionRules.none(), keep);
    }

    /**
     * Linearize a tree into its pre-order node sequence.
     */
    public static Sequence flatten(Sequence seq, RecursionRule recurse) {
        return filter(seq, recurse, Criteria.all());
    }

    /**
     * Non-recursive filter whose criterion also sees {@code state}.
     */
    public static <S> Sequence filterWith(Sequence seq, S state, BiPredicate<Node, S> keep) {
        var result = Sequence.empty();
        for (var node : seq) {
            if (keep.test(node, state)) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Scoped recursive filter. The state is transformed by {@code next} before each descent,
     * so siblings see the same state and children see the advanced one.
     */
    public static <S> Sequence scopedFilter(Sequence seq,
                                            S state,
                                            ScopedRecursionRule<S> recurse,
                                            BiPredicate<Node, S> keep,
                                            NextValue<S> next) {
        var result = Sequence.empty();
        collectScoped(seq, state, recurse, keep, next, result);
        return result;
    }

    /**
     * All manifolds, bare or bound to a name, without visiting the names they are bound to.
     */
    public static Sequence manifolds(Sequence seq) {
        return filter(seq, RecursionRules.most(), Criteria.isManifold());
    }

    /**
     * Top-level qualified paths.
     */
    public static Sequence qualifiedPaths(Sequence seq) {
        return filter(seq, Criteria.isQualifiedPath());
    }

    // === Modifiers ===

    /**
     * Apply {@code mutate} to every node of {@code seq}, without descending.
     */
    public static void apply(Sequence seq, Consumer<Node> mutate) {
        for (int i = 0; i < seq.size(); i++) {
            mutate.accept(seq.get(i));
        }
    }

    /**
     * Recursive conditional modify: apply {@code mutate} to every node satisfying {@code keep}.
     */
    public static void modify(Sequence seq, RecursionRule recurse, Predicate<Node> keep, Consumer<Node> mutate) {
        for (int i = 0; i < seq.size(); i++) {
            var node = seq.get(i);
            if (keep.test(node)) {
                mutate.accept(node);
            }
            for (var child : recurse.children(node)) {
                modify(child, recurse, keep, mutate);
            }
        }
    }

    /**
     * Like {@link #modify(Sequence, RecursionRule, Predicate, Consumer)}, but every mutation
     * also receives {@code context} (a symbol table, for instance).
     */
    public static void modifyInContext(Sequence seq,
                                       Sequence context,
                                       RecursionRule recurse,
                                       Predicate<Node> keep,
                                       BiConsumer<Node, Sequence> mutate) {
        modify(seq, recurse, keep, node -> mutate.accept(node, context));
    }

    /**
     * Scoped recursive modify: the traversal of {@link #scopedFilter}, applying {@code mutate}
     * to qualifying nodes instead of collecting them.
     */
    public static <S> void scopedModify(Sequence seq,
                                        S state,
                                        ScopedRecursionRule<S> recurse,
                                        BiPredicate<Node, S> keep,
                                        BiConsumer<Node, S> mutate,
                                        NextValue<S> next) {
        for (int i = 0; i < seq.size(); i++) {
            var node = seq.get(i);
            if (keep.test(node, state)) {
                mutate.accept(node, state);
            }
            var children = recurse.children(node, state);
            if (!children.isEmpty()) {
                var nextState = next.next(node, state);
                for (var child : children) {
                    scopedModify(child, nextState, recurse, keep, mutate, next);
                }
            }
        }
    }

    /**
     * Run a scoped modifier once per parameter: {@code pmod(xs, p)} for each {@code p} in {@code ps}.
     */
    public static void mapScoped(Sequence xs, Sequence ps, BiConsumer<Sequence, Node> pmod) {
        for (var p : ps) {
            pmod.accept(xs, p);
        }
    }

    /**
     * Flatten once under {@code recurse}, then apply {@code mutate} to every pair drawn from
     * the nodes satisfying {@code leftKeep} and the nodes satisfying {@code rightKeep}.
     */
    public static void reduceModify(Sequence seq,
                                    RecursionRule recurse,
                                    Predicate<Node> leftKeep,
                                    Predicate<Node> rightKeep,
                                    BiConsumer<Node, Node> mutate) {
        var flat = flatten(seq, recurse);
        var left = filter(flat, leftKeep);
        var right = filter(flat, rightKeep);
        LOG.debug("Reducing {} left nodes against {} right nodes", left.size(), right.size());
        crossApply(left, right, mutate);
    }

    // === Pairings ===

    /**
     * Apply {@code mutate} to every ordered pair, one node from each sequence.
     */
    public static void crossApply(Sequence xs, Sequence ys, BiConsumer<Node, Node> mutate) {
        for (var x : xs) {
            for (var y : ys) {
                mutate.accept(x, y);
            }
        }
    }

    /**
     * Apply {@code mutate} to every triple, one node from each sequence.
     */
    public static void crossApply(Sequence xs, Sequence ys, Sequence zs, TriConsumer<Node, Node, Node> mutate) {
        for (var x : xs) {
            for (var y : ys) {
                for (var z : zs) {
                    mutate.accept(x, y, z);
                }
            }
        }
    }

    /**
     * Apply {@code mutate(xs[i], ys[i])} for every index.
     *
     * @throws MalformedTreeException if the sequences differ in length; nothing is applied then
     */
    public static void zipApply(Sequence xs, Sequence ys, BiConsumer<Node, Node> mutate) throws MalformedTreeException {
        requireSameLength(xs, ys);
        for (int i = 0; i < xs.size(); i++) {
            mutate.accept(xs.get(i), ys.get(i));
        }
    }

    /**
     * Stateful zip: thread {@code initial} through every pair in order and return the final state.
     *
     * @throws MalformedTreeException if the sequences differ in length; nothing is applied then
     */
    public static <S> S zipApply(Sequence xs, Sequence ys, S initial, ZipStep<S> step) throws MalformedTreeException {
        requireSameLength(xs, ys);
        var state = initial;
        for (int i = 0; i < xs.size(); i++) {
            state = step.apply(xs.get(i), ys.get(i), state);
        }
        return state;
    }

    /**
     * Stateful recursive apply: thread {@code initial} through every qualifying node exactly
     * once, in traversal order, and return the final state.
     */
    public static <S> S accumulate(Sequence seq,
                                   S initial,
                                   RecursionRule recurse,
                                   Predicate<Node> keep,
                                   BiFunction<Node, S, S> step) {
        var state = initial;
        for (int i = 0; i < seq.size(); i++) {
            var node = seq.get(i);
            if (keep.test(node)) {
                state = step.apply(node, state);
            }
            for (var child : recurse.children(node)) {
                state = accumulate(child, state, recurse, keep, step);
            }
        }
        return state;
    }

    // === Filtered modifiers ===

    public static void filterApply(Sequence top, Function<Sequence, Sequence> xfilter, Consumer<Node> mutate) {
        apply(xfilter.apply(top), mutate);
    }

    /**
     * Filter {@code top} by each filter independently, then apply {@code mutate} across the product.
     */
    public static void filterApply(Sequence top,
                                   Function<Sequence, Sequence> xfilter,
                                   Function<Sequence, Sequence> yfilter,
                                   BiConsumer<Node, Node> mutate) {
        crossApply(xfilter.apply(top), yfilter.apply(top), mutate);
    }

    public static void filterApply(Sequence top,
                                   Function<Sequence, Sequence> xfilter,
                                   Function<Sequence, Sequence> yfilter,
                                   Function<Sequence, Sequence> zfilter,
                                   TriConsumer<Node, Node, Node> mutate) {
        crossApply(xfilter.apply(top), yfilter.apply(top), zfilter.apply(top), mutate);
    }

    // === Maps ===

    /**
     * Apply a one-to-many transform to every node and concatenate the results in order.
     * The result is flat: {@code [a] -> (a -> [b]) -> [b]}.
     */
    public static Sequence mapSplit(Sequence seq, Split split) throws MalformedTreeException {
        var result = Sequence.empty();
        for (var node : seq) {
            result.concat(split.apply(node));
        }
        return result;
    }

    private static void collect(Sequence seq, RecursionRule recurse, Predicate<Node> keep, Sequence result) {
        for (var node : seq) {
            if (keep.test(node)) {
                result.add(node);
            }
            for (var child : recurse.children(node)) {
                collect(child, recurse, keep, result);
            }
        }
    }

    private static <S> void collectScoped(Sequence seq,
                                          S state,
                                          ScopedRecursionRule<S> recurse,
                                          BiPredicate<Node, S> keep,
                                          NextValue<S> next,
                                          Sequence result) {
        for (var node : seq) {
            if (keep.test(node, state)) {
                result.add(node);
            }
            var children = recurse.children(node, state);
            if (!children.isEmpty()) {
                var nextState = next.next(node, state);
                for (var child : children) {
                    collectScoped(child, nextState, recurse, keep, next, result);
                }
            }
        }
    }

    private static void requireSameLength(Sequence xs, Sequence ys) throws MalformedTreeException {
        if (xs.size() != ys.size()) {
            throw new MalformedTreeException(new CompositionError.LengthMismatch(xs.size(), ys.size()));
        }
    }
}
