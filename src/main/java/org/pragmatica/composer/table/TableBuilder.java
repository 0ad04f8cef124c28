package org.pragmatica.composer.table;

import org.pragmatica.composer.error.CompositionError;
import org.pragmatica.composer.error.Diagnostic;
import org.pragmatica.composer.error.Diagnostics;
import org.pragmatica.composer.error.MalformedTreeException;
import org.pragmatica.composer.tree.Node;
import org.pragmatica.composer.tree.Sequence;
import org.pragmatica.composer.walk.Couplets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts a node tree into a symbol table.
 *
 * <ul>
 *   <li>composons, nests and derefs become anonymous scopes;</li>
 *   <li>list wrappers are transparent;</li>
 *   <li>a qualified path {@code a.b => body} becomes nested {@code PATH} scopes around its body;</li>
 *   <li>a binding becomes an entry of its body's type, named by its left-hand side;
 *       alternatives are split first and dotted names wrap the entry in {@code PATH} scopes;</li>
 *   <li>bare manifolds, positionals and group references become anonymous terminals.</li>
 * </ul>
 * Type declarations, names and labels carry nothing for the table and are skipped.
 */
public final class TableBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(TableBuilder.class);

    private final Diagnostics diagnostics;

    private TableBuilder(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public static Table build(Sequence seq, Diagnostics diagnostics) throws MalformedTreeException {
        var table = new TableBuilder(diagnostics).table(seq);
        LOG.debug("Built table with {} top-level entries", table.size());
        return table;
    }

    private Table table(Sequence seq) throws MalformedTreeException {
        var table = Table.empty();
        for (var node : seq) {
            table = Table.join(table, entries(node));
        }
        return table;
    }

    private Table entries(Node node) throws MalformedTreeException {
        return switch (node.kind()) {
            case LIST -> table(((Node.Branch) node).children());
            case COMPOSON, NEST, DEREF -> Table.of(scope(Optional.empty(), EntryType.valueOf(node.kind().name()), node));
            case QUALIFIED_PATH -> {
                var path = (Node.QualifiedPath) node;
                yield wrap(segments(path.lhs()), entries(path.rhs()));
            }
            case BINDING -> binding((Node.Binding) node);
            case MANIFOLD, POSITIONAL, GROUP_REF -> Table.of(terminal(Optional.empty(), node));
            default -> skip(node, "no table counterpart");
        };
    }

    private Table binding(Node.Binding binding) throws MalformedTreeException {
        var result = Table.empty();
        for (var single : Couplets.splitCouplet(binding)) {
            var couplet = (Node.Couplet) single;
            var ids = segments(couplet.lhs());
            var base = ids.get(ids.size() - 1);
            result = Table.join(result, wrap(ids.subList(0, ids.size() - 1), named(base, couplet.rhs())));
        }
        return result;
    }

    private Table named(Id id, Node body) throws MalformedTreeException {
        var name = Optional.of(id);
        return switch (body.kind()) {
            case MANIFOLD, POSITIONAL, GROUP_REF -> Table.of(terminal(name, body));
            case COMPOSON, NEST, DEREF -> Table.of(scope(name, EntryType.valueOf(body.kind().name()), body));
            case LIST -> Table.of(scope(name, EntryType.PATH, body));
            default -> skip(body, "binding '" + id + "' has no table counterpart");
        };
    }

    private Entry scope(Optional<Id> id, EntryType type, Node body) throws MalformedTreeException {
        return Entry.scope(id, type, table(((Node.Branch) body).children()));
    }

    private static Entry terminal(Optional<Id> id, Node leaf) throws MalformedTreeException {
        Object payload = null;
        if (leaf instanceof Node.ManifoldNode manifold) {
            payload = manifold.manifold();
        } else if (leaf instanceof Node.Positional positional) {
            payload = positional.value();
        } else if (leaf instanceof Node.GroupRef ref) {
            payload = ref.value();
        }
        return Entry.terminal(id, EntryType.valueOf(leaf.kind().name()), payload);
    }

    /**
     * Wrap {@code body} in one {@code PATH} scope per id, the first id outermost.
     */
    private static Table wrap(List<Id> ids, Table body) throws MalformedTreeException {
        var table = body;
        for (int i = ids.size() - 1; i >= 0; i--) {
            table = Table.of(Entry.scope(Optional.of(ids.get(i)), EntryType.PATH, table));
        }
        return table;
    }

    private static List<Id> segments(Node lhs) throws MalformedTreeException {
        var ids = new ArrayList<Id>();
        if (lhs instanceof Node.QualifiedName qualified) {
            for (var segment : qualified.children()) {
                ids.add(segmentId(segment));
            }
        } else {
            ids.add(segmentId(lhs));
        }
        if (ids.isEmpty()) {
            throw new MalformedTreeException(new CompositionError.InvalidLeftHandSide(lhs.kind()));
        }
        return ids;
    }

    private static Id segmentId(Node segment) throws MalformedTreeException {
        if (segment instanceof Node.LabelNode label) {
            return Id.of(label.label());
        }
        if (segment instanceof Node.Name name) {
            return Id.of(name.value());
        }
        throw new MalformedTreeException(new CompositionError.InvalidLeftHandSide(segment.kind()));
    }

    private Table skip(Node node, String reason) {
        diagnostics.report(Diagnostic.info(Diagnostic.SKIPPED_NODE,
                                           "skipped " + node.kind() + ": " + reason,
                                           "table conversion"));
        return Table.empty();
    }
}
