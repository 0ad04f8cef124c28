package org.pragmatica.composer.table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic textual dump of a table, for debugging and for diffing in tests.
 *
 * <p>Example output:
 * <pre>
 *  -------------------------------------------
 * PATH a
 *   PATH b
 *   . MANIFOLD c &lt;empty&gt;
 *  -------------------------------------------
 * </pre>
 */
public final class TableDump {
    private static final Logger LOG = LoggerFactory.getLogger(TableDump.class);

    static final String SEPARATOR = " " + "-".repeat(43) + " ";

    private TableDump() {}

    public static String render(Table table) {
        var sb = new StringBuilder();
        sb.append(SEPARATOR)
          .append("\n");
        renderLevel(table, 0, sb);
        sb.append(SEPARATOR)
          .append("\n");
        return sb.toString();
    }

    /**
     * Write the dump at debug level.
     */
    public static void log(Table table) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Table dump:\n{}", render(table));
        }
    }

    /**
     * One-line description of an entry, without indentation.
     */
    public static String describe(Entry entry) {
        var sb = new StringBuilder();
        sb.append(entry.type())
          .append(" ")
          .append(entry.id()
                       .map(Id::toString)
                       .orElse("*"));
        if (entry instanceof Entry.ManifoldEntry manifold) {
            sb.append(" ")
              .append(manifold.manifold()
                              .map(Object::toString)
                              .orElse("<empty>"));
        } else if (entry instanceof Entry.PositionalEntry positional) {
            sb.append(" \"")
              .append(positional.value())
              .append("\"");
        } else if (entry instanceof Entry.GroupRefEntry ref) {
            sb.append(" &")
              .append(ref.value());
            if (ref.isResolved()) {
                sb.append(" (resolved)");
            }
        }
        return sb.toString();
    }

    private static void renderLevel(Table table, int depth, StringBuilder sb) {
        for (var entry : table) {
            for (int i = 0; i < depth; i++) {
                sb.append(i % 2 == 0 ? "  " : ". ");
            }
            sb.append(describe(entry))
              .append("\n");
            if (entry instanceof Entry.Scope scope) {
                renderLevel(scope.table(), depth + 1, sb);
            }
        }
    }
}
