package org.pragmatica.composer.table;

import java.util.List;

/**
 * Ordered set of paths queried together.
 */
public record Selection(List<Path> paths) {
    public Selection {
        paths = List.copyOf(paths);
    }

    public static Selection of(Path... paths) {
        return new Selection(List.of(paths));
    }
}
