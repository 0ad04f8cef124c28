package org.pragmatica.composer.table;

/**
 * Type tag of a table entry.
 */
public enum EntryType {
    PATH(true),
    COMPOSON(true),
    NEST(true),
    DEREF(true),
    MANIFOLD(false),
    POSITIONAL(false),
    GROUP_REF(false);

    private final boolean recursive;

    EntryType(boolean recursive) {
        this.recursive = recursive;
    }

    /**
     * Recursive entries hold a nested table; all others hold a terminal payload.
     */
    public boolean isRecursive() {
        return recursive;
    }
}
