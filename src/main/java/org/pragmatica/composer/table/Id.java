package org.pragmatica.composer.table;

import org.pragmatica.composer.tree.Label;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Identifier of a table entry or path segment.
 */
public record Id(String name, Optional<String> tag) {
    public Id {
        checkNotNull(name);
        checkArgument(!name.isEmpty(), "id name must not be empty");
        checkNotNull(tag);
    }

    public static Id of(String name) {
        return new Id(name, Optional.empty());
    }

    public static Id of(String name, String tag) {
        return new Id(name, Optional.of(tag));
    }

    public static Id of(Label label) {
        return new Id(label.name(), label.tag());
    }

    /**
     * Same rule as {@link Label#matches(Label)}: tags only count when both sides carry one.
     */
    public boolean matches(Id other) {
        if (other == null || !name.equals(other.name)) {
            return false;
        }
        return tag.isEmpty() || other.tag.isEmpty() || tag.equals(other.tag);
    }

    @Override
    public String toString() {
        return tag.map(t -> name + ":" + t)
                  .orElse(name);
    }
}
