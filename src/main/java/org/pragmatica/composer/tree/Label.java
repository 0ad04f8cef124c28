package org.pragmatica.composer.tree;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Comparable name of a couplet's left-hand side, optionally tagged ({@code name:tag}).
 */
public record Label(String name, Optional<String> tag) {
    public Label {
        checkNotNull(name);
        checkArgument(!name.isEmpty(), "label name must not be empty");
        checkNotNull(tag);
    }

    public static Label of(String name) {
        return new Label(name, Optional.empty());
    }

    public static Label of(String name, String tag) {
        return new Label(name, Optional.of(tag));
    }

    /**
     * Names must be equal; tags are compared only when both labels carry one.
     */
    public boolean matches(Label other) {
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
