package org.pragmatica.composer.table;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Scope-qualified lookup key; the last segment is the base.
 */
public record Path(List<Id> segments) {
    public Path {
        segments = List.copyOf(segments);
        checkArgument(!segments.isEmpty(), "path must have at least one segment");
    }

    public static Path of(String... names) {
        return new Path(Arrays.stream(names)
                              .map(Id::of)
                              .toList());
    }

    public Id head() {
        return segments.get(0);
    }

    /**
     * Whether the current segment is the last one.
     */
    public boolean isBase() {
        return segments.size() == 1;
    }

    /**
     * The path below the current segment. Only valid when not at the base.
     */
    public Path rest() {
        checkArgument(!isBase(), "base segment has no rest");
        return new Path(segments.subList(1, segments.size()));
    }

    @Override
    public String toString() {
        return segments.stream()
                       .map(Id::toString)
                       .collect(Collectors.joining("."));
    }
}
