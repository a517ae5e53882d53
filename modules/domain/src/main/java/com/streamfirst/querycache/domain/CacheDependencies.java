package com.streamfirst.querycache.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Constants and helpers for dependency tag sets.
 * A dependency tag is either a table name or the {@link #UNKNOWN_DEPENDENCY} sentinel.
 */
public final class CacheDependencies {

    /**
     * Tag for results whose tables could not be determined. Every mutating command also purges
     * this tag, so such results never outlive a write.
     */
    public static final String UNKNOWN_DEPENDENCY = "UnknownDependency";

    private CacheDependencies() {
    }

    /**
     * Returns a new mutable set holding only the sentinel tag.
     */
    public static SortedSet<String> unknown() {
        SortedSet<String> tags = new TreeSet<>();
        tags.add(UNKNOWN_DEPENDENCY);
        return tags;
    }

    /**
     * Copies the given tags into a new sorted set, dropping nulls and blank values.
     */
    public static SortedSet<String> sorted(Collection<String> tags) {
        SortedSet<String> result = new TreeSet<>();
        if (tags == null) {
            return result;
        }
        tags.stream()
            .filter(Objects::nonNull)
            .filter(tag -> !tag.isBlank())
            .forEach(result::add);
        return result;
    }

    /**
     * Read-only view of a sorted copy of the given tags.
     */
    public static SortedSet<String> immutable(Collection<String> tags) {
        return Collections.unmodifiableSortedSet(sorted(tags));
    }

    /**
     * Formats tags as a comma separated list for log output.
     */
    public static String format(Collection<String> tags) {
        return tags == null ? "" : String.join(", ", tags);
    }
}
