package com.hcltech.hierarchy.core;

import java.util.Collections;
import java.util.Comparator;
import java.util.Set;

/** Which parent the root search follows when a node has several. */
@FunctionalInterface
public interface ParentSelection<N> {

    /** @param parents non-empty, insertion ordered */
    N select(N node, Set<N> parents);

    /** The parent recorded first in the edge source. */
    static <N> ParentSelection<N> firstRecorded() {
        return (node, parents) -> parents.iterator().next();
    }

    static <N> ParentSelection<N> smallest(Comparator<? super N> order) {
        return (node, parents) -> Collections.min(parents, order);
    }

    static <N extends Comparable<? super N>> ParentSelection<N> natural() {
        return smallest(Comparator.naturalOrder());
    }
}
