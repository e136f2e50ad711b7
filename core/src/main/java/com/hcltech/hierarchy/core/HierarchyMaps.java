package com.hcltech.hierarchy.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Read-only adjacency in both directions, insertion ordered.
 * {@code parentMap}: node -> direct children. {@code childMap}: node -> direct parents.
 */
public record HierarchyMaps<N>(Map<N, Set<N>> parentMap, Map<N, Set<N>> childMap) {

    public HierarchyMaps {
        parentMap = frozen(parentMap);
        childMap = frozen(childMap);
    }

    public static <N> HierarchyMaps<N> empty() {
        return new HierarchyMaps<>(Map.of(), Map.of());
    }

    public Set<N> childrenOf(N node) {
        return parentMap.getOrDefault(node, Set.of());
    }

    public Set<N> parentsOf(N node) {
        return childMap.getOrDefault(node, Set.of());
    }

    /** Nodes absent from the child map have no recorded parent. */
    public boolean hasParent(N node) {
        return childMap.containsKey(node);
    }

    private static <N> Map<N, Set<N>> frozen(Map<N, Set<N>> map) {
        Map<N, Set<N>> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        return Collections.unmodifiableMap(copy);
    }
}
