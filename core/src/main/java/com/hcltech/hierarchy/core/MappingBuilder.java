package com.hcltech.hierarchy.core;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class MappingBuilder {
    private MappingBuilder() {}

    /** Fresh maps on every call; nothing is merged with earlier builds. */
    public static <N> HierarchyMaps<N> build(List<Edge<N>> edges) {
        Map<N, Set<N>> parentMap = new LinkedHashMap<>();
        Map<N, Set<N>> childMap = new LinkedHashMap<>();
        for (Edge<N> e : edges) {
            Set<N> children = parentMap.computeIfAbsent(e.parent(), k -> new LinkedHashSet<>());
            if (e.isSelfEdge()) continue; // registers the node, no self-loop
            children.add(e.child());
            childMap.computeIfAbsent(e.child(), k -> new LinkedHashSet<>()).add(e.parent());
        }
        return new HierarchyMaps<>(parentMap, childMap);
    }
}
