package com.hcltech.hierarchy.core;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A cycle was met while walking the edge relation, so no root (or no finite path) exists.
 * {@link #cycle()} starts and ends with the repeated node.
 */
public class CyclicHierarchyException extends HierarchyException {
    private final List<Object> cycle;

    public CyclicHierarchyException(String direction, List<?> cycle) {
        super("Cycle detected " + direction + ": "
                + cycle.stream().map(String::valueOf).collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    public List<Object> cycle() {
        return cycle;
    }
}
