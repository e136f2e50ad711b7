package com.hcltech.hierarchy.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public final class RootFinder<N> {
    private final HierarchyMaps<N> maps;
    private final ParentSelection<N> selection;

    public RootFinder(HierarchyMaps<N> maps, ParentSelection<N> selection) {
        this.maps = Objects.requireNonNull(maps, "maps");
        this.selection = Objects.requireNonNull(selection, "selection");
    }

    /** Climbs parent links until a node without a parent is reached. */
    public N findRoot(N node) {
        Set<N> climbed = new LinkedHashSet<>();
        N current = node;
        while (maps.hasParent(current)) {
            if (!climbed.add(current)) {
                throw new CyclicHierarchyException("while searching for the root of " + node,
                        cycleEndingAt(climbed, current));
            }
            current = selection.select(current, maps.parentsOf(current));
        }
        return current;
    }

    /** Distinct roots over every node that has children (or a self edge), in discovery order. */
    public Set<N> findRoots() {
        Set<N> roots = new LinkedHashSet<>();
        for (N parent : maps.parentMap().keySet()) {
            roots.add(findRoot(parent));
        }
        return roots;
    }

    private static <N> List<N> cycleEndingAt(Set<N> climbed, N repeated) {
        List<N> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (N n : climbed) {
            if (n.equals(repeated)) inCycle = true;
            if (inCycle) cycle.add(n);
        }
        cycle.add(repeated);
        return cycle;
    }
}
