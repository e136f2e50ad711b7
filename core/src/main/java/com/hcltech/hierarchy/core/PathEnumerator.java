package com.hcltech.hierarchy.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Depth-first walk from a root that records the path to every node it visits, so every prefix of every
 * maximal path is part of the result. Uses an explicit stack: depth is bounded by heap, not by the call stack.
 */
public final class PathEnumerator<N> {
    private final HierarchyMaps<N> maps;

    public PathEnumerator(HierarchyMaps<N> maps) {
        this.maps = Objects.requireNonNull(maps, "maps");
    }

    private record Frame<N>(List<N> path, Iterator<N> children) {
        N last() {
            return path.get(path.size() - 1);
        }
    }

    public Set<List<N>> enumerateAll(Collection<N> roots) {
        Set<List<N>> paths = new LinkedHashSet<>();
        for (N root : roots) enumerateInto(root, paths);
        return paths;
    }

    public Set<List<N>> enumerate(N root) {
        Set<List<N>> paths = new LinkedHashSet<>();
        enumerateInto(root, paths);
        return paths;
    }

    /**
     * @throws CyclicHierarchyException if a node is reachable from itself on the current branch
     */
    public void enumerateInto(N root, Set<List<N>> sink) {
        Deque<Frame<N>> stack = new ArrayDeque<>();
        Set<N> onBranch = new HashSet<>();
        push(List.of(root), stack, onBranch, sink);

        while (!stack.isEmpty()) {
            Frame<N> top = stack.peek();
            if (!top.children().hasNext()) {
                stack.pop();
                onBranch.remove(top.last());
                continue;
            }
            N child = top.children().next();
            if (onBranch.contains(child)) {
                throw new CyclicHierarchyException("below root " + root, cycleEndingAt(top.path(), child));
            }
            push(extend(top.path(), child), stack, onBranch, sink);
        }
    }

    private void push(List<N> path, Deque<Frame<N>> stack, Set<N> onBranch, Set<List<N>> sink) {
        sink.add(path);
        Frame<N> frame = new Frame<>(path, maps.childrenOf(path.get(path.size() - 1)).iterator());
        onBranch.add(frame.last());
        stack.push(frame);
    }

    // each branch owns its copy; siblings never see each other's extensions
    private static <N> List<N> extend(List<N> path, N next) {
        List<N> copy = new ArrayList<>(path.size() + 1);
        copy.addAll(path);
        copy.add(next);
        return Collections.unmodifiableList(copy);
    }

    private static <N> List<N> cycleEndingAt(List<N> path, N repeated) {
        List<N> cycle = new ArrayList<>(path.subList(path.indexOf(repeated), path.size()));
        cycle.add(repeated);
        return cycle;
    }
}
