package com.hcltech.hierarchy.core;

import java.util.Objects;

/** One direct (parent, child) relation. A self edge only registers the node as a parent. */
public record Edge<N>(N parent, N child) {
    public Edge {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(child, "child");
    }

    public static <N> Edge<N> of(N parent, N child) {
        return new Edge<>(parent, child);
    }

    public boolean isSelfEdge() {
        return parent.equals(child);
    }
}
