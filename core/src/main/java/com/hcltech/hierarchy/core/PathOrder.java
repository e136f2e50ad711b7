package com.hcltech.hierarchy.core;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Tree order over paths: element-wise by string form, a prefix before its extensions.
 * Gives stable row order for rendered tables.
 */
public final class PathOrder implements Comparator<List<?>> {
    public static final PathOrder INSTANCE = new PathOrder();

    private PathOrder() {}

    public static boolean isPrefix(List<?> prefix, List<?> full) {
        if (Objects.equals(prefix, full)) return true;
        if (prefix == null || full == null || prefix.isEmpty() || prefix.size() > full.size()) return false;
        for (int i = 0; i < prefix.size(); i++) {
            if (!Objects.equals(prefix.get(i), full.get(i))) return false;
        }
        return true;
    }

    @Override
    public int compare(List<?> a, List<?> b) {
        int common = Math.min(a.size(), b.size());
        for (int i = 0; i < common; i++) {
            int c = String.valueOf(a.get(i)).compareTo(String.valueOf(b.get(i)));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size()); // shorter (the prefix) first
    }
}
