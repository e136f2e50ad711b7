package com.hcltech.hierarchy.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns variable-length paths into rows of equal width: the path, right-padded with {@code emptyValue} to the
 * longest path length, then (optionally) the path's last node again as a primary-key column.
 */
public final class RowFlattener {
    private RowFlattener() {}

    /** @throws EmptyHierarchyException when there are no paths */
    public static int maxLength(Collection<? extends List<?>> paths) {
        if (paths.isEmpty()) throw new EmptyHierarchyException();
        int max = 0;
        for (List<?> p : paths) max = Math.max(max, p.size());
        return max;
    }

    /** Rows in the iteration order of {@code paths}. */
    public static List<List<Object>> flatten(Collection<? extends List<?>> paths, Object emptyValue, boolean hasPrimkey) {
        int width = maxLength(paths);
        List<List<Object>> rows = new ArrayList<>(paths.size());
        for (List<?> path : paths) rows.add(flattenPath(path, width, emptyValue, hasPrimkey));
        return rows;
    }

    public static Set<List<Object>> flattenToSet(Collection<? extends List<?>> paths, Object emptyValue, boolean hasPrimkey) {
        return new LinkedHashSet<>(flatten(paths, emptyValue, hasPrimkey));
    }

    static List<Object> flattenPath(List<?> path, int width, Object emptyValue, boolean hasPrimkey) {
        if (path.isEmpty()) throw new IllegalArgumentException("Paths must contain at least one node");
        Object[] row = new Object[width + (hasPrimkey ? 1 : 0)];
        int i = 0;
        for (Object node : path) row[i++] = node;
        Arrays.fill(row, i, width, emptyValue);
        if (hasPrimkey) row[width] = path.get(path.size() - 1);
        // Arrays.asList tolerates a null padding value, List.of would not
        return Collections.unmodifiableList(Arrays.asList(row));
    }
}
