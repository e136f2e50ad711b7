package com.hcltech.hierarchy.core;

import com.hcltech.hierarchy.core.table.Table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

public final class HierarchyTables {
    public static final String DEFAULT_LEVEL_LABEL = "LVL";
    public static final String DEFAULT_PRIMKEY_LABEL = "PK";

    private HierarchyTables() {}

    /** {@code LVL01..LVLnn}, plus the primary-key label when that column exists. */
    public static List<String> columnLabels(int maxLength, String levelLabel, boolean hasPrimkey, String primkeyLabel) {
        Objects.requireNonNull(levelLabel, "levelLabel");
        int digits = Math.max(2, String.valueOf(maxLength).length());
        List<String> labels = new ArrayList<>(maxLength + 1);
        for (int i = 1; i <= maxLength; i++) {
            labels.add(levelLabel + String.format("%0" + digits + "d", i));
        }
        if (hasPrimkey) {
            Objects.requireNonNull(primkeyLabel, "primkeyLabel");
            if (labels.contains(primkeyLabel)) {
                throw new IllegalArgumentException("Primary-key label '" + primkeyLabel
                        + "' collides with a level column generated from level label '" + levelLabel + "'");
            }
            labels.add(primkeyLabel);
        }
        return labels;
    }

    /**
     * Flattened rows in tree order with generated labels.
     *
     * @throws EmptyHierarchyException when there are no paths
     */
    public static Table render(Collection<? extends List<?>> paths,
                               Object emptyValue,
                               String levelLabel,
                               boolean hasPrimkey,
                               String primkeyLabel) {
        List<List<?>> ordered = new ArrayList<>(paths);
        ordered.sort(PathOrder.INSTANCE);
        int maxLength = RowFlattener.maxLength(ordered);
        List<List<Object>> rows = RowFlattener.flatten(ordered, emptyValue, hasPrimkey);
        return new Table(columnLabels(maxLength, levelLabel, hasPrimkey, primkeyLabel), rows);
    }
}
