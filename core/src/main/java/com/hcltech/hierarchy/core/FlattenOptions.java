package com.hcltech.hierarchy.core;

import org.jetbrains.annotations.Nullable;

/**
 * @param flattened  false returns the raw variable-length paths
 * @param emptyValue padding for paths shorter than the longest one; may be null
 * @param hasPrimkey append the path's last node as an extra column
 */
public record FlattenOptions(boolean flattened, @Nullable Object emptyValue, boolean hasPrimkey) {

    public static final FlattenOptions DEFAULT = new FlattenOptions(true, null, true);

    public static FlattenOptions raw() {
        return new FlattenOptions(false, null, true);
    }

    public static FlattenOptions flattened(@Nullable Object emptyValue, boolean hasPrimkey) {
        return new FlattenOptions(true, emptyValue, hasPrimkey);
    }
}
