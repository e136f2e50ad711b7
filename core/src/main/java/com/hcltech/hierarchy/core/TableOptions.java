package com.hcltech.hierarchy.core;

import org.jetbrains.annotations.Nullable;

/** Null labels fall back to the owning {@link Hierarchy}'s level and primary-key labels. */
public record TableOptions(@Nullable Object emptyValue,
                           @Nullable String levelLabel,
                           boolean hasPrimkey,
                           @Nullable String primkeyLabel) {

    public static final TableOptions DEFAULT = new TableOptions(null, null, true, null);

    public TableOptions withEmptyValue(@Nullable Object value) {
        return new TableOptions(value, levelLabel, hasPrimkey, primkeyLabel);
    }

    public TableOptions withLabels(@Nullable String level, @Nullable String primkey) {
        return new TableOptions(emptyValue, level, hasPrimkey, primkey);
    }

    public TableOptions withPrimkey(boolean primkey) {
        return new TableOptions(emptyValue, levelLabel, primkey, primkeyLabel);
    }
}
