package com.hcltech.hierarchy.config;

import org.jetbrains.annotations.Nullable;

/**
 * Where and how the flattened hierarchy is written.
 *
 * @param level      prefix of the level column labels (LVL01, LVL02, ...)
 * @param primkey    label of the trailing primary-key column
 * @param emptyValue padding for levels below a path's end; null writes SQL NULL
 */
public record DestinationConfig(String schema,
                                String table,
                                String level,
                                String primkey,
                                Boolean hasPrimkey,
                                IfExists ifExists,
                                @Nullable Object emptyValue) {

    public static final String DEFAULT_LEVEL = "LVL";
    public static final String DEFAULT_PRIMKEY = "PK";

    public DestinationConfig {
        if (level == null || level.isBlank()) level = DEFAULT_LEVEL;
        if (primkey == null || primkey.isBlank()) primkey = DEFAULT_PRIMKEY;
        if (hasPrimkey == null) hasPrimkey = Boolean.TRUE;
        if (ifExists == null) ifExists = IfExists.FAIL;
    }

    public static DestinationConfig of(String schema, String table) {
        return new DestinationConfig(schema, table, null, null, null, null, null);
    }
}
