package com.hcltech.hierarchy.config;

import org.jetbrains.annotations.Nullable;

/**
 * The edge table: one row per parent/child relation.
 *
 * @param where optional SQL condition restricting the rows read
 */
public record SourceConfig(String schema, String table, String parent, String child, @Nullable String where) {
}
