package com.hcltech.hierarchy.db;

import com.hcltech.hierarchy.config.DestinationConfig;
import com.hcltech.hierarchy.config.IfExists;
import com.hcltech.hierarchy.config.SourceConfig;
import com.hcltech.hierarchy.core.table.Table;

/**
 * Storage adapter: reads edge tables and writes flattened hierarchy tables.
 * Implementations that hold connections release them on {@link #close()}.
 */
public interface HierarchyDb extends AutoCloseable {

    /**
     * {@code SELECT parent, child FROM schema.table [WHERE where]}. The columns of the result are labelled
     * with the configured parent and child names. No rows gives an empty table.
     *
     * @throws HierarchyDbException when the query fails
     */
    Table readData(SourceConfig source);

    /**
     * Writes every row of {@code table} to the destination in one unit of work.
     *
     * @throws HierarchyDbException when the table exists and the policy is {@link IfExists#FAIL}, or the write fails
     */
    void writeData(Table table, DestinationConfig destination, IfExists ifExists);

    @Override
    default void close() {
    }
}
