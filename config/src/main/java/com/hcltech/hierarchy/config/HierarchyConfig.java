package com.hcltech.hierarchy.config;

/**
 * The job configuration file:
 * - database:    where to connect
 * - source:      the parent/child edge table to read
 * - destination: where the flattened hierarchy is written
 */
public record HierarchyConfig(DatabaseConfig database, SourceConfig source, DestinationConfig destination) {

    public HierarchyConfig withDatabase(DatabaseConfig database) {
        return new HierarchyConfig(database, source, destination);
    }
}
