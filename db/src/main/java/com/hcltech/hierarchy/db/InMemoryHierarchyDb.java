package com.hcltech.hierarchy.db;

import com.hcltech.hierarchy.config.DestinationConfig;
import com.hcltech.hierarchy.config.IfExists;
import com.hcltech.hierarchy.config.SourceConfig;
import com.hcltech.hierarchy.core.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link HierarchyDb} over a map of qualified table name to {@link Table}. Used in tests and for small
 * hierarchies that never touch a database. WHERE clauses are not supported.
 */
public class InMemoryHierarchyDb implements HierarchyDb {
    private static final Logger log = LoggerFactory.getLogger(InMemoryHierarchyDb.class);

    private final Map<String, Table> tables = new LinkedHashMap<>();

    public InMemoryHierarchyDb put(String schema, String table, Table data) {
        tables.put(SqlIdentifiers.qualified(schema, table), data);
        return this;
    }

    public Optional<Table> get(String schema, String table) {
        return Optional.ofNullable(tables.get(SqlIdentifiers.qualified(schema, table)));
    }

    @Override
    public Table readData(SourceConfig source) {
        String qualified = SqlIdentifiers.qualified(source.schema(), source.table());
        if (source.where() != null && !source.where().isBlank()) {
            throw new HierarchyDbException("WHERE clauses are not supported in memory: " + source.where());
        }
        Table data = tables.get(qualified);
        if (data == null) throw new HierarchyDbException("Table " + qualified + " does not exist");
        List<Object> parents;
        List<Object> children;
        try {
            parents = data.column(source.parent());
            children = data.column(source.child());
        } catch (IllegalArgumentException e) {
            throw new HierarchyDbException("Failed to read edges from " + qualified + ": " + e.getMessage(), e);
        }
        List<List<Object>> rows = new ArrayList<>(parents.size());
        for (int i = 0; i < parents.size(); i++) rows.add(Arrays.asList(parents.get(i), children.get(i)));
        log.info("Read {} edge(s) from {}", rows.size(), qualified);
        return new Table(List.of(source.parent(), source.child()), rows);
    }

    @Override
    public void writeData(Table table, DestinationConfig destination, IfExists ifExists) {
        String qualified = SqlIdentifiers.qualified(destination.schema(), destination.table());
        Table existing = tables.get(qualified);
        Table result = table;
        if (existing != null) {
            switch (ifExists) {
                case FAIL -> throw new HierarchyDbException("Table " + qualified + " already exists");
                case REPLACE -> result = table;
                case APPEND -> result = append(qualified, existing, table);
            }
        }
        tables.put(qualified, result);
        log.info("Wrote {} row(s) to {} ({})", table.rowCount(), qualified, ifExists);
    }

    private static Table append(String qualified, Table existing, Table more) {
        if (!existing.columns().equals(more.columns())) {
            throw new HierarchyDbException("Cannot append to " + qualified + ": columns " + more.columns()
                    + " do not match " + existing.columns());
        }
        List<List<Object>> rows = new ArrayList<>(existing.rows());
        rows.addAll(more.rows());
        return new Table(existing.columns(), rows);
    }
}
