package com.hcltech.hierarchy.db;

import com.hcltech.hierarchy.config.DestinationConfig;
import com.hcltech.hierarchy.config.HierarchyConfig;
import com.hcltech.hierarchy.config.IfExists;
import com.hcltech.hierarchy.config.SourceConfig;
import com.hcltech.hierarchy.core.Hierarchy;
import com.hcltech.hierarchy.core.TableOptions;
import com.hcltech.hierarchy.core.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Reads the configured edge table, flattens it and writes the result back. Closing the job closes its database.
 */
public class HierarchyJob implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HierarchyJob.class);

    private final HierarchyConfig config;
    private final HierarchyDb db;

    public HierarchyJob(HierarchyConfig config, HierarchyDb db) {
        this.config = Objects.requireNonNull(config, "config");
        this.db = Objects.requireNonNull(db, "db");
    }

    /** A hierarchy without a source when the edge table has no rows. */
    public Hierarchy<Object> loadHierarchy() {
        SourceConfig source = config.source();
        Table edges;
        try {
            edges = db.readData(source);
        } catch (RuntimeException e) {
            log.error("Failed to load edges from {}.{}", source.schema(), source.table(), e);
            throw e;
        }
        Hierarchy<Object> hierarchy;
        if (edges.isEmpty()) {
            log.warn("No edges found in {}.{}; the hierarchy has no source", source.schema(), source.table());
            hierarchy = Hierarchy.empty();
        } else {
            hierarchy = Hierarchy.fromTable(edges);
        }
        DestinationConfig destination = config.destination();
        hierarchy.setLevelLabel(destination.level());
        hierarchy.setPrimkeyLabel(destination.primkey());
        return hierarchy;
    }

    /** @return the number of rows written */
    public int write(Hierarchy<?> hierarchy, IfExists ifExists) {
        DestinationConfig destination = config.destination();
        try {
            Table table = hierarchy.toTable(new TableOptions(destination.emptyValue(), destination.level(),
                    destination.hasPrimkey(), destination.primkey()));
            db.writeData(table, destination, ifExists);
            log.info("Successfully wrote hierarchy to {}.{}: {} row(s), {} level(s)",
                    destination.schema(), destination.table(), table.rowCount(), hierarchy.maxDepth());
            return table.rowCount();
        } catch (RuntimeException e) {
            log.error("Failed to write hierarchy to {}.{}", destination.schema(), destination.table(), e);
            throw e;
        }
    }

    public int run() {
        return run(config.destination().ifExists());
    }

    public int run(IfExists ifExists) {
        return write(loadHierarchy(), ifExists);
    }

    @Override
    public void close() {
        db.close();
    }
}
