package com.hcltech.hierarchy.db;

import com.hcltech.hierarchy.config.DestinationConfig;
import com.hcltech.hierarchy.config.IfExists;
import com.hcltech.hierarchy.config.SourceConfig;
import com.hcltech.hierarchy.core.table.Table;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryHierarchyDbTest {

    private static final SourceConfig EDGES = new SourceConfig("S", "EDGES", "PARENT", "CHILD", null);
    private static final DestinationConfig HIER = DestinationConfig.of("S", "HIER");

    private final InMemoryHierarchyDb db = new InMemoryHierarchyDb()
            .put("S", "EDGES", Table.of(List.of("ID", "CHILD", "PARENT"),
                    List.of(List.of(1, "B", "A"), List.of(2, "C", "B"))));

    @Test
    void readData_picksTheConfiguredColumns() {
        var table = db.readData(EDGES);

        assertEquals(List.of("PARENT", "CHILD"), table.columns());
        assertEquals(List.of(List.of("A", "B"), List.of("B", "C")), table.rows());
    }

    @Test
    void readData_unknownTableOrColumn() {
        assertThrows(HierarchyDbException.class, () -> db.readData(new SourceConfig("S", "NOPE", "PARENT", "CHILD", null)));
        assertThrows(HierarchyDbException.class, () -> db.readData(new SourceConfig("S", "EDGES", "UP", "CHILD", null)));
    }

    @Test
    void readData_whereIsNotSupported() {
        assertThrows(HierarchyDbException.class, () -> db.readData(new SourceConfig("S", "EDGES", "PARENT", "CHILD", "ID = 1")));
    }

    @Test
    void writeData_policies() {
        var first = Table.of(List.of("LVL01", "PK"), List.of(List.of("A", "A")));
        var second = Table.of(List.of("LVL01", "PK"), List.of(List.of("B", "B")));

        db.writeData(first, HIER, IfExists.FAIL);
        assertThrows(HierarchyDbException.class, () -> db.writeData(second, HIER, IfExists.FAIL));

        db.writeData(second, HIER, IfExists.APPEND);
        assertEquals(2, db.get("S", "HIER").orElseThrow().rowCount());

        db.writeData(second, HIER, IfExists.REPLACE);
        assertEquals(second, db.get("S", "HIER").orElseThrow());
    }

    @Test
    void writeData_appendRequiresSameColumns() {
        db.writeData(Table.of(List.of("LVL01", "PK"), List.of(List.of("A", "A"))), HIER, IfExists.FAIL);

        assertThrows(HierarchyDbException.class,
                () -> db.writeData(Table.of(List.of("LVL01"), List.of(List.of("A"))), HIER, IfExists.APPEND));
    }
}
