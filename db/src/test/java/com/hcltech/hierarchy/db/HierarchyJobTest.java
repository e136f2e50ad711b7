package com.hcltech.hierarchy.db;

import com.hcltech.hierarchy.config.DatabaseConfig;
import com.hcltech.hierarchy.config.DestinationConfig;
import com.hcltech.hierarchy.config.HierarchyConfig;
import com.hcltech.hierarchy.config.IfExists;
import com.hcltech.hierarchy.config.SourceConfig;
import com.hcltech.hierarchy.core.CyclicHierarchyException;
import com.hcltech.hierarchy.core.EmptyHierarchyException;
import com.hcltech.hierarchy.core.table.Table;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HierarchyJobTest {

    private static final SourceConfig SOURCE = new SourceConfig("HR", "ORG_EDGES", "BOSS", "EMPLOYEE", null);
    private static final DestinationConfig DESTINATION =
            new DestinationConfig("HR", "ORG_HIER", "L", "ID", true, IfExists.REPLACE, "-");
    private static final HierarchyConfig CONFIG = new HierarchyConfig(
            new DatabaseConfig("h2", "jdbc:h2:mem:unused", null, null, null, null), SOURCE, DESTINATION);

    private static Table edges(List<?>... rows) {
        return Table.of(List.of("BOSS", "EMPLOYEE"), List.of(rows));
    }

    @Test
    void run_writesTheFlattenedTableWithConfiguredLabels() {
        HierarchyDb db = mock(HierarchyDb.class);
        when(db.readData(SOURCE)).thenReturn(edges(List.of("CEO", "CTO"), List.of("CTO", "DEV"), List.of("CEO", "CFO")));

        int rows = new HierarchyJob(CONFIG, db).run();

        ArgumentCaptor<Table> written = ArgumentCaptor.forClass(Table.class);
        verify(db).writeData(written.capture(), eq(DESTINATION), eq(IfExists.REPLACE));
        assertEquals(4, rows);
        assertEquals(List.of("L01", "L02", "L03", "ID"), written.getValue().columns());
        assertEquals(List.of(
                row("CEO", "-", "-", "CEO"),
                row("CEO", "CFO", "-", "CFO"),
                row("CEO", "CTO", "-", "CTO"),
                row("CEO", "CTO", "DEV", "DEV")), written.getValue().rows());
    }

    @Test
    void run_withExplicitPolicy() {
        HierarchyDb db = mock(HierarchyDb.class);
        when(db.readData(SOURCE)).thenReturn(edges(List.of("A", "B")));

        new HierarchyJob(CONFIG, db).run(IfExists.APPEND);

        verify(db).writeData(any(Table.class), eq(DESTINATION), eq(IfExists.APPEND));
    }

    @Test
    void emptySource_givesAHierarchyWithoutSource_andNothingIsWritten() {
        HierarchyDb db = mock(HierarchyDb.class);
        when(db.readData(SOURCE)).thenReturn(Table.empty(List.of("BOSS", "EMPLOYEE")));
        var job = new HierarchyJob(CONFIG, db);

        var hierarchy = job.loadHierarchy();
        assertFalse(hierarchy.hasSource());
        assertEquals("L", hierarchy.levelLabel());

        assertThrows(EmptyHierarchyException.class, job::run);
        verify(db, never()).writeData(any(), any(), any());
    }

    @Test
    void readFailure_isRethrown() {
        HierarchyDb db = mock(HierarchyDb.class);
        when(db.readData(SOURCE)).thenThrow(new HierarchyDbException("connection refused"));

        var ex = assertThrows(HierarchyDbException.class, () -> new HierarchyJob(CONFIG, db).run());

        assertEquals("connection refused", ex.getMessage());
    }

    @Test
    void cyclicSource_failsBeforeWriting() {
        HierarchyDb db = mock(HierarchyDb.class);
        when(db.readData(SOURCE)).thenReturn(edges(List.of("R", "A"), List.of("A", "B"), List.of("B", "A")));

        assertThrows(CyclicHierarchyException.class, () -> new HierarchyJob(CONFIG, db).run());
        verify(db, never()).writeData(any(), any(), any());
    }

    @Test
    void close_closesTheDatabase() {
        HierarchyDb db = mock(HierarchyDb.class);

        new HierarchyJob(CONFIG, db).close();

        verify(db).close();
    }

    @Test
    void inMemoryRoundTrip() {
        var db = new InMemoryHierarchyDb().put("HR", "ORG_EDGES", edges(List.of(1, 2), List.of(2, 3)));
        var noPrimkey = new DestinationConfig("HR", "ORG_HIER", null, null, false, null, null);

        try (var job = new HierarchyJob(new HierarchyConfig(CONFIG.database(), SOURCE, noPrimkey), db)) {
            job.run();
        }

        var written = db.get("HR", "ORG_HIER").orElseThrow();
        assertEquals(List.of("LVL01", "LVL02", "LVL03"), written.columns());
        assertEquals(List.of(row(1L, null, null), row(1L, 2L, null), row(1L, 2L, 3L)), written.rows());
    }

    private static List<Object> row(Object... cells) {
        return Arrays.asList(cells);
    }
}
