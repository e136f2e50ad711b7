package com.hcltech.hierarchy.core;

import com.hcltech.hierarchy.core.table.Table;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static com.hcltech.hierarchy.core.HierarchyFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class EdgeSourcesTest {

    @Test
    void pairs_becomeEdgesInOrder() {
        var edges = EdgeSources.fromPairs(List.of(List.of("A", "B"), List.of("B", "C")));

        assertEquals(edges("A>B", "B>C"), edges);
    }

    @Test
    void pairOfWrongSize_namesTheIndex() {
        var ex = assertThrows(InvalidSourceShapeException.class,
                () -> EdgeSources.fromPairs(List.of(List.of("A", "B"), List.of("A", "B", "C"))));

        assertTrue(ex.getMessage().contains("index 1"), ex.getMessage());
    }

    @Test
    void nullPairOrNullIdentifier_isRejected() {
        assertThrows(InvalidSourceShapeException.class,
                () -> EdgeSources.fromPairs(Arrays.asList(List.of("A", "B"), null)));
        assertThrows(InvalidSourceShapeException.class,
                () -> EdgeSources.fromPairs(List.of(Arrays.asList("A", null))));
        assertThrows(InvalidSourceShapeException.class,
                () -> EdgeSources.fromPairs((List<List<String>>) null));
    }

    @Test
    void arrays_areAccepted() {
        var edges = EdgeSources.fromPairs(new Object[][]{{"A", "B"}, {1, 2}});

        assertEquals(List.of(Edge.of("A", "B"), Edge.of(1L, 2L)), edges);
        assertThrows(InvalidSourceShapeException.class, () -> EdgeSources.fromPairs(new Object[][]{{"A"}}));
    }

    @Test
    void edges_nullEntryIsRejected() {
        assertThrows(InvalidSourceShapeException.class, () -> EdgeSources.fromEdges(Arrays.asList(Edge.of("A", "B"), null)));
    }

    @Test
    void twoColumnTable_isAccepted() {
        var table = Table.of(List.of("P", "C"), List.of(List.of("A", "B"), List.of("A", "A")));

        assertEquals(List.of(Edge.of("A", "B"), Edge.of("A", "A")), EdgeSources.fromTable(table, String.class));
    }

    @Test
    void tableWithOtherColumnCount_isRejected() {
        var table = Table.of(List.of("P", "C", "W"), List.of(List.of("A", "B", 1)));

        var ex = assertThrows(InvalidSourceShapeException.class, () -> EdgeSources.fromTable(table));
        assertTrue(ex.getMessage().contains("exactly two columns"), ex.getMessage());
    }

    @Test
    void tableCellOfWrongType_isRejected() {
        var table = Table.of(List.of("P", "C"), List.of(List.of("A", 1)));

        assertThrows(InvalidSourceShapeException.class, () -> EdgeSources.fromTable(table, String.class));
    }

    @Test
    void csvResource_buildsTheOrgChart() throws Exception {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("edges/org_chart.csv")) {
            var h = Hierarchy.of(EdgeSources.fromCsv(in, ',', true));

            assertEquals(set(
                    path("CEO"),
                    path("CEO", "CTO"),
                    path("CEO", "CTO", "Dev, Platform"),
                    path("CEO", "CTO", "QA"),
                    path("CEO", "CFO")), h.paths());
        }
    }

    @Test
    void csvWithThreeColumns_isRejected() throws Exception {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("edges/three_columns.csv")) {
            assertThrows(InvalidSourceShapeException.class, () -> EdgeSources.fromCsv(in, ';', true));
        }
    }

    @Test
    void raggedCsv_isRejected() {
        var in = new ByteArrayInputStream("A,B\nC\n".getBytes(StandardCharsets.UTF_8));

        assertThrows(InvalidSourceShapeException.class, () -> EdgeSources.fromCsv(in, ',', false));
    }

    @Test
    void numericIdentifiersOfDifferentTypes_joinOneChain() {
        var table = Table.of(List.of("PARENT", "CHILD"), List.of(
                List.of(1, 2L),
                List.of(new BigDecimal("2.0"), BigInteger.valueOf(3))));

        var h = Hierarchy.fromTable(table);

        assertEquals(Set.of(1L), h.roots());
        assertEquals(Set.of(List.of(1L), List.of(1L, 2L), List.of(1L, 2L, 3L)), h.paths());
    }

    @Test
    void canonical_givesOneRepresentationPerNumber() {
        assertEquals(7L, EdgeSources.canonical(7));
        assertEquals(7L, EdgeSources.canonical((short) 7));
        assertEquals(7L, EdgeSources.canonical(new BigDecimal("7.000")));
        assertEquals(7L, EdgeSources.canonical(BigInteger.valueOf(7)));
        assertEquals(new BigDecimal("1.5"), EdgeSources.canonical(new BigDecimal("1.50")));
        var huge = new BigInteger("123456789012345678901234567890");
        assertEquals(huge, EdgeSources.canonical(new BigDecimal(huge)));
        assertEquals("7", EdgeSources.canonical("7"));
        assertNull(EdgeSources.canonical(null));
    }

    @Test
    void csvWithBlankCell_namesTheRow() {
        var in = new ByteArrayInputStream("P,C\n,A\nA,B\n".getBytes(StandardCharsets.UTF_8));

        var ex = assertThrows(InvalidSourceShapeException.class, () -> EdgeSources.fromCsv(in, ',', true));
        assertTrue(ex.getMessage().contains("Row 0"), ex.getMessage());
        assertTrue(ex.getMessage().contains("empty identifier"), ex.getMessage());
    }
}
