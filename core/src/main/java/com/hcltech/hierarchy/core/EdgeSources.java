package com.hcltech.hierarchy.core;

import com.hcltech.hierarchy.core.table.CsvTableReader;
import com.hcltech.hierarchy.core.table.Table;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Normalizes every accepted edge representation into one immutable {@code List<Edge<N>>}.
 * Shape problems are reported before anything is built.
 * <p>
 * Untyped cells (tables, object arrays) go through {@link #canonical(Object)} so that the same number read
 * as {@code Integer}, {@code Long} or {@code BigDecimal} is one node.
 */
public final class EdgeSources {
    private EdgeSources() {}

    public static <N> List<Edge<N>> fromEdges(Collection<Edge<N>> edges) {
        requireSource(edges);
        int i = 0;
        for (Edge<N> e : edges) {
            if (e == null) throw new InvalidSourceShapeException("Edge at index " + i + " is null");
            i++;
        }
        return List.copyOf(edges);
    }

    /** Each element must be a list of exactly two non-null identifiers: parent then child. */
    public static <N> List<Edge<N>> fromPairs(Collection<? extends List<? extends N>> pairs) {
        requireSource(pairs);
        List<Edge<N>> out = new ArrayList<>(pairs.size());
        int i = 0;
        for (List<? extends N> pair : pairs) {
            if (pair == null || pair.size() != 2) {
                throw new InvalidSourceShapeException("Pair at index " + i
                        + " must contain exactly two elements but was " + pair);
            }
            out.add(edge(pair.get(0), pair.get(1), i));
            i++;
        }
        return List.copyOf(out);
    }

    public static List<Edge<Object>> fromPairs(Object[][] pairs) {
        requireSource(pairs);
        List<Edge<Object>> out = new ArrayList<>(pairs.length);
        for (int i = 0; i < pairs.length; i++) {
            Object[] pair = pairs[i];
            if (pair == null || pair.length != 2) {
                throw new InvalidSourceShapeException("Pair at index " + i
                        + " must contain exactly two elements but was "
                        + (pair == null ? null : Arrays.toString(pair)));
            }
            out.add(edge(canonical(pair[0]), canonical(pair[1]), i));
        }
        return List.copyOf(out);
    }

    public static List<Edge<Object>> fromTable(Table table) {
        return fromTable(table, Object.class);
    }

    /** Column 0 holds the parent and column 1 the child; every cell must be a {@code type}. */
    public static <N> List<Edge<N>> fromTable(Table table, Class<N> type) {
        requireSource(table);
        if (table.columnCount() != 2) {
            throw new InvalidSourceShapeException("Table must have exactly two columns but had "
                    + table.columnCount() + ": " + table.columns());
        }
        List<Edge<N>> out = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) {
            List<Object> row = table.rows().get(i);
            out.add(edge(cell(row.get(0), type, i), cell(row.get(1), type, i), i));
        }
        return List.copyOf(out);
    }

    /** Empty fields are missing identifiers and are rejected. */
    public static List<Edge<String>> fromCsv(InputStream in, char delimiter, boolean header) throws IOException {
        Table table;
        try {
            table = CsvTableReader.read(in, delimiter, header);
        } catch (IllegalArgumentException e) {
            throw new InvalidSourceShapeException("Malformed CSV edge source: " + e.getMessage(), e);
        }
        for (int i = 0; i < table.rowCount(); i++) {
            List<Object> row = table.rows().get(i);
            for (int c = 0; c < row.size(); c++) {
                if (row.get(c) instanceof String s && s.isBlank()) {
                    throw new InvalidSourceShapeException("Row " + i + " has an empty identifier in column "
                            + table.columns().get(c));
                }
            }
        }
        return fromTable(table, String.class);
    }

    /**
     * One representation per numeric value: integral numbers (including {@code BigDecimal}s without a fraction)
     * become {@code Long}, or {@code BigInteger} when too large; other {@code BigDecimal}s lose trailing zeros.
     * Everything else is returned as is.
     */
    public static Object canonical(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : big;
        }
        if (value instanceof BigDecimal dec) {
            BigDecimal stripped = dec.stripTrailingZeros();
            return stripped.scale() <= 0 ? canonical(stripped.toBigIntegerExact()) : stripped;
        }
        return value;
    }

    // a cell already of a type narrower than Long is what the caller asked for
    private static <N> N cell(Object value, Class<N> type, int row) {
        Object v = type.isInstance(value) && !type.isAssignableFrom(Long.class) ? value : canonical(value);
        if (v != null && !type.isInstance(v)) {
            throw new InvalidSourceShapeException("Row " + row + " holds " + value.getClass().getName()
                    + " but " + type.getName() + " was expected");
        }
        return type.cast(v);
    }

    private static <N> Edge<N> edge(N parent, N child, int index) {
        if (parent == null || child == null) {
            throw new InvalidSourceShapeException("Pair at index " + index + " has a null identifier");
        }
        return new Edge<>(parent, child);
    }

    private static void requireSource(Object source) {
        if (source == null) throw new InvalidSourceShapeException("Edge source must not be null");
    }
}
