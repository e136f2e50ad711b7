package com.hcltech.hierarchy.core.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rectangular, column-labelled data. Cells may be {@code null}; every row is as wide as {@link #columns()}.
 */
public record Table(List<String> columns, List<List<Object>> rows) {

    public Table {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(rows, "rows");
        columns = List.copyOf(columns);
        if (columns.stream().distinct().count() != columns.size()) {
            throw new IllegalArgumentException("Duplicate column labels: " + columns);
        }
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<Object> row = rows.get(i);
            if (row == null || row.size() != columns.size()) {
                throw new IllegalArgumentException("Row " + i + " has "
                        + (row == null ? "no" : String.valueOf(row.size())) + " cells but the table has "
                        + columns.size() + " columns");
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    public static Table of(List<String> columns, List<? extends List<?>> rows) {
        List<List<Object>> widened = new ArrayList<>(rows.size());
        for (List<?> row : rows) widened.add(row == null ? null : new ArrayList<>(row));
        return new Table(columns, widened);
    }

    public static Table empty(List<String> columns) {
        return new Table(columns, List.of());
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int indexOf(String column) {
        int idx = columns.indexOf(column);
        if (idx < 0) throw new IllegalArgumentException("Unknown column: " + column + " (columns " + columns + ")");
        return idx;
    }

    public List<Object> column(String column) {
        int idx = indexOf(column);
        List<Object> out = new ArrayList<>(rows.size());
        for (List<Object> row : rows) out.add(row.get(idx));
        return out;
    }

    public Object get(int row, String column) {
        return rows.get(row).get(indexOf(column));
    }
}
