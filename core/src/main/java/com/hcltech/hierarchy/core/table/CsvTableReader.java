package com.hcltech.hierarchy.core.table;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads delimited text into a {@link Table} of strings.
 * - Quoted fields and doubled quotes inside quoted fields.
 * - Blank lines skipped, UTF-8 BOM stripped.
 * - Without a header row the columns are labelled C1, C2, ...
 */
public final class CsvTableReader {
    private final char delimiter;

    public CsvTableReader(char delimiter) {
        this.delimiter = delimiter;
    }

    public static Table read(InputStream in, char delimiter, boolean header) throws IOException {
        return new CsvTableReader(delimiter).read(new InputStreamReader(in, StandardCharsets.UTF_8), header);
    }

    public Table read(Reader reader, boolean header) throws IOException {
        List<String> columns = null;
        List<List<Object>> rows = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(reader)) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (lineNo == 1) line = stripBom(line);
                if (line.isBlank()) continue;
                List<String> fields = parseLine(line);
                if (columns == null) {
                    if (header) {
                        columns = fields;
                        continue;
                    }
                    columns = generatedLabels(fields.size());
                }
                if (fields.size() != columns.size()) {
                    throw new IllegalArgumentException("CSV line " + lineNo + " has " + fields.size()
                            + " fields, expected " + columns.size());
                }
                rows.add(new ArrayList<>(fields));
            }
        }
        if (columns == null) {
            throw new IllegalArgumentException("CSV input is empty");
        }
        return new Table(columns, rows);
    }

    List<String> parseLine(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cur.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (ch == delimiter && !inQuotes) {
                out.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(ch);
            }
        }
        out.add(cur.toString());
        return out;
    }

    private static List<String> generatedLabels(int n) {
        List<String> labels = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) labels.add("C" + i);
        return labels;
    }

    private static String stripBom(String s) {
        return (!s.isEmpty() && s.charAt(0) == '\uFEFF') ? s.substring(1) : s;
    }
}
