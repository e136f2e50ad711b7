package com.hcltech.hierarchy.db;

import java.util.regex.Pattern;

/**
 * Schema, table and column names are spliced into SQL text, so only plain unquoted identifiers are accepted.
 */
public final class SqlIdentifiers {
    public static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$#]*");

    private SqlIdentifiers() {}

    public static String requireValid(String kind, String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new HierarchyDbException("Invalid " + kind + " name: '" + name + "'");
        }
        return name;
    }

    public static String qualified(String schema, String table) {
        return requireValid("schema", schema) + "." + requireValid("table", table);
    }
}
