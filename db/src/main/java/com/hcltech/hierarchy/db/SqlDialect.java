package com.hcltech.hierarchy.db;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;

/** Column types and catalogue lookups that differ between databases. */
public enum SqlDialect {
    GENERIC("BIGINT", "VARCHAR", Integer.MAX_VALUE, "CLOB"),
    H2("BIGINT", "VARCHAR", 1_000_000, "CLOB"),
    ORACLE("NUMBER(19)", "VARCHAR2", 4000, "CLOB");

    private final String integerType;
    private final String varcharType;
    private final int maxVarcharLength;
    private final String longTextType;

    SqlDialect(String integerType, String varcharType, int maxVarcharLength, String longTextType) {
        this.integerType = integerType;
        this.varcharType = varcharType;
        this.maxVarcharLength = maxVarcharLength;
        this.longTextType = longTextType;
    }

    public static SqlDialect forUrl(String url) {
        if (url == null) return GENERIC;
        if (url.startsWith("jdbc:h2:")) return H2;
        if (url.startsWith("jdbc:oracle:")) return ORACLE;
        return GENERIC;
    }

    public String integerType() {
        return integerType;
    }

    public String textType(int longest) {
        if (longest > maxVarcharLength) return longTextType;
        String size = Integer.toString(Math.max(1, longest));
        return this == ORACLE ? varcharType + "(" + size + " CHAR)" : varcharType + "(" + size + ")";
    }

    /** Looks the table up in the catalogue, folding the names the way the database stores unquoted identifiers. */
    public boolean tableExists(Connection con, String schema, String table) throws SQLException {
        DatabaseMetaData meta = con.getMetaData();
        try (ResultSet rs = meta.getTables(null, fold(meta, schema), fold(meta, table), new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private static String fold(DatabaseMetaData meta, String name) throws SQLException {
        if (meta.storesUpperCaseIdentifiers()) return name.toUpperCase(Locale.ROOT);
        if (meta.storesLowerCaseIdentifiers()) return name.toLowerCase(Locale.ROOT);
        return name;
    }
}
