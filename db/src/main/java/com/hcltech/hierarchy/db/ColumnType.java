package com.hcltech.hierarchy.db;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Column type inferred from the values written: integral numbers become an integer column, anything else text.
 */
public record ColumnType(boolean integral, int longestText) {

    public static ColumnType infer(List<Object> values) {
        boolean integral = true;
        boolean sawValue = false;
        int longest = 0;
        for (Object v : values) {
            if (v == null) continue;
            sawValue = true;
            if (!isIntegral(v)) integral = false;
            longest = Math.max(longest, String.valueOf(v).length());
        }
        return new ColumnType(sawValue && integral, longest);
    }

    /** Whole numbers, including {@code BigDecimal}s with no fractional part (Oracle NUMBER keys). */
    public static boolean isIntegral(Object v) {
        if (v instanceof BigDecimal dec) return dec.stripTrailingZeros().scale() <= 0;
        return v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte
                || v instanceof BigInteger;
    }

    public String sqlType(SqlDialect dialect) {
        return integral ? dialect.integerType() : dialect.textType(longestText);
    }
}
