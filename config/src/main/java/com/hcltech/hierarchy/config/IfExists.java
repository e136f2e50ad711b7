package com.hcltech.hierarchy.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/** What a write does when the destination table is already there. */
public enum IfExists {
    /** Refuse to write. */
    FAIL,
    /** Insert into the existing table. */
    APPEND,
    /** Drop the table and create it again. */
    REPLACE;

    @JsonCreator
    public static IfExists parse(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown ifExists policy '" + value + "', expected one of "
                    + Arrays.toString(values()).toLowerCase(Locale.ROOT), e);
        }
    }

    @JsonValue
    public String json() {
        return name().toLowerCase(Locale.ROOT);
    }
}
