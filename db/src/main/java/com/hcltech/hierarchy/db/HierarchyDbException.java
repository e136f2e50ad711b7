package com.hcltech.hierarchy.db;

import java.sql.SQLException;

/** Unchecked wrapper for storage failures, carrying the statement or table involved in its message. */
public class HierarchyDbException extends RuntimeException {

    public HierarchyDbException(String message) {
        super(message);
    }

    public HierarchyDbException(String message, Throwable cause) {
        super(message, cause);
    }

    /** The cause as an {@code SQLException}, or null. */
    public SQLException sqlCause() {
        return getCause() instanceof SQLException sql ? sql : null;
    }
}
