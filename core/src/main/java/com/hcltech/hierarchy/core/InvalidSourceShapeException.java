package com.hcltech.hierarchy.core;

/** The edge source is not a collection of two-element pairs nor a two-column table. */
public class InvalidSourceShapeException extends HierarchyException {
    public InvalidSourceShapeException(String message) {
        super(message);
    }

    public InvalidSourceShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
