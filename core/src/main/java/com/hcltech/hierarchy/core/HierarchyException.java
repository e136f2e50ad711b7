package com.hcltech.hierarchy.core;

/** Base of the unchecked exceptions raised while building or flattening a hierarchy. */
public class HierarchyException extends RuntimeException {
    public HierarchyException(String message) {
        super(message);
    }

    public HierarchyException(String message, Throwable cause) {
        super(message, cause);
    }
}
