package com.hcltech.hierarchy.core;

public class EmptyHierarchyException extends HierarchyException {
    public EmptyHierarchyException() {
        super("Cannot flatten an empty hierarchy: the longest path length is undefined");
    }
}
