package org.databaseclone.clone.models;

/**
 * Which end of a relationship an attribute is.  The child end is created by the service when
 * the parent end is created with two-way enabled.
 */
public enum RelationSide {
    PARENT,
    CHILD;

    public static RelationSide fromString(String value) {
        return "child".equalsIgnoreCase(value) ? CHILD : PARENT;
    }
}
