package com.cadence.core.schema;

/**
 * Kind of structural rule a document broke.
 */
public enum Constraint {
    REQUIRED,
    TYPE,
    MIN_LENGTH,
    MAX_LENGTH,
    MIN_ITEMS,
    PATTERN
}
