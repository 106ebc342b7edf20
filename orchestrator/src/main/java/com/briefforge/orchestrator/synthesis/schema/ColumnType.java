package com.briefforge.orchestrator.synthesis.schema;

/**
 * Dialect-neutral column type. {@link SqlDialect#typeName} maps each value
 * to concrete SQL.
 */
public enum ColumnType {
    UUID,
    STRING,
    TEXT,
    INTEGER,
    BIGINT,
    BOOLEAN,
    TIMESTAMP,
    DATE,
    JSON,
    DECIMAL
}
