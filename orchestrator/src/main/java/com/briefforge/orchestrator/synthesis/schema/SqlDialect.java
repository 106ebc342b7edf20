package com.briefforge.orchestrator.synthesis.schema;

/**
 * Target SQL dialect for migration output.
 */
public enum SqlDialect {
    POSTGRESQL,
    MYSQL;

    /** Concrete column type for this dialect. */
    public String typeName(ColumnType type) {
        return switch (type) {
            case UUID      -> this == POSTGRESQL ? "UUID" : "CHAR(36)";
            case STRING    -> "VARCHAR(255)";
            case TEXT      -> "TEXT";
            case INTEGER   -> this == POSTGRESQL ? "INTEGER" : "INT";
            case BIGINT    -> "BIGINT";
            case BOOLEAN   -> this == POSTGRESQL ? "BOOLEAN" : "TINYINT(1)";
            case TIMESTAMP -> "TIMESTAMP";
            case DATE      -> "DATE";
            case JSON      -> this == POSTGRESQL ? "JSONB" : "JSON";
            case DECIMAL   -> "DECIMAL(10, 2)";
        };
    }

    /** Server-side default for a UUID primary key. */
    public String uuidDefault() {
        return this == POSTGRESQL ? "uuid_generate_v4()" : "(UUID())";
    }

    /** Accepts "postgresql", "postgres", "pg" or "mysql" in any case. */
    public static SqlDialect fromConfig(String value) {
        if (value == null) return POSTGRESQL;
        return switch (value.strip().toLowerCase()) {
            case "mysql", "mariadb" -> MYSQL;
            case "postgresql", "postgres", "pg", "" -> POSTGRESQL;
            default -> throw new IllegalArgumentException("Unsupported SQL dialect: " + value);
        };
    }
}
