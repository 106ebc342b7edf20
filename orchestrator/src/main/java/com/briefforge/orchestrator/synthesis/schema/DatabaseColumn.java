package com.briefforge.orchestrator.synthesis.schema;

/**
 * One column of a table template.
 *
 * defaultValue is a raw SQL fragment (e.g. {@code 'pending'} with quotes,
 * or {@code CURRENT_TIMESTAMP}); null means no default.
 */
public record DatabaseColumn(String name,
                             ColumnType type,
                             boolean nullable,
                             boolean unique,
                             String defaultValue,
                             boolean primaryKey) {

    /** The surrogate UUID key every table carries. */
    public static DatabaseColumn id() {
        return new DatabaseColumn("id", ColumnType.UUID, false, true, null, true);
    }

    public static DatabaseColumn required(String name, ColumnType type) {
        return new DatabaseColumn(name, type, false, false, null, false);
    }

    public static DatabaseColumn optional(String name, ColumnType type) {
        return new DatabaseColumn(name, type, true, false, null, false);
    }

    /** NOT NULL timestamp defaulting to CURRENT_TIMESTAMP. */
    public static DatabaseColumn timestamp(String name) {
        return required(name, ColumnType.TIMESTAMP).withDefault("CURRENT_TIMESTAMP");
    }

    public DatabaseColumn withDefault(String sql) {
        return new DatabaseColumn(name, type, nullable, unique, sql, primaryKey);
    }

    public DatabaseColumn asUnique() {
        return new DatabaseColumn(name, type, nullable, true, defaultValue, primaryKey);
    }
}
