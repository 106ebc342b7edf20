package com.briefforge.orchestrator.synthesis.schema;

/**
 * Inline foreign-key constraint. referencedColumn is always "id" in the
 * built-in templates but kept explicit for rendering.
 */
public record DatabaseForeignKey(String column,
                                 String referencedTable,
                                 String referencedColumn,
                                 OnDeletePolicy onDelete) {

    public static DatabaseForeignKey references(String column, String table, OnDeletePolicy onDelete) {
        return new DatabaseForeignKey(column, table, "id", onDelete);
    }
}
