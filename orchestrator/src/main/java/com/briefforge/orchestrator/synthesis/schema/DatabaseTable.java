package com.briefforge.orchestrator.synthesis.schema;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Relational table descriptor.
 *
 * Construction enforces the structural rules every emitted table must obey:
 * exactly one primary key, named "id" and typed UUID; unique column names;
 * indexes and foreign keys only on declared columns.
 */
public record DatabaseTable(String name,
                            List<DatabaseColumn> columns,
                            List<DatabaseIndex> indexes,
                            List<DatabaseForeignKey> foreignKeys) {

    public DatabaseTable {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name must not be blank");
        }
        columns     = List.copyOf(columns);
        indexes     = List.copyOf(indexes);
        foreignKeys = List.copyOf(foreignKeys);

        List<DatabaseColumn> keys = columns.stream().filter(DatabaseColumn::primaryKey).toList();
        if (keys.size() != 1
                || !"id".equals(keys.get(0).name())
                || keys.get(0).type() != ColumnType.UUID) {
            throw new IllegalArgumentException(
                    "Table '" + name + "' must have exactly one UUID primary key named 'id'");
        }

        Set<String> columnNames = columns.stream().map(DatabaseColumn::name).collect(Collectors.toSet());
        if (columnNames.size() != columns.size()) {
            throw new IllegalArgumentException("Table '" + name + "' has duplicate column names");
        }
        for (DatabaseIndex index : indexes) {
            if (!columnNames.containsAll(index.columns())) {
                throw new IllegalArgumentException(
                        "Index '" + index.name() + "' references unknown column on '" + name + "'");
            }
        }
        for (DatabaseForeignKey fk : foreignKeys) {
            if (!columnNames.contains(fk.column())) {
                throw new IllegalArgumentException(
                        "Foreign key on unknown column '" + fk.column() + "' in '" + name + "'");
            }
        }
    }

    /** Names of other tables this table points at; self references excluded. */
    public Set<String> referencedTables() {
        return foreignKeys.stream()
                .map(DatabaseForeignKey::referencedTable)
                .filter(t -> !t.equals(name))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public DatabaseColumn primaryKey() {
        return columns.stream().filter(DatabaseColumn::primaryKey).findFirst().orElseThrow();
    }
}
