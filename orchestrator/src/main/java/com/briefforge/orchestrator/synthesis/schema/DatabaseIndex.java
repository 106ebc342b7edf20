package com.briefforge.orchestrator.synthesis.schema;

import java.util.List;

public record DatabaseIndex(String name, List<String> columns, boolean unique) {

    public DatabaseIndex {
        columns = List.copyOf(columns);
    }

    public static DatabaseIndex on(String name, String... columns) {
        return new DatabaseIndex(name, List.of(columns), false);
    }

    public static DatabaseIndex uniqueOn(String name, String... columns) {
        return new DatabaseIndex(name, List.of(columns), true);
    }
}
