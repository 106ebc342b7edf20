package com.briefforge.orchestrator.synthesis.schema;

public enum OnDeletePolicy {
    CASCADE("CASCADE"),
    SET_NULL("SET NULL"),
    RESTRICT("RESTRICT");

    private final String sql;

    OnDeletePolicy(String sql) {
        this.sql = sql;
    }

    public String sql() { return sql; }
}
