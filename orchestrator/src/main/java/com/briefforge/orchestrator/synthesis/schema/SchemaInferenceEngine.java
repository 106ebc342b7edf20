package com.briefforge.orchestrator.synthesis.schema;

import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.synthesis.KeywordClassifier;
import com.briefforge.orchestrator.synthesis.SynthesisException;
import com.briefforge.orchestrator.synthesis.TaskText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Maps task text to relational table descriptors and renders them as SQL.
 *
 * <p>Inference happens in three passes:
 * <ol>
 *   <li>Detection: each keyword family, in fixed order, contributes its
 *       template tables when any of its keywords occurs in the task text.</li>
 *   <li>Closure: a table whose foreign key targets an undetected table pulls
 *       that table's template in, so the batch never references a missing
 *       table.</li>
 *   <li>Ordering: tables are sorted so that every referenced table precedes
 *       the tables pointing at it; detection order is kept otherwise.</li>
 * </ol>
 * When nothing is detected, a single generic table named after the task
 * title is returned instead.
 */
@Component
public class SchemaInferenceEngine {

    private static final Logger log = LoggerFactory.getLogger(SchemaInferenceEngine.class);

    private static final List<String> TITLE_VERBS =
            List.of("create", "implement", "build", "develop", "add", "setup", "configure");

    static final String DEFAULT_ENTITY_TABLE = "entities";

    /**
     * One keyword family. {@code precondition} sees the tables detected so far;
     * only task_shares uses it, to require a keyword-detected users table.
     */
    private record TableFamily(String name,
                               List<String> keywords,
                               List<String> tables,
                               Map<String, Predicate<Set<String>>> preconditions) {

        TableFamily(String name, List<String> keywords, List<String> tables) {
            this(name, keywords, tables, Map.of());
        }
    }

    private static final List<TableFamily> FAMILIES = List.of(
            new TableFamily("users",
                    List.of("auth", "login", "register", "user", "account", "profile"),
                    List.of("users")),
            new TableFamily("tasks",
                    List.of("task", "todo", "item", "project", "work"),
                    List.of("tasks", "task_shares"),
                    Map.of("task_shares", detected -> detected.contains("users"))),
            new TableFamily("comments",
                    List.of("comment", "note", "feedback", "discussion"),
                    List.of("comments")),
            new TableFamily("attachments",
                    List.of("file", "attachment", "upload", "document", "media"),
                    List.of("attachments")),
            new TableFamily("notifications",
                    List.of("notification", "alert", "reminder", "email"),
                    List.of("notifications")),
            new TableFamily("teams",
                    List.of("team", "group", "organization", "workspace"),
                    List.of("teams", "team_members")),
            new TableFamily("categories",
                    List.of("category", "tag", "label", "organize"),
                    List.of("categories", "task_categories")),
            new TableFamily("audit",
                    List.of("analytics", "log", "audit", "track", "history"),
                    List.of("audit_logs"))
    );

    private final KeywordClassifier classifier;
    private final Clock             clock;

    public SchemaInferenceEngine(KeywordClassifier classifier, Clock clock) {
        this.classifier = classifier;
        this.clock      = clock;
    }

    // ------------------------------------------------------------------
    // Inference
    // ------------------------------------------------------------------

    /**
     * Infer the table set for a task. Deterministic: calling this twice on
     * the same task yields equal lists.
     */
    public List<DatabaseTable> inferSchema(TechnicalTask task) {
        String combined = TaskText.combined(task);

        // 1. Detection (LinkedHashMap keeps detection order and drops duplicates)
        Map<String, DatabaseTable> detected = new LinkedHashMap<>();
        for (TableFamily family : FAMILIES) {
            if (!classifier.matchesAny(combined, family.keywords())) continue;
            for (String tableName : family.tables()) {
                Predicate<Set<String>> precondition = family.preconditions().get(tableName);
                if (precondition != null && !precondition.test(detected.keySet())) continue;
                detected.computeIfAbsent(tableName, this::template);
            }
        }

        if (detected.isEmpty()) {
            String name = entityNameFromTitle(task.title());
            log.debug("No table family matched task '{}', using generic table '{}'", task.title(), name);
            return List.of(TableTemplates.genericEntity(name));
        }

        // 2. Referential closure
        closeOverReferences(detected);

        // 3. Dependency ordering
        return orderByDependencies(new ArrayList<>(detected.values()));
    }

    /**
     * Derive a table name from a task title: drop common verbs, take the first
     * remaining word and append "s" unless it already ends with one.
     * Characters that are not valid in an unquoted identifier are stripped;
     * a word left empty (or starting with a digit) is skipped.
     * Returns "entities" when no usable word remains.
     */
    static String entityNameFromTitle(String title) {
        if (title == null || title.isBlank()) return DEFAULT_ENTITY_TABLE;
        for (String word : title.toLowerCase().strip().split("\\s+")) {
            String clean = word.replaceAll("[^a-z0-9_]", "");
            if (clean.isEmpty() || Character.isDigit(clean.charAt(0))) continue;
            if (TITLE_VERBS.contains(clean)) continue;
            return clean.endsWith("s") ? clean : clean + "s";
        }
        return DEFAULT_ENTITY_TABLE;
    }

    private DatabaseTable template(String name) {
        return TableTemplates.byName(name).orElseThrow(() -> new SynthesisException(
                SynthesisException.Kind.GENERATION_ERROR, "No template for table '" + name + "'"));
    }

    private void closeOverReferences(Map<String, DatabaseTable> tables) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (DatabaseTable table : List.copyOf(tables.values())) {
                for (String referenced : table.referencedTables()) {
                    if (!tables.containsKey(referenced)) {
                        tables.put(referenced, template(referenced));
                        log.debug("Table '{}' pulled in by foreign key from '{}'", referenced, table.name());
                        changed = true;
                    }
                }
            }
        }
    }

    /**
     * Stable topological sort: repeatedly take the earliest table whose
     * referenced tables have all been placed. A reference to a table outside
     * the batch is an error; a cycle (none of the templates has one) keeps
     * the remaining tables in input order.
     */
    static List<DatabaseTable> orderByDependencies(List<DatabaseTable> tables) {
        Set<String> names = new HashSet<>();
        for (DatabaseTable table : tables) {
            if (!names.add(table.name())) {
                throw new SynthesisException(SynthesisException.Kind.INVALID_INPUT,
                        "Duplicate table '" + table.name() + "' in schema batch");
            }
        }
        for (DatabaseTable table : tables) {
            for (String referenced : table.referencedTables()) {
                if (!names.contains(referenced)) {
                    throw new SynthesisException(SynthesisException.Kind.INVALID_INPUT,
                            "Table '" + table.name() + "' references missing table '" + referenced + "'");
                }
            }
        }

        List<DatabaseTable> remaining = new ArrayList<>(tables);
        List<DatabaseTable> ordered   = new ArrayList<>(tables.size());
        Set<String>         placed    = new HashSet<>();
        while (!remaining.isEmpty()) {
            DatabaseTable next = remaining.stream()
                    .filter(t -> placed.containsAll(t.referencedTables()))
                    .findFirst()
                    .orElse(remaining.get(0));
            remaining.remove(next);
            ordered.add(next);
            placed.add(next.name());
        }
        return ordered;
    }

    // ------------------------------------------------------------------
    // SQL rendering
    // ------------------------------------------------------------------

    /**
     * Render a table batch as one migration script.
     *
     * Layout: header comments, (PostgreSQL) uuid extension, BEGIN, every
     * CREATE TABLE in dependency order, every CREATE INDEX, COMMIT.
     *
     * @throws SynthesisException if a foreign key targets a table missing from the batch
     */
    public String emitSql(List<DatabaseTable> tables, SqlDialect dialect) {
        List<DatabaseTable> ordered = orderByDependencies(tables);

        StringBuilder sql = new StringBuilder();
        sql.append("-- Database Schema Migration\n");
        sql.append("-- Generated: ").append(Instant.now(clock)).append('\n');
        sql.append("-- Dialect: ").append(dialect.name()).append("\n\n");

        if (dialect == SqlDialect.POSTGRESQL) {
            sql.append("-- Enable UUID extension\n");
            sql.append("CREATE EXTENSION IF NOT EXISTS \"uuid-ossp\";\n\n");
        }

        sql.append("BEGIN;\n\n");
        for (DatabaseTable table : ordered) {
            appendTable(sql, table, dialect);
            sql.append('\n');
        }

        // MySQL has no IF NOT EXISTS for CREATE INDEX.
        String indexGuard = dialect == SqlDialect.POSTGRESQL ? "IF NOT EXISTS " : "";
        sql.append("-- Indexes for performance optimization\n");
        for (DatabaseTable table : ordered) {
            for (DatabaseIndex index : table.indexes()) {
                sql.append("CREATE ")
                        .append(index.unique() ? "UNIQUE " : "")
                        .append("INDEX ").append(indexGuard)
                        .append(index.name())
                        .append(" ON ").append(table.name())
                        .append('(').append(String.join(", ", index.columns())).append(");\n");
            }
        }

        sql.append("\nCOMMIT;\n");
        return sql.toString();
    }

    private static void appendTable(StringBuilder sql, DatabaseTable table, SqlDialect dialect) {
        sql.append("-- ").append(capitalize(table.name())).append(" table\n");
        sql.append("CREATE TABLE IF NOT EXISTS ").append(table.name()).append(" (\n");

        List<String> definitions = new ArrayList<>();
        for (DatabaseColumn col : table.columns()) {
            StringBuilder def = new StringBuilder("  ")
                    .append(col.name()).append(' ')
                    .append(dialect.typeName(col.type()));
            if (col.primaryKey()) {
                def.append(" PRIMARY KEY DEFAULT ").append(dialect.uuidDefault());
            } else {
                if (!col.nullable())          def.append(" NOT NULL");
                if (col.unique())             def.append(" UNIQUE");
                if (col.defaultValue() != null) def.append(" DEFAULT ").append(col.defaultValue());
            }
            definitions.add(def.toString());
        }
        for (DatabaseForeignKey fk : table.foreignKeys()) {
            definitions.add("  CONSTRAINT fk_%s_%s FOREIGN KEY (%s) REFERENCES %s(%s) ON DELETE %s".formatted(
                    table.name(), fk.column(), fk.column(),
                    fk.referencedTable(), fk.referencedColumn(), fk.onDelete().sql()));
        }

        sql.append(String.join(",\n", definitions));
        sql.append("\n);\n\n");
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
