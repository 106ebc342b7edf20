package com.briefforge.orchestrator.synthesis.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import static com.briefforge.orchestrator.synthesis.schema.ColumnType.*;
import static com.briefforge.orchestrator.synthesis.schema.DatabaseColumn.*;
import static com.briefforge.orchestrator.synthesis.schema.DatabaseForeignKey.references;
import static com.briefforge.orchestrator.synthesis.schema.DatabaseIndex.on;
import static com.briefforge.orchestrator.synthesis.schema.DatabaseIndex.uniqueOn;
import static com.briefforge.orchestrator.synthesis.schema.OnDeletePolicy.CASCADE;
import static com.briefforge.orchestrator.synthesis.schema.OnDeletePolicy.SET_NULL;

/**
 * Fixed table shapes. The inference engine never invents column names;
 * it only chooses which of these templates to include.
 */
public final class TableTemplates {

    private static final Map<String, Supplier<DatabaseTable>> BY_NAME = new LinkedHashMap<>();

    static {
        BY_NAME.put("users",           TableTemplates::users);
        BY_NAME.put("tasks",           TableTemplates::tasks);
        BY_NAME.put("task_shares",     TableTemplates::taskShares);
        BY_NAME.put("comments",        TableTemplates::comments);
        BY_NAME.put("attachments",     TableTemplates::attachments);
        BY_NAME.put("notifications",   TableTemplates::notifications);
        BY_NAME.put("teams",           TableTemplates::teams);
        BY_NAME.put("team_members",    TableTemplates::teamMembers);
        BY_NAME.put("categories",      TableTemplates::categories);
        BY_NAME.put("task_categories", TableTemplates::taskCategories);
        BY_NAME.put("audit_logs",      TableTemplates::auditLogs);
    }

    private TableTemplates() {}

    /** Template lookup used when a foreign key pulls in an undetected table. */
    public static Optional<DatabaseTable> byName(String name) {
        Supplier<DatabaseTable> supplier = BY_NAME.get(name);
        return supplier == null ? Optional.empty() : Optional.of(supplier.get());
    }

    public static List<String> names() {
        return List.copyOf(BY_NAME.keySet());
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    public static DatabaseTable users() {
        return new DatabaseTable("users",
                List.of(
                        id(),
                        required("email", STRING).asUnique(),
                        required("password_hash", STRING),
                        required("name", STRING),
                        optional("avatar_url", STRING),
                        required("role", STRING).withDefault("'user'"),
                        required("is_active", BOOLEAN).withDefault("true"),
                        required("email_verified", BOOLEAN).withDefault("false"),
                        optional("last_login_at", TIMESTAMP),
                        timestamp("created_at"),
                        timestamp("updated_at")),
                List.of(
                        uniqueOn("idx_users_email", "email"),
                        on("idx_users_role", "role"),
                        on("idx_users_created_at", "created_at")),
                List.of());
    }

    public static DatabaseTable tasks() {
        return new DatabaseTable("tasks",
                List.of(
                        id(),
                        required("title", STRING),
                        optional("description", TEXT),
                        required("status", STRING).withDefault("'pending'"),
                        required("priority", STRING).withDefault("'medium'"),
                        required("user_id", UUID),
                        optional("assigned_to", UUID),
                        optional("parent_task_id", UUID),
                        optional("due_date", TIMESTAMP),
                        optional("completed_at", TIMESTAMP),
                        timestamp("created_at"),
                        timestamp("updated_at")),
                List.of(
                        on("idx_tasks_user_id", "user_id"),
                        on("idx_tasks_assigned_to", "assigned_to"),
                        on("idx_tasks_status", "status"),
                        on("idx_tasks_priority", "priority"),
                        on("idx_tasks_due_date", "due_date"),
                        on("idx_tasks_parent_task_id", "parent_task_id")),
                List.of(
                        references("user_id", "users", CASCADE),
                        references("assigned_to", "users", SET_NULL),
                        references("parent_task_id", "tasks", CASCADE)));
    }

    public static DatabaseTable taskShares() {
        return new DatabaseTable("task_shares",
                List.of(
                        id(),
                        required("task_id", UUID),
                        required("user_id", UUID),
                        required("permission", STRING).withDefault("'view'"),
                        required("shared_by", UUID),
                        timestamp("created_at")),
                List.of(
                        on("idx_task_shares_task_id", "task_id"),
                        on("idx_task_shares_user_id", "user_id"),
                        uniqueOn("idx_task_shares_unique", "task_id", "user_id")),
                List.of(
                        references("task_id", "tasks", CASCADE),
                        references("user_id", "users", CASCADE),
                        references("shared_by", "users", CASCADE)));
    }

    public static DatabaseTable comments() {
        return new DatabaseTable("comments",
                List.of(
                        id(),
                        required("task_id", UUID),
                        required("user_id", UUID),
                        required("content", TEXT),
                        optional("parent_comment_id", UUID),
                        timestamp("created_at"),
                        timestamp("updated_at")),
                List.of(
                        on("idx_comments_task_id", "task_id"),
                        on("idx_comments_user_id", "user_id"),
                        on("idx_comments_created_at", "created_at")),
                List.of(
                        references("task_id", "tasks", CASCADE),
                        references("user_id", "users", CASCADE),
                        references("parent_comment_id", "comments", CASCADE)));
    }

    public static DatabaseTable attachments() {
        return new DatabaseTable("attachments",
                List.of(
                        id(),
                        required("task_id", UUID),
                        required("user_id", UUID),
                        required("file_name", STRING),
                        required("file_path", STRING),
                        required("file_size", BIGINT),
                        required("mime_type", STRING),
                        timestamp("created_at")),
                List.of(
                        on("idx_attachments_task_id", "task_id"),
                        on("idx_attachments_user_id", "user_id")),
                List.of(
                        references("task_id", "tasks", CASCADE),
                        references("user_id", "users", CASCADE)));
    }

    public static DatabaseTable notifications() {
        return new DatabaseTable("notifications",
                List.of(
                        id(),
                        required("user_id", UUID),
                        required("title", STRING),
                        required("message", TEXT),
                        required("type", STRING),
                        optional("reference_id", UUID),
                        required("is_read", BOOLEAN).withDefault("false"),
                        timestamp("created_at")),
                List.of(
                        on("idx_notifications_user_id", "user_id"),
                        on("idx_notifications_is_read", "is_read"),
                        on("idx_notifications_created_at", "created_at")),
                List.of(
                        references("user_id", "users", CASCADE)));
    }

    public static DatabaseTable teams() {
        return new DatabaseTable("teams",
                List.of(
                        id(),
                        required("name", STRING),
                        optional("description", TEXT),
                        required("owner_id", UUID),
                        timestamp("created_at"),
                        timestamp("updated_at")),
                List.of(
                        on("idx_teams_owner_id", "owner_id")),
                List.of(
                        references("owner_id", "users", CASCADE)));
    }

    public static DatabaseTable teamMembers() {
        return new DatabaseTable("team_members",
                List.of(
                        id(),
                        required("team_id", UUID),
                        required("user_id", UUID),
                        required("role", STRING).withDefault("'member'"),
                        timestamp("joined_at")),
                List.of(
                        on("idx_team_members_team_id", "team_id"),
                        on("idx_team_members_user_id", "user_id"),
                        uniqueOn("idx_team_members_unique", "team_id", "user_id")),
                List.of(
                        references("team_id", "teams", CASCADE),
                        references("user_id", "users", CASCADE)));
    }

    public static DatabaseTable categories() {
        return new DatabaseTable("categories",
                List.of(
                        id(),
                        required("name", STRING),
                        optional("color", STRING),
                        required("user_id", UUID),
                        timestamp("created_at")),
                List.of(
                        on("idx_categories_user_id", "user_id"),
                        uniqueOn("idx_categories_name_user", "name", "user_id")),
                List.of(
                        references("user_id", "users", CASCADE)));
    }

    public static DatabaseTable taskCategories() {
        return new DatabaseTable("task_categories",
                List.of(
                        id(),
                        required("task_id", UUID),
                        required("category_id", UUID),
                        timestamp("created_at")),
                List.of(
                        on("idx_task_categories_task_id", "task_id"),
                        on("idx_task_categories_category_id", "category_id"),
                        uniqueOn("idx_task_categories_unique", "task_id", "category_id")),
                List.of(
                        references("task_id", "tasks", CASCADE),
                        references("category_id", "categories", CASCADE)));
    }

    public static DatabaseTable auditLogs() {
        return new DatabaseTable("audit_logs",
                List.of(
                        id(),
                        optional("user_id", UUID),
                        required("action", STRING),
                        required("entity_type", STRING),
                        required("entity_id", UUID),
                        optional("changes", JSON),
                        optional("ip_address", STRING),
                        optional("user_agent", STRING),
                        timestamp("created_at")),
                List.of(
                        on("idx_audit_logs_user_id", "user_id"),
                        on("idx_audit_logs_entity", "entity_type", "entity_id"),
                        on("idx_audit_logs_created_at", "created_at")),
                List.of(
                        references("user_id", "users", SET_NULL)));
    }

    /** Catch-all table used when no keyword family matched. No foreign keys. */
    public static DatabaseTable genericEntity(String name) {
        return new DatabaseTable(name,
                List.of(
                        id(),
                        required("name", STRING),
                        optional("description", TEXT),
                        required("status", STRING).withDefault("'active'"),
                        optional("user_id", UUID),
                        timestamp("created_at"),
                        timestamp("updated_at")),
                List.of(
                        on("idx_" + name + "_user_id", "user_id"),
                        on("idx_" + name + "_status", "status")),
                List.of());
    }
}
