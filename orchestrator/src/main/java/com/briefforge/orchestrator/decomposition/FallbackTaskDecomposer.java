package com.briefforge.orchestrator.decomposition;

import com.briefforge.orchestrator.model.DecompositionSource;
import com.briefforge.orchestrator.model.ProjectBrief;
import com.briefforge.orchestrator.model.TaskPriority;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.synthesis.KeywordClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based decomposer used whenever the reasoning service is missing or fails.
 *
 * <p>Keyword families on the brief description each contribute one backend
 * and one frontend task. When at least one family matched but no task covers
 * the API layer, an infrastructure task is appended. When nothing matched,
 * a fixed eight-task project skeleton is returned. The result is never empty.
 *
 * <p>Deterministic and free of I/O: ids are {@code fallback-1..n} in emission order.
 */
@Component
public class FallbackTaskDecomposer implements TaskDecomposer {

    private static final Logger log = LoggerFactory.getLogger(FallbackTaskDecomposer.class);

    /** Task data without an id. */
    record TaskTemplate(String title,
                        String description,
                        TaskType type,
                        TaskPriority priority,
                        int estimatedHours,
                        List<String> acceptanceCriteria) {

        TechnicalTask toTask(String id) {
            return TechnicalTask.of(id, title, description, type, priority, acceptanceCriteria, estimatedHours);
        }
    }

    record Family(String name, List<String> keywords, TaskTemplate backend, TaskTemplate frontend) {}

    // ------------------------------------------------------------------
    // Keyword families
    // ------------------------------------------------------------------

    static final List<Family> FAMILIES = List.of(
            new Family("authentication", List.of("auth", "login", "user"),
                    new TaskTemplate("Implement Advanced Authentication System",
                            "Secure authentication backend with email verification, token sessions, MFA and social login",
                            TaskType.BACKEND, TaskPriority.HIGH, 16, List.of(
                            "User registration with email verification",
                            "Secure login with password hashing (bcrypt)",
                            "JWT token-based authentication",
                            "Password reset functionality",
                            "Multi-factor authentication (TOTP)",
                            "Social login integration (Google, GitHub)",
                            "Rate limiting for security",
                            "Session management with refresh tokens",
                            "Account lockout after failed attempts",
                            "Audit logging for security events")),
                    new TaskTemplate("Build Modern Authentication UI Components",
                            "Responsive, accessible login and registration forms with real-time validation",
                            TaskType.FRONTEND, TaskPriority.HIGH, 12, List.of(
                            "Responsive login/register forms",
                            "Real-time form validation",
                            "Password strength indicator",
                            "Social login buttons",
                            "Multi-factor authentication UI",
                            "Password recovery flow",
                            "Loading states and error handling",
                            "Accessibility compliance (ARIA labels)",
                            "Mobile-optimized design",
                            "Dark/light theme support"))),

            new Family("task management", List.of("task", "todo", "management"),
                    new TaskTemplate("Develop Comprehensive Task Management API",
                            "Task management service with categories, priorities, dependencies and search",
                            TaskType.BACKEND, TaskPriority.HIGH, 20, List.of(
                            "CRUD operations for tasks",
                            "Task categorization and tagging",
                            "Priority levels and due dates",
                            "Task dependencies and subtasks",
                            "Advanced filtering and search",
                            "Bulk operations support",
                            "Real-time notifications",
                            "Activity history and audit trail",
                            "Data export functionality",
                            "Performance optimization with indexing")),
                    new TaskTemplate("Create Interactive Task Management Dashboard",
                            "Interactive task dashboard with drag-and-drop boards and live updates",
                            TaskType.FRONTEND, TaskPriority.HIGH, 18, List.of(
                            "Kanban board with drag-and-drop",
                            "Task creation and editing modals",
                            "Advanced filtering and search",
                            "Real-time updates via WebSocket",
                            "Bulk selection and operations",
                            "Calendar view integration",
                            "Progress tracking and analytics",
                            "Keyboard shortcuts support",
                            "Responsive design for all devices",
                            "Customizable dashboard layout"))),

            new Family("collaboration", List.of("shar", "collaborat", "team"),
                    new TaskTemplate("Implement Advanced Collaboration System",
                            "Team workspaces, granular permissions, comments and activity feeds",
                            TaskType.BACKEND, TaskPriority.MEDIUM, 24, List.of(
                            "Team and workspace management",
                            "Granular permission system",
                            "Real-time collaboration features",
                            "Comment and mention system",
                            "File sharing and attachments",
                            "Activity feeds and notifications",
                            "Integration with external tools",
                            "Conflict resolution mechanisms",
                            "Version control for shared items",
                            "Advanced analytics and reporting")),
                    new TaskTemplate("Build Collaborative User Interface",
                            "Real-time collaborative views with presence, comments and permission settings",
                            TaskType.FRONTEND, TaskPriority.MEDIUM, 16, List.of(
                            "Real-time collaborative editing",
                            "User presence indicators",
                            "Comment and annotation system",
                            "File upload with drag-and-drop",
                            "Team member management UI",
                            "Permission settings interface",
                            "Activity timeline and feeds",
                            "Notification center",
                            "Integration widgets",
                            "Mobile collaboration features"))),

            new Family("e-commerce", List.of("ecommerce", "shop", "product"),
                    new TaskTemplate("Build Advanced E-commerce Backend",
                            "Catalog, inventory, orders and payment processing",
                            TaskType.BACKEND, TaskPriority.HIGH, 32, List.of(
                            "Product catalog with variants",
                            "Inventory management system",
                            "Shopping cart and checkout",
                            "Order processing workflow",
                            "Payment gateway integration",
                            "Shipping and tax calculations",
                            "Customer management system",
                            "Analytics and reporting",
                            "Promotional codes and discounts",
                            "Multi-currency support")),
                    new TaskTemplate("Create Modern E-commerce Frontend",
                            "Fast storefront with search, cart, checkout and order tracking",
                            TaskType.FRONTEND, TaskPriority.HIGH, 28, List.of(
                            "Product catalog with filtering",
                            "Advanced search functionality",
                            "Shopping cart with persistence",
                            "Checkout flow optimization",
                            "Product image gallery",
                            "Customer account dashboard",
                            "Order tracking interface",
                            "Responsive design patterns",
                            "Performance optimization",
                            "SEO-friendly structure")))
    );

    static final TaskTemplate API_INFRASTRUCTURE = new TaskTemplate(
            "Setup Production-Ready API Infrastructure",
            "API foundation with middleware, security headers, logging, health checks and containerization",
            TaskType.BACKEND, TaskPriority.HIGH, 12, List.of(
            "Express.js server with TypeScript",
            "Comprehensive middleware setup",
            "Security headers and CORS",
            "Request/response logging",
            "Error handling middleware",
            "API documentation (OpenAPI/Swagger)",
            "Health check endpoints",
            "Rate limiting and throttling",
            "Environment configuration",
            "Docker containerization"));

    // ------------------------------------------------------------------
    // Baseline skeleton (no family matched)
    // ------------------------------------------------------------------

    static final List<TaskTemplate> BASELINE = List.of(
            new TaskTemplate("Design Database Schema and Backend Architecture",
                    "Normalized schema with migrations, connection pooling, versioned REST architecture, "
                            + "environment-based configuration and health endpoints",
                    TaskType.BACKEND, TaskPriority.HIGH, 20, List.of(
                    "Complete database schema diagram created",
                    "All data models implemented with proper relationships",
                    "Database migrations tested and documented",
                    "API endpoints follow RESTful conventions",
                    "Environment configuration properly set up",
                    "Database queries optimized with proper indexing",
                    "Error handling middleware implemented",
                    "API documentation generated (Swagger/OpenAPI)")),
            new TaskTemplate("Implement User Authentication and Authorization System",
                    "Registration with verification, hashed passwords, JWT with refresh tokens, "
                            + "password reset, role-based access control and social login",
                    TaskType.BACKEND, TaskPriority.HIGH, 18, List.of(
                    "User registration with email verification working",
                    "Secure login system with proper password hashing",
                    "JWT tokens generated and validated correctly",
                    "Password reset flow fully functional",
                    "Role-based permissions implemented",
                    "Refresh token mechanism working",
                    "Security best practices followed (rate limiting, etc.)",
                    "Social login integration completed")),
            new TaskTemplate("Develop Core Business Logic and API Endpoints",
                    "CRUD for the main entities with validation rules, filtering, pagination, "
                            + "bulk operations, export and activity logging",
                    TaskType.BACKEND, TaskPriority.HIGH, 28, List.of(
                    "All CRUD operations working correctly",
                    "Business validation rules enforced",
                    "Advanced filtering and search implemented",
                    "Pagination working on all list endpoints",
                    "Data relationships properly handled",
                    "Bulk operations tested and optimized",
                    "Export functionality working (CSV, PDF, etc.)",
                    "Activity logs captured for important actions")),
            new TaskTemplate("Build Responsive UI Components and Layout System",
                    "Reusable accessible component library, responsive layout, navigation, forms, "
                            + "data display and feedback states",
                    TaskType.FRONTEND, TaskPriority.HIGH, 24, List.of(
                    "Component library with 20+ reusable components",
                    "Fully responsive design for all screen sizes",
                    "Navigation system working smoothly",
                    "Forms with real-time validation implemented",
                    "Data tables with sorting and filtering",
                    "Loading and error states properly displayed",
                    "Modal and notification systems functional",
                    "Accessibility audit passed with no critical issues")),
            new TaskTemplate("Implement State Management and API Integration Layer",
                    "Global state, API client with interceptors, caching, optimistic updates "
                            + "and data-fetching hooks",
                    TaskType.FRONTEND, TaskPriority.HIGH, 16, List.of(
                    "State management system properly configured",
                    "All API endpoints integrated",
                    "Loading states displayed during API calls",
                    "Error messages shown appropriately",
                    "Data caching working to reduce API calls",
                    "Optimistic updates implemented where needed",
                    "Custom hooks created for common operations",
                    "Real-time updates working (if applicable)")),
            new TaskTemplate("Implement Comprehensive Testing Suite",
                    "Unit, integration, component and end-to-end tests with coverage reporting in CI",
                    TaskType.BACKEND, TaskPriority.MEDIUM, 20, List.of(
                    "Testing framework configured (Jest, Vitest, etc.)",
                    "Unit tests covering core business logic",
                    "Integration tests for all API endpoints",
                    "Component tests for major UI components",
                    "E2E tests for main user workflows",
                    "Test coverage above 80%",
                    "Tests running automatically in CI/CD",
                    "Testing documentation completed")),
            new TaskTemplate("Implement Security Measures and Performance Optimization",
                    "Input validation, rate limiting, security headers, injection prevention, "
                            + "query tuning and caching",
                    TaskType.BACKEND, TaskPriority.HIGH, 16, List.of(
                    "All user inputs validated and sanitized",
                    "Rate limiting implemented on all endpoints",
                    "Security headers properly configured",
                    "No SQL injection or XSS vulnerabilities",
                    "Request/response logging working",
                    "Slow queries identified and optimized",
                    "Caching implemented for frequently accessed data",
                    "Security audit completed with no critical issues")),
            new TaskTemplate("Setup CI/CD Pipeline and Production Deployment",
                    "Automated pipeline, containers, production configuration, backups, "
                            + "monitoring and deployment runbooks",
                    TaskType.BACKEND, TaskPriority.MEDIUM, 14, List.of(
                    "CI/CD pipeline running successfully",
                    "Automated tests passing before deployment",
                    "Docker images built and pushed to registry",
                    "Production environment properly configured",
                    "Database backups scheduled and tested",
                    "Monitoring dashboards set up",
                    "Auto-scaling configured and tested",
                    "Deployment documentation completed"))
    );

    private final KeywordClassifier classifier;

    public FallbackTaskDecomposer(KeywordClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public DecompositionSource source() {
        return DecompositionSource.FALLBACK;
    }

    @Override
    public List<TechnicalTask> decompose(ProjectBrief brief) {
        String description = brief.description().toLowerCase();

        List<TaskTemplate> selected = new ArrayList<>();
        for (Family family : FAMILIES) {
            if (classifier.matchesAny(description, family.keywords())) {
                log.debug("Fallback family matched: {}", family.name());
                selected.add(family.backend());
                selected.add(family.frontend());
            }
        }

        if (selected.isEmpty()) {
            log.warn("No keyword family matched the brief; using the {}-task baseline", BASELINE.size());
            selected.addAll(BASELINE);
        } else if (selected.stream().noneMatch(FallbackTaskDecomposer::coversApiLayer)) {
            selected.add(API_INFRASTRUCTURE);
        }

        List<TechnicalTask> tasks = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            tasks.add(selected.get(i).toTask("fallback-" + (i + 1)));
        }
        return tasks;
    }

    private static boolean coversApiLayer(TaskTemplate template) {
        String title = template.title().toLowerCase();
        return title.contains("api") || title.contains("foundation");
    }
}
