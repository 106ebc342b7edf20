package com.briefforge.orchestrator.synthesis;

import com.briefforge.orchestrator.model.TechnicalTask;

/**
 * Builds the lower-cased text that keyword families are matched against.
 */
public final class TaskText {

    private TaskText() {}

    /** Title, description and joined acceptance criteria, lower-cased. */
    public static String combined(TechnicalTask task) {
        String title       = task.title() == null ? "" : task.title();
        String description = task.description() == null ? "" : task.description();
        String criteria    = String.join(" ", task.acceptanceCriteria());
        return (title + " " + description + " " + criteria).toLowerCase();
    }

    /** Lower-cased title only; some synthesizers key on the title alone. */
    public static String title(TechnicalTask task) {
        return task.title() == null ? "" : task.title().toLowerCase();
    }

    /** "Build User Auth!" becomes "build-user-auth". Never empty. */
    public static String slug(String title) {
        String slug = (title == null ? "" : title.toLowerCase())
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > 50) {
            slug = slug.substring(0, 50).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? "task" : slug;
    }

    /** "Build user auth" becomes "BuildUserAuth". Never empty. */
    public static String pascalCase(String title) {
        StringBuilder sb = new StringBuilder();
        for (String word : (title == null ? "" : title).split("[^A-Za-z0-9]+")) {
            if (word.isEmpty()) continue;
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.length() == 0 ? "Generated" : sb.toString();
    }
}
