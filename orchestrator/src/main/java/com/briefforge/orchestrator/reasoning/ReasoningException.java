package com.briefforge.orchestrator.reasoning;

/**
 * The reasoning service could not produce a task list.
 *
 * Either kind sends the brief down the rule-based path; the kind is only
 * used for logging and metrics.
 */
public class ReasoningException extends RuntimeException {

    public enum Kind {
        /** No candidate model answered, or the analyze call failed at transport or API level. */
        SERVICE_UNAVAILABLE,
        /** The reply held no parseable task array, or an empty one. */
        MALFORMED_RESPONSE
    }

    private final Kind kind;

    public ReasoningException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ReasoningException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
