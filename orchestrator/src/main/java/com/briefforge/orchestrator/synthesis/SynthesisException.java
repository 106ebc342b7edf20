package com.briefforge.orchestrator.synthesis;

/**
 * Thrown when a synthesizer fails for one task.
 *
 * Unchecked: the coordinator catches it per task and records the message in
 * that task's response; the rest of the batch keeps going.
 */
public class SynthesisException extends RuntimeException {

    public enum Kind { INVALID_INPUT, GENERATION_ERROR }

    private final Kind kind;

    public SynthesisException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public SynthesisException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
