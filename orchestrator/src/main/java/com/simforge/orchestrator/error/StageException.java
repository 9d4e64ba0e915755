package com.simforge.orchestrator.error;

/**
 * Thrown by a stage when it fails in a way the orchestrator should route.
 *
 * Unchecked so that collaborators deep inside a stage can raise it without
 * every intermediate signature declaring it. The orchestrator never inspects
 * the message; it only reads the kind through {@link ErrorClassifier}.
 */
public class StageException extends RuntimeException {

    private final FailureKind kind;
    private final String      diagnostics;

    public StageException(FailureKind kind, String message) {
        this(kind, message, null, null);
    }

    public StageException(FailureKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public StageException(FailureKind kind, String message, String diagnostics, Throwable cause) {
        super(message, cause);
        this.kind        = kind;
        this.diagnostics = diagnostics;
    }

    public FailureKind getKind()        { return kind; }
    public String      getDiagnostics() { return diagnostics; }
}
