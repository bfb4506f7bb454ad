package io.treeshell.exec;

/**
 * Failure of a {@code jump} or {@code chain} step after resolution succeeded.
 */
public class ExecutionException extends RuntimeException {

    public enum Kind { ARG_VALIDATION, CALLABLE_REQUIRED, CALLABLE_FAILURE, TIMEOUT, CANCELLED }

    private final Kind kind;

    public ExecutionException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ExecutionException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
