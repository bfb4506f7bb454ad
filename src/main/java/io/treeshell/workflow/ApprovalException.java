package io.treeshell.workflow;

/**
 * A contradictory approval action. Concurrent duplicates are not errors; see {@link ApprovalOutcome#NO_OP}.
 */
public class ApprovalException extends RuntimeException {

    public enum Kind { NOT_IN_QUARANTINE, ALREADY_GOLDEN, NOT_GOLDEN }

    private final Kind kind;
    private final String path;

    public ApprovalException(Kind kind, String path, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
        this.path = path;
    }

    public Kind getKind() { return kind; }

    public String getPath() { return path; }
}
