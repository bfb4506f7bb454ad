package io.treeshell.workflow;

import io.treeshell.model.WorkflowRecord;

public record ApprovalOutcome(
        Result result,
        WorkflowRecord record
) {
    public enum Result {
        APPROVED,
        /** A concurrent approval of the same record won the swap. */
        NO_OP,
        REVOKED
    }
}
