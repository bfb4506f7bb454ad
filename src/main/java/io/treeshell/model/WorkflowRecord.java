package io.treeshell.model;

public record WorkflowRecord(
        String path,
        WorkflowStatus status,
        long executionCount,
        long failureCount,
        String approvedBy,
        Long approvedAtMs,
        boolean flaggedForReview,
        long createdAtMs,
        long updatedAtMs
) {
    public static WorkflowRecord unran(String path) {
        return new WorkflowRecord(path, WorkflowStatus.UNRAN, 0L, 0L, null, null, false, 0L, 0L);
    }
}
