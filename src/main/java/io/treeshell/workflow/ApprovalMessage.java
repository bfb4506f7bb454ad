package io.treeshell.workflow;

import io.treeshell.model.WorkflowStatus;

import java.util.concurrent.CompletableFuture;

/**
 * Message on the {@link ApprovalChannel}. Requests carry a reply future; notices do not.
 * An approval also carries the status its sender observed when posting it, which is the
 * expected value of the compare-and-swap.
 */
public record ApprovalMessage(
        Type type,
        String path,
        String actor,
        WorkflowStatus observed,
        CompletableFuture<ApprovalOutcome> reply
) {
    public enum Type {
        /** Posted by the dispatcher when a path enters quarantine for the first time. */
        QUARANTINE_NOTICE,
        APPROVE,
        REVOKE,
        SHUTDOWN
    }

    public static ApprovalMessage quarantineNotice(String path) {
        return new ApprovalMessage(Type.QUARANTINE_NOTICE, path, null, null, null);
    }

    public static ApprovalMessage approve(String path, String approver, WorkflowStatus observed) {
        return new ApprovalMessage(Type.APPROVE, path, approver, observed, new CompletableFuture<>());
    }

    public static ApprovalMessage revoke(String path, String actor) {
        return new ApprovalMessage(Type.REVOKE, path, actor, null, new CompletableFuture<>());
    }

    static ApprovalMessage shutdown() {
        return new ApprovalMessage(Type.SHUTDOWN, null, null, null, null);
    }
}
