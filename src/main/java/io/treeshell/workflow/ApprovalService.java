package io.treeshell.workflow;

import io.treeshell.model.WorkflowRecord;
import io.treeshell.model.WorkflowStatus;
import io.treeshell.storage.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Approver: the only consumer of an {@link ApprovalChannel}. Status changes happen on its single
 * thread; the store's compare-and-swap guards against other processes sharing the database.
 */
public final class ApprovalService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);
    private static final long REPLY_TIMEOUT_SECONDS = 30L;

    private final WorkflowStore store;
    private final ApprovalChannel channel;
    private final Consumer<ApprovalEvent> events;
    private final Thread worker;

    public ApprovalService(WorkflowStore store, ApprovalChannel channel, Consumer<ApprovalEvent> events) {
        this.store = store;
        this.channel = channel;
        this.events = events;
        this.worker = new Thread(this::runLoop, "treeshell-approver");
        this.worker.setDaemon(true);
    }

    public ApprovalService start() {
        worker.start();
        return this;
    }

    public ApprovalOutcome approve(String path, String approver) {
        WorkflowStatus observed = store.recordOrUnran(path).status();
        return send(ApprovalMessage.approve(path, approver, observed));
    }

    public ApprovalOutcome revoke(String path, String actor) {
        return send(ApprovalMessage.revoke(path, actor));
    }

    private ApprovalOutcome send(ApprovalMessage message) {
        channel.post(message);
        try {
            return message.reply().get(REPLY_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for approver", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Approver failed", e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Approver did not reply within " + REPLY_TIMEOUT_SECONDS + "s", e);
        }
    }

    private void runLoop() {
        while (true) {
            ApprovalMessage message;
            try {
                message = channel.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (message.type() == ApprovalMessage.Type.SHUTDOWN) {
                return;
            }
            try {
                handle(message);
            } catch (RuntimeException e) {
                log.warn("Approval message {} for {} failed: {}", message.type(), message.path(), e.getMessage());
                if (message.reply() != null) {
                    message.reply().completeExceptionally(e);
                }
            }
        }
    }

    private void handle(ApprovalMessage message) {
        switch (message.type()) {
            case QUARANTINE_NOTICE -> {
                log.info("Path {} entered quarantine and awaits approval", message.path());
                events.accept(new ApprovalEvent("quarantined", message.path(), null, WorkflowStatus.QUARANTINE));
            }
            case APPROVE -> message.reply().complete(doApprove(message.path(), message.actor(), message.observed()));
            case REVOKE -> message.reply().complete(doRevoke(message.path(), message.actor()));
            default -> throw new IllegalArgumentException("Unexpected approval message: " + message.type());
        }
    }

    /**
     * Quarantine to Golden. A request that observed QUARANTINE but lost the swap to another
     * approval is a no-op; approving a record that was already Golden when the request was
     * posted is an error.
     */
    ApprovalOutcome doApprove(String path, String approver, WorkflowStatus observed) {
        long now = Instant.now().toEpochMilli();
        if (store.approve(path, approver, now)) {
            WorkflowRecord record = store.recordOrUnran(path);
            log.info("Path {} approved by {}", path, approver);
            events.accept(new ApprovalEvent("approved", path, approver, WorkflowStatus.GOLDEN));
            return new ApprovalOutcome(ApprovalOutcome.Result.APPROVED, record);
        }
        WorkflowRecord current = store.recordOrUnran(path);
        if (current.status() == WorkflowStatus.GOLDEN) {
            if (observed == WorkflowStatus.QUARANTINE) {
                log.info("Path {} approval by {} lost to {}", path, approver, current.approvedBy());
                return new ApprovalOutcome(ApprovalOutcome.Result.NO_OP, current);
            }
            throw new ApprovalException(ApprovalException.Kind.ALREADY_GOLDEN, path,
                    path + " is already golden (approved by " + current.approvedBy() + ")");
        }
        throw new ApprovalException(ApprovalException.Kind.NOT_IN_QUARANTINE, path,
                path + " is " + current.status() + ", not QUARANTINE");
    }

    ApprovalOutcome doRevoke(String path, String actor) {
        long now = Instant.now().toEpochMilli();
        if (store.revoke(path, now)) {
            log.info("Path {} revoked to quarantine by {}", path, actor);
            events.accept(new ApprovalEvent("revoked", path, actor, WorkflowStatus.QUARANTINE));
            return new ApprovalOutcome(ApprovalOutcome.Result.REVOKED, store.recordOrUnran(path));
        }
        WorkflowRecord current = store.recordOrUnran(path);
        throw new ApprovalException(ApprovalException.Kind.NOT_GOLDEN, path,
                path + " is " + current.status() + ", not GOLDEN");
    }

    @Override
    public void close() {
        channel.post(ApprovalMessage.shutdown());
        try {
            worker.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Status change reported to observers (the audit log).
     */
    public record ApprovalEvent(String action, String path, String actor, WorkflowStatus status) {
    }
}
