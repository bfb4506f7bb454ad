package io.treeshell.workflow;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded FIFO between message producers (dispatcher, command surface) and the single approver.
 */
public final class ApprovalChannel {
    private final BlockingQueue<ApprovalMessage> queue = new LinkedBlockingQueue<>();

    public void post(ApprovalMessage message) {
        queue.add(message);
    }

    ApprovalMessage take() throws InterruptedException {
        return queue.take();
    }

    public int backlog() {
        return queue.size();
    }
}
