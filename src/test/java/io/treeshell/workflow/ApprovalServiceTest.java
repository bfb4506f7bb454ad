package io.treeshell.workflow;

import io.treeshell.TreeShellFixtures;
import io.treeshell.config.TreeShellConfig;
import io.treeshell.model.WorkflowStatus;
import io.treeshell.storage.Database;
import io.treeshell.storage.WorkflowStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class ApprovalServiceTest {
    private Path root;
    private WorkflowStore store;
    private ApprovalChannel channel;
    private ApprovalService service;
    private final List<ApprovalService.ApprovalEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("treeshell-test-approval-");
        Database db = new Database(TreeShellConfig.fromRoot(root.toString()));
        db.init();
        store = new WorkflowStore(db);
        channel = new ApprovalChannel();
        service = new ApprovalService(store, channel, events::add).start();
    }

    @AfterEach
    void tearDown() throws Exception {
        service.close();
        TreeShellFixtures.deleteRecursively(root);
    }

    @Test
    void approvePromotesQuarantineAndRepeatIsAlreadyGolden() {
        store.recordExecution("system.echo", true, Instant.now().toEpochMilli(), 3);

        ApprovalOutcome first = service.approve("system.echo", "alice");
        ApprovalException again = Assertions.assertThrows(ApprovalException.class,
                () -> service.approve("system.echo", "alice"));

        Assertions.assertEquals(ApprovalOutcome.Result.APPROVED, first.result());
        Assertions.assertEquals(WorkflowStatus.GOLDEN, first.record().status());
        Assertions.assertEquals("alice", first.record().approvedBy());
        Assertions.assertEquals(ApprovalException.Kind.ALREADY_GOLDEN, again.getKind());
        Assertions.assertEquals(1, events.stream().filter(e -> "approved".equals(e.action())).count());
    }

    @Test
    void concurrentApprovalsYieldOneApprovedAndOneNoOp() throws Exception {
        store.recordExecution("system.echo", true, Instant.now().toEpochMilli(), 3);
        ApprovalChannel held = new ApprovalChannel();
        ApprovalService pending = new ApprovalService(store, held, events::add);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CountDownLatch ready = new CountDownLatch(1);
            List<Future<ApprovalOutcome>> futures = new ArrayList<>();
            for (String approver : List.of("alice", "bob")) {
                futures.add(pool.submit(() -> {
                    ready.await();
                    return pending.approve("system.echo", approver);
                }));
            }
            ready.countDown();
            long deadline = System.currentTimeMillis() + 5_000L;
            while (held.backlog() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            Assertions.assertEquals(2, held.backlog());
            pending.start();

            List<ApprovalOutcome.Result> results = new ArrayList<>();
            for (Future<ApprovalOutcome> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS).result());
            }

            Assertions.assertEquals(1, results.stream().filter(r -> r == ApprovalOutcome.Result.APPROVED).count());
            Assertions.assertEquals(1, results.stream().filter(r -> r == ApprovalOutcome.Result.NO_OP).count());
            Assertions.assertEquals(WorkflowStatus.GOLDEN, store.recordOrUnran("system.echo").status());
        } finally {
            pool.shutdownNow();
            pending.close();
        }
    }

    @Test
    void unranPathCannotBeApproved() {
        ApprovalException e = Assertions.assertThrows(ApprovalException.class,
                () -> service.approve("system.never", "alice"));

        Assertions.assertEquals(ApprovalException.Kind.NOT_IN_QUARANTINE, e.getKind());
        Assertions.assertEquals("system.never", e.getPath());
    }

    @Test
    void revokeReturnsGoldenToQuarantineOnce() {
        store.recordExecution("system.echo", true, Instant.now().toEpochMilli(), 3);
        service.approve("system.echo", "alice");

        ApprovalOutcome revoked = service.revoke("system.echo", "bob");
        ApprovalException again = Assertions.assertThrows(ApprovalException.class,
                () -> service.revoke("system.echo", "bob"));

        Assertions.assertEquals(ApprovalOutcome.Result.REVOKED, revoked.result());
        Assertions.assertEquals(WorkflowStatus.QUARANTINE, revoked.record().status());
        Assertions.assertEquals(ApprovalException.Kind.NOT_GOLDEN, again.getKind());
        Assertions.assertTrue(events.stream().anyMatch(e -> "revoked".equals(e.action()) && "bob".equals(e.actor())));
    }

    @Test
    void quarantineNoticeIsReportedAsEvent() throws Exception {
        channel.post(ApprovalMessage.quarantineNotice("system.echo"));
        store.recordExecution("system.other", true, Instant.now().toEpochMilli(), 3);
        // requests are served in order, so the notice has been handled once this returns
        service.approve("system.other", "alice");

        Assertions.assertTrue(events.stream().anyMatch(e -> "quarantined".equals(e.action()) && "system.echo".equals(e.path())));
    }
}
