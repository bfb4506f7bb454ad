package io.treeshell.storage;

import io.treeshell.model.WorkflowRecord;
import io.treeshell.model.WorkflowStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable workflow records and the pending-approval queue. Status changes are compare-and-swap
 * updates on the current status; counter updates for one path are serialized by a per-path lock
 * inside the process and by an immediate transaction across processes.
 */
public final class WorkflowStore {
    private static final String RECORD_COLUMNS =
            "path,status,execution_count,failure_count,approved_by,approved_at_ms,flagged_for_review,created_at_ms,updated_at_ms";

    private final Database database;
    private final ConcurrentMap<String, ReentrantLock> pathLocks = new ConcurrentHashMap<>();

    public WorkflowStore(Database database) {
        this.database = database;
    }

    /**
     * Counts one execution of {@code path}. The first execution creates the record in
     * QUARANTINE and enqueues it for approval. A GOLDEN record is flagged, never demoted, once
     * its failures since approval reach {@code failureThreshold}.
     */
    public RecordedExecution recordExecution(String path, boolean success, long nowMs, int failureThreshold) {
        ReentrantLock lock = pathLocks.computeIfAbsent(path, k -> new ReentrantLock());
        lock.lock();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement insert = c.prepareStatement("""
                    INSERT OR IGNORE INTO workflow_records(path,status,execution_count,failure_count,created_at_ms,updated_at_ms)
                    VALUES(?,?,1,?,?,?)
                    """);
                 PreparedStatement bump = c.prepareStatement(
                         "UPDATE workflow_records SET execution_count=execution_count+1,failure_count=failure_count+?,updated_at_ms=? WHERE path=?");
                 PreparedStatement enqueue = c.prepareStatement(
                         "INSERT OR IGNORE INTO pending_approvals(path,enqueued_at_ms) VALUES(?,?)");
                 PreparedStatement flag = c.prepareStatement("""
                         UPDATE workflow_records SET flagged_for_review=1,updated_at_ms=?
                         WHERE path=? AND status=? AND flagged_for_review=0 AND failure_count-failures_at_approval>=?
                         """)) {
                int failed = success ? 0 : 1;
                insert.setString(1, path);
                insert.setString(2, WorkflowStatus.QUARANTINE.name());
                insert.setInt(3, failed);
                insert.setLong(4, nowMs);
                insert.setLong(5, nowMs);
                boolean created = insert.executeUpdate() == 1;
                if (created) {
                    enqueue.setString(1, path);
                    enqueue.setLong(2, nowMs);
                    enqueue.executeUpdate();
                } else {
                    bump.setInt(1, failed);
                    bump.setLong(2, nowMs);
                    bump.setString(3, path);
                    bump.executeUpdate();
                }
                boolean flagged = false;
                if (!success) {
                    flag.setLong(1, nowMs);
                    flag.setString(2, path);
                    flag.setString(3, WorkflowStatus.GOLDEN.name());
                    flag.setInt(4, Math.max(1, failureThreshold));
                    flagged = flag.executeUpdate() == 1;
                }
                WorkflowRecord record = readRecord(c, path)
                        .orElseThrow(() -> new IllegalStateException("record vanished: " + path));
                c.commit();
                return new RecordedExecution(record, created, flagged);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to record execution: " + path, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * QUARANTINE to GOLDEN. Returns {@code false} when the record was not in QUARANTINE at the
     * time of the update.
     */
    public boolean approve(String path, String approver, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE workflow_records
                    SET status=?,approved_by=?,approved_at_ms=?,failures_at_approval=failure_count,flagged_for_review=0,updated_at_ms=?
                    WHERE path=? AND status=?
                    """);
                 PreparedStatement dequeue = c.prepareStatement("DELETE FROM pending_approvals WHERE path=?")) {
                ps.setString(1, WorkflowStatus.GOLDEN.name());
                ps.setString(2, approver);
                ps.setLong(3, nowMs);
                ps.setLong(4, nowMs);
                ps.setString(5, path);
                ps.setString(6, WorkflowStatus.QUARANTINE.name());
                if (ps.executeUpdate() != 1) {
                    c.commit();
                    return false;
                }
                dequeue.setString(1, path);
                dequeue.executeUpdate();
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to approve: " + path, e);
        }
    }

    /**
     * GOLDEN back to QUARANTINE, re-entering the pending queue. Returns {@code false} when the
     * record was not GOLDEN at the time of the update.
     */
    public boolean revoke(String path, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE workflow_records
                    SET status=?,approved_by=NULL,approved_at_ms=NULL,flagged_for_review=0,updated_at_ms=?
                    WHERE path=? AND status=?
                    """);
                 PreparedStatement enqueue = c.prepareStatement(
                         "INSERT OR IGNORE INTO pending_approvals(path,enqueued_at_ms) VALUES(?,?)")) {
                ps.setString(1, WorkflowStatus.QUARANTINE.name());
                ps.setLong(2, nowMs);
                ps.setString(3, path);
                ps.setString(4, WorkflowStatus.GOLDEN.name());
                if (ps.executeUpdate() != 1) {
                    c.commit();
                    return false;
                }
                enqueue.setString(1, path);
                enqueue.setLong(2, nowMs);
                enqueue.executeUpdate();
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to revoke: " + path, e);
        }
    }

    public Optional<WorkflowRecord> find(String path) {
        try (Connection c = database.openConnection()) {
            return readRecord(c, path);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read record: " + path, e);
        }
    }

    /**
     * The stored record, or an UNRAN placeholder when the path never executed.
     */
    public WorkflowRecord recordOrUnran(String path) {
        return find(path).orElseGet(() -> WorkflowRecord.unran(path));
    }

    public List<WorkflowRecord> listRecords() {
        return queryRecords("SELECT " + RECORD_COLUMNS + " FROM workflow_records ORDER BY path");
    }

    public List<WorkflowRecord> listFlagged() {
        return queryRecords("SELECT " + RECORD_COLUMNS + " FROM workflow_records WHERE flagged_for_review=1 ORDER BY path");
    }

    public List<PendingApproval> listPending() {
        String sql = """
                SELECT p.seq,p.path,p.enqueued_at_ms,r.execution_count,r.failure_count
                FROM pending_approvals p JOIN workflow_records r ON r.path=p.path
                ORDER BY p.seq
                """;
        List<PendingApproval> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new PendingApproval(
                        rs.getLong("seq"),
                        rs.getString("path"),
                        rs.getLong("enqueued_at_ms"),
                        rs.getLong("execution_count"),
                        rs.getLong("failure_count")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list pending approvals", e);
        }
    }

    private List<WorkflowRecord> queryRecords(String sql) {
        List<WorkflowRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapRecord(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list workflow records", e);
        }
    }

    private Optional<WorkflowRecord> readRecord(Connection c, String path) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + RECORD_COLUMNS + " FROM workflow_records WHERE path=?")) {
            ps.setString(1, path);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapRecord(rs));
            }
        }
    }

    private static WorkflowRecord mapRecord(ResultSet rs) throws SQLException {
        long approvedAt = rs.getLong("approved_at_ms");
        Long approvedAtMs = rs.wasNull() ? null : approvedAt;
        return new WorkflowRecord(
                rs.getString("path"),
                WorkflowStatus.valueOf(rs.getString("status")),
                rs.getLong("execution_count"),
                rs.getLong("failure_count"),
                rs.getString("approved_by"),
                approvedAtMs,
                rs.getInt("flagged_for_review") == 1,
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    public record RecordedExecution(WorkflowRecord record, boolean created, boolean newlyFlagged) {
    }

    public record PendingApproval(long seq, String path, long enqueuedAtMs, long executionCount, long failureCount) {
    }
}
