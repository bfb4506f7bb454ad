package io.treeshell.observability;

import io.treeshell.TreeShellFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class AuditLoggerTest {

    @Test
    void chainVerifiesAndContinuesAcrossInstances() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file);
            first.log(AuditLogger.AuditEvent.of("node.execute", "alice", "system.echo", "ok", Map.of("duration_ms", 3)));
            first.log(AuditLogger.AuditEvent.of("workflow.approved", "alice", "system.echo", "GOLDEN", Map.of()));

            AuditLogger second = new AuditLogger(file);
            Assertions.assertEquals(first.currentHash(), second.currentHash());
            second.log(AuditLogger.AuditEvent.of("config.reload", "runtime", "snapshot", "applied", Map.of()));

            AuditLogger.IntegrityReport report = second.verify();
            Assertions.assertTrue(report.ok());
            Assertions.assertEquals(3, report.checkedRows());
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }

    @Test
    void tamperedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-audit-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file);
            logger.log(AuditLogger.AuditEvent.of("node.execute", "alice", "system.echo", "ok", Map.of()));
            logger.log(AuditLogger.AuditEvent.of("node.execute", "alice", "system.math.add", "ok", Map.of()));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(0, lines.get(0).replace("\"alice\"", "\"mallory\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.IntegrityReport report = new AuditLogger(file).verify();
            Assertions.assertFalse(report.ok());
            Assertions.assertEquals(1, report.brokenLine());
            Assertions.assertEquals("hash_mismatch", report.reason());
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }

    @Test
    void sensitiveDetailsAreMasked() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-audit-");
        try {
            Path file = root.resolve("audit.log");
            new AuditLogger(file).log(AuditLogger.AuditEvent.of("node.execute", "alice", "system.echo", "ok",
                    Map.of("args", Map.of("password", "hunter2", "message", "hello"))));

            String line = Files.readString(file, StandardCharsets.UTF_8);
            Assertions.assertFalse(line.contains("hunter2"));
            Assertions.assertTrue(line.contains("hello"));
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }
}
