package io.treeshell.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.util.Hashing;
import io.treeshell.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row, so any
 * edit or deletion breaks the chain from that row on.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log directory: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes every row hash and checks each {@code prev_hash} link.
     */
    public synchronized IntegrityReport verify() {
        if (!Files.exists(auditFile)) {
            return new IntegrityReport(true, 0, 0, "");
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
        int checked = 0;
        String expectedPrev = "";
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(line);
            } catch (JsonProcessingException e) {
                return new IntegrityReport(false, checked, i + 1, "invalid_json");
            }
            if (!parsed.path("prev_hash").asText("").equals(expectedPrev)) {
                return new IntegrityReport(false, checked, i + 1, "prev_hash_mismatch");
            }
            String hash = parsed.path("hash").asText("");
            ObjectNode canonical = parsed.deepCopy();
            canonical.remove("hash");
            if (!Hashing.sha256Hex(toCompactJson(canonical)).equals(hash)) {
                return new IntegrityReport(false, checked, i + 1, "hash_mismatch");
            }
            checked++;
            expectedPrev = hash;
        }
        return new IntegrityReport(true, checked, 0, "");
    }

    private String loadLastHash() {
        if (!Files.exists(auditFile)) {
            return "";
        }
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            log.warn("Audit log {} has an unreadable tail, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    private Object sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        return SensitiveDataMasker.masked(Jsons.mapper().valueToTree(input));
    }

    private String toCompactJson(Object row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }

    public record IntegrityReport(boolean ok, int checkedRows, int brokenLine, String reason) {
    }
}
