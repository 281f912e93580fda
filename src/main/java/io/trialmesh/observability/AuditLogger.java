package io.trialmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.trialmesh.util.Hashing;
import io.trialmesh.util.Jsons;

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
 * Append-only JSON-lines log of run lifecycle events. Each row carries the hash of the
 * previous row, so truncation or edits break the chain.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String project;
    private String previousHash;

    public AuditLogger(Path auditFile, String project) {
        this.auditFile = auditFile;
        this.project = project == null || project.isBlank() ? "default" : project.trim();
        try {
            Files.createDirectories(auditFile.getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("project", project);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("sim_id", event.simId());
        row.put("run_id", event.runId());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
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
     * Recomputes every row hash. Returns the number of valid rows, or throws at the first
     * broken link.
     */
    public synchronized int verifyChain() {
        List<String> lines;
        try {
            lines = Files.exists(auditFile) ? Files.readAllLines(auditFile, StandardCharsets.UTF_8) : List.of();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        int count = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>(Jsons.toMap(line));
            Object hash = row.remove("hash");
            if (!expectedPrev.equals(row.get("prev_hash"))) {
                throw new IllegalStateException("Audit chain broken at row " + (count + 1) + ": prev_hash mismatch");
            }
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(hash)) {
                throw new IllegalStateException("Audit chain broken at row " + (count + 1) + ": hash mismatch");
            }
            expectedPrev = recomputed;
            count++;
        }
        return count;
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
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Long simId,
            Long runId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result,
                                    Long simId, Long runId, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, simId, runId, details == null ? Map.of() : details);
        }
    }
}
