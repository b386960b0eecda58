package io.validatorpool.observability;

import com.fasterxml.jackson.core.type.TypeReference;
import io.validatorpool.util.Hashing;
import io.validatorpool.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only JSON-lines log of committed pool events. Each row carries the hash of the previous row, so
 * {@link #verify()} detects edits or truncation in the middle of the file.
 */
public final class PoolEventLog {
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final Path eventFile;
    private final String namespace;
    private String previousHash;

    public PoolEventLog(Path eventFile, String namespace) {
        this.eventFile = eventFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        try {
            Files.createDirectories(eventFile.getParent());
            if (!Files.exists(eventFile)) {
                try {
                    Files.createFile(eventFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize pool event log: " + eventFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void append(PoolEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("recorded_at", Instant.now().toString());
        row.put("namespace", namespace);
        row.put("event", event.type());
        row.put("subject", event.subject());
        row.put("occurred_at", event.occurredAt());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(eventFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write pool event log", e);
        }
    }

    public synchronized void appendAll(List<PoolEvent> events) {
        for (PoolEvent event : events) {
            append(event);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized List<Map<String, Object>> tail(int limit) {
        List<Map<String, Object>> rows = readRows();
        int from = Math.max(0, rows.size() - Math.max(1, limit));
        return List.copyOf(rows.subList(from, rows.size()));
    }

    public synchronized VerifyOutcome verify() {
        List<Map<String, Object>> rows = readRows();
        String expectedPrev = "";
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = new LinkedHashMap<>(rows.get(i));
            Object storedHash = row.remove("hash");
            if (!Objects.equals(expectedPrev, row.get("prev_hash"))) {
                return new VerifyOutcome(false, rows.size(), i + 1, "prev_hash mismatch");
            }
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(storedHash)) {
                return new VerifyOutcome(false, rows.size(), i + 1, "hash mismatch");
            }
            expectedPrev = recomputed;
        }
        return new VerifyOutcome(true, rows.size(), -1, "ok");
    }

    private String loadLastHash() {
        List<Map<String, Object>> rows = readRows();
        if (rows.isEmpty()) {
            return "";
        }
        Object hash = rows.get(rows.size() - 1).get("hash");
        return hash == null ? "" : hash.toString();
    }

    private List<Map<String, Object>> readRows() {
        List<Map<String, Object>> rows = new ArrayList<>();
        try {
            if (!Files.exists(eventFile)) {
                return rows;
            }
            for (String line : Files.readAllLines(eventFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    rows.add(Jsons.mapper().readValue(line, ROW_TYPE));
                }
            }
            return rows;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read pool event log: " + eventFile, e);
        }
    }

    public record PoolEvent(
            String type,
            String subject,
            long occurredAt,
            Map<String, Object> details
    ) {
        public static PoolEvent of(String type, Object subject, long occurredAt, Map<String, Object> details) {
            return new PoolEvent(
                    type,
                    subject == null ? null : subject.toString(),
                    occurredAt,
                    details == null ? Map.of() : new LinkedHashMap<>(details)
            );
        }
    }

    public record VerifyOutcome(boolean valid, int rows, int firstBrokenRow, String message) {
    }
}
