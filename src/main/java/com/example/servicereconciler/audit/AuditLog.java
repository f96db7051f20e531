package com.example.servicereconciler.audit;

import com.example.servicereconciler.config.ReconcilerProperties;
import com.example.servicereconciler.domain.ActionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only audit trail of every probe, action, escalation and skip, one JSON object per line.
 * It is the durable record from which the health timeline of each service can be rebuilt;
 * runtime state itself is never persisted.
 * <p>
 * A write failure is logged and swallowed: losing an audit line must not stop reconciliation.
 */
@Slf4j
@Service
public class AuditLog {

    private final Path auditFile;
    private final ObjectMapper objectMapper;

    @Autowired
    public AuditLog(ReconcilerProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getAudit().getFile()), objectMapper);
    }

    public AuditLog(Path auditFile, ObjectMapper objectMapper) {
        this.auditFile = auditFile.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        try {
            Path parent = this.auditFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit log directory for " + this.auditFile, e);
        }
    }

    public synchronized void append(ActionRecord record) {
        try {
            String line = objectMapper.writeValueAsString(record) + System.lineSeparator();
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            log.debug("Audit: [{}] {} {} -> {} ({})", record.tickId(), record.kind().wireName(),
                    record.serviceId(), record.result(), record.detail());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit record for {}: {}", record.serviceId(), e.getMessage());
        } catch (IOException e) {
            log.error("Failed to write audit log {}: {}", auditFile, e.getMessage());
        }
    }

    /** The newest {@code limit} records, oldest first. Unparseable lines are skipped. */
    public synchronized List<ActionRecord> recent(int limit) {
        if (limit <= 0 || !Files.exists(auditFile)) {
            return List.of();
        }
        Deque<ActionRecord> tail = new ArrayDeque<>(limit);
        try (Stream<String> lines = Files.lines(auditFile, StandardCharsets.UTF_8)) {
            lines.filter(line -> !line.isBlank()).forEach(line -> {
                try {
                    ActionRecord record = objectMapper.readValue(line, ActionRecord.class);
                    if (tail.size() == limit) tail.removeFirst();
                    tail.addLast(record);
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed audit line: {}", e.getOriginalMessage());
                }
            });
        } catch (IOException e) {
            log.error("Failed to read audit log {}: {}", auditFile, e.getMessage());
            return List.of();
        }
        return new ArrayList<>(tail);
    }

    public Path file() {
        return auditFile;
    }
}
