package io.tierkeeper.observability;

import io.tierkeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only JSON-lines record of lifecycle mutations (moves, purges, evictions, cycles).
 *
 * <p>An audit write failure is logged and never aborts the operation being audited.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final Clock clock;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException e) {
                    log.debug("Audit log {} created concurrently", auditFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("dry_run", event.dryRun());
        row.put("details", event.details());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            log.error("Failed to append audit event {} to {}", event.action(), auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String resource,
            String result,
            boolean dryRun,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String resource, String result, boolean dryRun, Map<String, Object> details) {
            return new AuditEvent(action, resource, result, dryRun, details == null ? Map.of() : details);
        }
    }
}
