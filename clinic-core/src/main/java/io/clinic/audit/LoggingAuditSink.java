package io.clinic.audit;

import io.clinic.spi.AuditSink;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link AuditSink} that writes each event as one line to the {@code io.clinic.audit} logger.
 */
public final class LoggingAuditSink implements AuditSink {
    private static final Logger logger = Logger.getLogger("io.clinic.audit");

    private final Level level;

    public LoggingAuditSink() {
        this(Level.INFO);
    }

    public LoggingAuditSink(Level level) {
        this.level = level == null ? Level.INFO : level;
    }

    @Override
    public void record(AuditEvent event) {
        if (!logger.isLoggable(level)) {
            return;
        }
        StringBuilder line = new StringBuilder(128)
            .append(event.type().code())
            .append(": ")
            .append(event.description());
        if (event.targetType() != null) {
            line.append(" [").append(event.targetType()).append('=').append(event.targetId()).append(']');
        }
        if (event.actorId() != null || event.actorName() != null) {
            line.append(" by ").append(event.actorName() == null ? "?" : event.actorName());
            if (event.actorId() != null) {
                line.append('#').append(event.actorId());
            }
            if (event.actorRole() != null) {
                line.append(" (").append(event.actorRole()).append(')');
            }
        }
        logger.log(level, line.toString());
    }
}
