package io.clinic.audit;

import io.clinic.model.Actor;

import java.time.Instant;
import java.util.Objects;

/**
 * Structured notification of a committed business operation.
 *
 * @param type        event type
 * @param description human-readable summary
 * @param actorId     acting account id, {@code null} when not known
 * @param actorName   acting account display name, {@code null} when not known
 * @param actorRole   acting account role code, {@code null} when not known
 * @param targetType  kind of entity affected ({@code "appointment"} or {@code "patient"})
 * @param targetId    identifier of the affected entity
 * @param occurredAt  commit-side timestamp
 */
public record AuditEvent(
    AuditEventType type,
    String description,
    Long actorId,
    String actorName,
    String actorRole,
    String targetType,
    Long targetId,
    Instant occurredAt
) {

    public static final String TARGET_APPOINTMENT = "appointment";
    public static final String TARGET_PATIENT = "patient";

    public AuditEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    /**
     * Creates an event without actor details.
     */
    public static AuditEvent of(AuditEventType type, String description, String targetType, long targetId,
                                Instant occurredAt) {
        return new AuditEvent(type, description, null, null, null, targetType, targetId, occurredAt);
    }

    /**
     * Returns a copy carrying the given actor's id, name and role.
     */
    public AuditEvent withActor(Actor actor) {
        if (actor == null) {
            return this;
        }
        return new AuditEvent(type, description, actor.accountId(), actor.name(), actor.role().code(),
            targetType, targetId, occurredAt);
    }
}
