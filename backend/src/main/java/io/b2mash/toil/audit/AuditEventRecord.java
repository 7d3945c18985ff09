package io.b2mash.toil.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which fills in actor and request metadata.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "timesheet", "leave_allocation")
 * @param entityId ID of the affected entity
 * @param actorId JWT subject of the acting user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API, INTERNAL, SCHEDULED
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 * @param details key values of the transition as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
