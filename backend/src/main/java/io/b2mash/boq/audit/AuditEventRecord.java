package io.b2mash.boq.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which fills actor, source and request metadata.
 *
 * @param eventType {@code {entity}.{action}}, e.g. {@code submission.approved}
 * @param entityType the kind of entity being audited (e.g. "shop", "boq_version")
 * @param entityId ID of the affected entity (not a FK, the entity may be deleted later)
 * @param actorId JWT subject of the caller; null for system-initiated events
 * @param actorRole role claim of the caller; null for system-initiated events
 * @param source API for HTTP requests, INTERNAL otherwise
 * @param ipAddress client IP; null outside HTTP
 * @param userAgent truncated User-Agent header; null outside HTTP
 * @param details key field changes; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String actorId,
    String actorRole,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
