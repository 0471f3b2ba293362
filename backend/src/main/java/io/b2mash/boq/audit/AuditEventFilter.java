package io.b2mash.boq.audit;

import java.util.UUID;

/**
 * Query filter for {@link AuditService#findEvents}. Null fields do not filter.
 *
 * @param entityType entity kind, e.g. "material"
 * @param entityId a specific entity
 * @param actorId JWT subject of the caller
 * @param eventType prefix match, "shop." matches shop.approved and shop.rejected
 */
public record AuditEventFilter(String entityType, UUID entityId, String actorId, String eventType) {}
