package io.b2mash.boq.audit;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  /** Nullable filters: {@code (:param IS NULL OR e.field = :param)}; event type is a prefix. */
  @Query(
      """
      SELECT e FROM AuditEvent e
      WHERE (CAST(:entityType AS string) IS NULL OR e.entityType = CAST(:entityType AS string))
        AND (:entityId IS NULL OR e.entityId = :entityId)
        AND (CAST(:actorId AS string) IS NULL OR e.actorId = CAST(:actorId AS string))
        AND (CAST(:eventTypePrefix AS string) IS NULL OR e.eventType LIKE CONCAT(CAST(:eventTypePrefix AS string), '%'))
      ORDER BY e.occurredAt DESC
      """)
  Page<AuditEvent> findByFilter(
      @Param("entityType") String entityType,
      @Param("entityId") UUID entityId,
      @Param("actorId") String actorId,
      @Param("eventTypePrefix") String eventTypePrefix,
      Pageable pageable);

  long countByEntityTypeAndEntityId(String entityType, UUID entityId);
}
