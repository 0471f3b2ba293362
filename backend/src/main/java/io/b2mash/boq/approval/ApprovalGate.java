package io.b2mash.boq.approval;

import io.b2mash.boq.audit.AuditEventBuilder;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.ResourceNotFoundException;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approve / reject / visibility logic shared by shops and materials. Callers own the transaction;
 * every method is expected to run inside the caller's {@code @Transactional} boundary.
 *
 * <p>{@code approved} is a non-null boolean on these rows, so "pending" means {@code approved =
 * false}: a freshly submitted entry and a rejected one are both pending.
 */
public class ApprovalGate<T extends Approvable> {

  private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

  private final ApprovableRepository<T> repository;
  private final AuditService auditService;
  private final String resourceType;
  private final String auditEntityType;

  public ApprovalGate(
      ApprovableRepository<T> repository,
      AuditService auditService,
      String resourceType,
      String auditEntityType) {
    this.repository = repository;
    this.auditService = auditService;
    this.resourceType = resourceType;
    this.auditEntityType = auditEntityType;
  }

  /** Approves the entry. Approving an already approved entry changes nothing and returns it. */
  public T approve(UUID id) {
    require(id);
    int updated = repository.markApproved(id, Instant.now());
    if (updated > 0) {
      auditService.log(
          AuditEventBuilder.builder()
              .eventType(auditEntityType + ".approved")
              .entityType(auditEntityType)
              .entityId(id)
              .build());
      log.info("Approved {} {}", auditEntityType, id);
    } else {
      log.debug("{} {} already approved", auditEntityType, id);
    }
    return require(id);
  }

  /** Rejects the entry, keeping it in the pending listing. The reason may be null. */
  public T reject(UUID id, String reason) {
    require(id);
    repository.markRejected(id, reason, Instant.now());

    var details = new HashMap<String, Object>();
    if (reason != null) {
      details.put("reason", reason);
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(auditEntityType + ".rejected")
            .entityType(auditEntityType)
            .entityId(id)
            .details(details)
            .build());
    log.info("Rejected {} {}", auditEntityType, id);
    return require(id);
  }

  public List<T> listApproved() {
    return repository.findApproved();
  }

  public List<T> listPending() {
    return repository.findPending();
  }

  private T require(UUID id) {
    return repository.findById(id).orElseThrow(() -> new ResourceNotFoundException(resourceType, id));
  }
}
