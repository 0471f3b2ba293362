package io.b2mash.boq.audit;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is rolled back too.
   */
  void log(AuditEventRecord record);

  /** Events matching the filter, newest first. */
  Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable);
}
