package io.b2mash.b2b.collab.audit;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/** Records and queries the membership audit trail. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is rolled back too (no REQUIRES_NEW).
   */
  void log(AuditEventRecord record);

  /** Events recorded against a project, newest first. */
  Page<AuditEvent> findProjectEvents(UUID projectId, Pageable pageable);
}
