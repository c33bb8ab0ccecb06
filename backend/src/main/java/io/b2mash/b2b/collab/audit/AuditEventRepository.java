package io.b2mash.b2b.collab.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  Page<AuditEvent> findByProjectIdOrderByOccurredAtDesc(UUID projectId, Pageable pageable);

  List<AuditEvent> findByEventType(String eventType);
}
