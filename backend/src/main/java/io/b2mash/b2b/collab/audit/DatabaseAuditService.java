package io.b2mash.b2b.collab.audit;

import io.b2mash.b2b.collab.member.MemberRepository;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed {@link AuditService}. {@code log()} joins the caller's transaction, so an
 * operation that rolls back leaves no audit row behind.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final MemberRepository memberRepository;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository, MemberRepository memberRepository) {
    this.auditEventRepository = auditEventRepository;
    this.memberRepository = memberRepository;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    var event = new AuditEvent(withActorName(record));
    auditEventRepository.save(event);
    log.debug(
        "Recorded audit event: type={}, entity={}/{}, actor={}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.actorId());
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditEvent> findProjectEvents(UUID projectId, Pageable pageable) {
    return auditEventRepository.findByProjectIdOrderByOccurredAtDesc(projectId, pageable);
  }

  private AuditEventRecord withActorName(AuditEventRecord record) {
    var details =
        new HashMap<String, Object>(record.details() != null ? record.details() : Map.of());
    if (!details.containsKey("actor_name")) {
      if (record.actorId() != null) {
        memberRepository
            .findById(record.actorId())
            .map(member -> member.getName() != null ? member.getName() : member.getEmail())
            .ifPresent(name -> details.put("actor_name", name));
      }
      details.putIfAbsent("actor_name", "System");
    }
    return new AuditEventRecord(
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.projectId(),
        record.actorId(),
        record.actorType(),
        record.source(),
        record.ipAddress(),
        record.userAgent(),
        details);
  }
}
