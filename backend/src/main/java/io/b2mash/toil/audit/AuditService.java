package io.b2mash.toil.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads the audit trail of TOIL state transitions. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   */
  void log(AuditEventRecord record);

  /** Most recent events for one entity, newest first. */
  List<AuditEvent> findByEntity(String entityType, UUID entityId, int limit);
}
