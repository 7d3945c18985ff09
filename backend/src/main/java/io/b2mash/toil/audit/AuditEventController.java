package io.b2mash.toil.audit;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditEventController {

  private final AuditService auditService;

  public AuditEventController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping("/api/audit-events/{entityType}/{entityId}")
  @PreAuthorize("hasRole('TOIL_ADMIN')")
  public ResponseEntity<List<AuditEventResponse>> listByEntity(
      @PathVariable String entityType,
      @PathVariable UUID entityId,
      @RequestParam(defaultValue = "50") int limit) {
    var events = auditService.findByEntity(entityType, entityId, limit);
    return ResponseEntity.ok(events.stream().map(AuditEventResponse::from).toList());
  }

  public record AuditEventResponse(
      UUID id,
      String eventType,
      String entityType,
      UUID entityId,
      String actorId,
      String actorType,
      String source,
      Map<String, Object> details,
      Instant occurredAt) {

    public static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getEventType(),
          event.getEntityType(),
          event.getEntityId(),
          event.getActorId(),
          event.getActorType(),
          event.getSource(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
