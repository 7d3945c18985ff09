package io.b2mash.toil.accrual;

import io.b2mash.toil.audit.AuditEventBuilder;
import io.b2mash.toil.audit.AuditService;
import java.util.HashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class AccrualOutcomeListener {

  private static final Logger log = LoggerFactory.getLogger(AccrualOutcomeListener.class);

  private final AuditService auditService;

  public AccrualOutcomeListener(AuditService auditService) {
    this.auditService = auditService;
  }

  @EventListener
  public void onCompleted(ToilAccrualCompletedEvent event) {
    if (event.allocationId() == null) {
      log.info("Timesheet {} approved with no TOIL to credit", event.timesheetId());
      return;
    }
    log.info(
        "Accrual job finished for timesheet {}: {} day(s) to allocation {} after {} attempt(s)",
        event.timesheetId(),
        event.creditedDays(),
        event.allocationId(),
        event.attempts());
  }

  /** Records that the worker stopped trying; the per-attempt failures are audited already. */
  @EventListener
  public void onFailed(ToilAccrualFailedEvent event) {
    var details = new HashMap<String, Object>();
    details.put("error_code", event.errorCode());
    details.put("message", event.message() != null ? event.message() : "unknown");
    details.put("retryable", event.retryable());
    details.put("attempts", event.attempts());
    try {
      auditService.log(
          AuditEventBuilder.builder()
              .eventType("timesheet.toil_accrual_abandoned")
              .entityType("timesheet")
              .entityId(event.timesheetId())
              .details(details)
              .build());
    } catch (RuntimeException e) {
      log.error("Could not audit abandoned accrual for timesheet {}", event.timesheetId(), e);
    }
    if (event.retryable()) {
      log.warn(
          "Accrual for timesheet {} abandoned after {} attempt(s) ({}); sweeper will retry",
          event.timesheetId(),
          event.attempts(),
          event.errorCode());
    } else {
      log.warn(
          "Accrual for timesheet {} refused ({}): {}",
          event.timesheetId(),
          event.errorCode(),
          event.message());
    }
  }
}
