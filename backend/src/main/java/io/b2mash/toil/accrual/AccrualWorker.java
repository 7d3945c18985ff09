package io.b2mash.toil.accrual;

import io.b2mash.toil.allocation.AccrualResult;
import io.b2mash.toil.allocation.AllocationLedgerManager;
import io.b2mash.toil.exception.InfrastructureException;
import io.b2mash.toil.exception.ResourceConflictException;
import io.b2mash.toil.exception.ResourceNotFoundException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.ErrorResponseException;

/**
 * Runs one accrual job on a worker thread. Lock and persistence failures are retried with
 * exponential backoff; business refusals are not. Every attempt that fails has already been
 * compensated by {@link AllocationLedgerManager#accrue(UUID)}, so a job that gives up leaves the
 * timesheet in DRAFT / PENDING_ACCRUAL for the sweeper or a fresh approval.
 */
@Component
public class AccrualWorker {

  private static final Logger log = LoggerFactory.getLogger(AccrualWorker.class);

  static final String MDC_TIMESHEET_ID = "timesheetId";

  private final AllocationLedgerManager allocationLedgerManager;
  private final RetryTemplate accrualRetryTemplate;
  private final ApplicationEventPublisher eventPublisher;

  public AccrualWorker(
      AllocationLedgerManager allocationLedgerManager,
      RetryTemplate accrualRetryTemplate,
      ApplicationEventPublisher eventPublisher) {
    this.allocationLedgerManager = allocationLedgerManager;
    this.accrualRetryTemplate = accrualRetryTemplate;
    this.eventPublisher = eventPublisher;
  }

  /** Accrues one timesheet, publishing a completed or failed event. Never throws. */
  public void process(UUID timesheetId) {
    MDC.put(MDC_TIMESHEET_ID, timesheetId.toString());
    var attempts = new AtomicInteger();
    try {
      AccrualResult result =
          accrualRetryTemplate.execute(
              context -> {
                attempts.incrementAndGet();
                if (context.getRetryCount() > 0) {
                  log.info(
                      "Retrying accrual for timesheet {} (attempt {})",
                      timesheetId,
                      attempts.get());
                }
                return allocationLedgerManager.accrue(timesheetId);
              });
      eventPublisher.publishEvent(
          new ToilAccrualCompletedEvent(
              timesheetId,
              result.allocationId(),
              result.creditedDays(),
              result.toppedUp(),
              attempts.get()));
    } catch (InfrastructureException e) {
      log.error(
          "Accrual for timesheet {} failed after {} attempt(s): {}",
          timesheetId,
          attempts.get(),
          e.getMessage());
      publishFailure(timesheetId, e.getCode(), e.getMessage(), true, attempts.get());
    } catch (ResourceNotFoundException e) {
      log.warn("Timesheet {} vanished before accrual", timesheetId);
      publishFailure(timesheetId, "NOT_FOUND", e.getMessage(), false, attempts.get());
    } catch (ResourceConflictException e) {
      log.warn("Accrual refused for timesheet {}: {}", timesheetId, e.getMessage());
      publishFailure(timesheetId, e.getCode(), e.getMessage(), false, attempts.get());
    } catch (ErrorResponseException e) {
      log.warn("Accrual refused for timesheet {}: {}", timesheetId, e.getMessage());
      publishFailure(timesheetId, "ACCRUAL_REFUSED", e.getMessage(), false, attempts.get());
    } catch (RuntimeException e) {
      log.error("Unexpected error accruing TOIL for timesheet {}", timesheetId, e);
      publishFailure(timesheetId, "ACCRUAL_FAILED", e.getMessage(), false, attempts.get());
    } finally {
      MDC.remove(MDC_TIMESHEET_ID);
    }
  }

  private void publishFailure(
      UUID timesheetId, String code, String message, boolean retryable, int attempts) {
    try {
      eventPublisher.publishEvent(
          new ToilAccrualFailedEvent(timesheetId, code, message, retryable, attempts));
    } catch (RuntimeException e) {
      log.error("Could not publish accrual failure for timesheet {}", timesheetId, e);
    }
  }
}
