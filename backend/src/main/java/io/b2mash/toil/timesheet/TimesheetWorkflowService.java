package io.b2mash.toil.timesheet;

import io.b2mash.toil.accrual.ToilAccrualRequestedEvent;
import io.b2mash.toil.allocation.AllocationLedgerManager;
import io.b2mash.toil.audit.AuditEventBuilder;
import io.b2mash.toil.audit.AuditService;
import io.b2mash.toil.directory.Employee;
import io.b2mash.toil.directory.EmployeeAccessPolicy;
import io.b2mash.toil.directory.EmployeeRepository;
import io.b2mash.toil.exception.ForbiddenException;
import io.b2mash.toil.exception.ResourceConflictException;
import io.b2mash.toil.exception.ResourceNotFoundException;
import io.b2mash.toil.exception.ValidationException;
import io.b2mash.toil.security.CallerIdentity;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Timesheet state machine: submit for approval, supervisor decision, cancellation.
 *
 * <p>Approval does not accrue. It publishes {@link ToilAccrualRequestedEvent}, which is handed to
 * the background worker once this transaction commits; the timesheet stays PENDING_ACCRUAL until
 * the worker links it to an allocation or reverts it. Replaying an already-applied transition
 * returns the current state.
 */
@Service
public class TimesheetWorkflowService {

  private static final Logger log = LoggerFactory.getLogger(TimesheetWorkflowService.class);

  static final int MIN_REJECTION_REASON_LENGTH = 10;

  private final TimesheetRepository timesheetRepository;
  private final EmployeeRepository employeeRepository;
  private final SupervisorApprovalGuard approvalGuard;
  private final EmployeeAccessPolicy accessPolicy;
  private final AllocationLedgerManager allocationLedgerManager;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public TimesheetWorkflowService(
      TimesheetRepository timesheetRepository,
      EmployeeRepository employeeRepository,
      SupervisorApprovalGuard approvalGuard,
      EmployeeAccessPolicy accessPolicy,
      AllocationLedgerManager allocationLedgerManager,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.timesheetRepository = timesheetRepository;
    this.employeeRepository = employeeRepository;
    this.approvalGuard = approvalGuard;
    this.accessPolicy = accessPolicy;
    this.allocationLedgerManager = allocationLedgerManager;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Sends a draft to the employee's supervisor. Fails early when the approval route is broken so
   * the employee is not left waiting on nobody.
   */
  @Transactional
  public Timesheet submitForApproval(UUID timesheetId, CallerIdentity caller) {
    var timesheet = findTimesheet(timesheetId);
    var employee = findEmployee(timesheet.getEmployeeId());

    if (!caller.isPrivileged() && !caller.is(employee.getUserId())) {
      throw new ForbiddenException(
          "NOT_TIMESHEET_OWNER",
          "Access denied",
          "Only " + employee.getName() + " can submit this timesheet");
    }
    if (timesheet.getStatus() == TimesheetStatus.CANCELLED) {
      throw new ResourceConflictException(
          "TIMESHEET_CANCELLED",
          "Timesheet cancelled",
          "Timesheet " + timesheetId + " is cancelled");
    }
    if (timesheet.getStatus() == TimesheetStatus.SUBMITTED) {
      throw new ResourceConflictException(
          "ALREADY_SUBMITTED",
          "Already submitted",
          "Timesheet " + timesheetId + " has already been approved and submitted");
    }
    if (timesheet.isAwaitingApproval() || timesheet.getApprovedAt() != null) {
      log.debug("Timesheet {} already awaiting approval or accrual", timesheetId);
      return timesheet;
    }

    approvalGuard.resolveApprovalRoute(employee);

    timesheet.requestApproval(Instant.now(clock));
    timesheetRepository.save(timesheet);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("timesheet.approval_requested")
            .entityType("timesheet")
            .entityId(timesheetId)
            .details(
                Map.of(
                    "toil_hours", timesheet.getTotalToilHours().toPlainString(),
                    "toil_days", timesheet.getToilDays().toPlainString()))
            .build());

    log.info(
        "Timesheet {} submitted for approval ({} TOIL hours)",
        timesheetId,
        timesheet.getTotalToilHours());
    return timesheet;
  }

  /**
   * Records the supervisor's decision.
   *
   * @param decision approved or rejected
   * @param reason required for rejection, at least ten characters
   */
  @Transactional
  public Timesheet setApproval(
      UUID timesheetId, ApprovalDecision decision, String reason, CallerIdentity caller) {
    var timesheet = findTimesheet(timesheetId);
    var employee = findEmployee(timesheet.getEmployeeId());

    approvalGuard.requireApprover(employee, caller);

    if (timesheet.getStatus() == TimesheetStatus.CANCELLED) {
      throw new ResourceConflictException(
          "TIMESHEET_CANCELLED",
          "Timesheet cancelled",
          "Timesheet " + timesheetId + " is cancelled");
    }

    return decision == ApprovalDecision.APPROVED
        ? approve(timesheet, caller)
        : reject(timesheet, reason, caller);
  }

  private Timesheet approve(Timesheet timesheet, CallerIdentity caller) {
    if (timesheet.getApprovedAt() != null) {
      // A compensated accrual keeps its approval; approving again re-queues it
      if (timesheet.getStatus() == TimesheetStatus.DRAFT && timesheet.isAwaitingAccrual()) {
        log.info("Re-queueing accrual for timesheet {} after earlier failure", timesheet.getId());
        eventPublisher.publishEvent(
            new ToilAccrualRequestedEvent(
                timesheet.getId(),
                timesheet.getEmployeeId(),
                timesheet.getToilDays(),
                Instant.now(clock)));
      } else {
        log.debug("Timesheet {} already approved; returning current state", timesheet.getId());
      }
      return timesheet;
    }
    requireAwaitingApproval(timesheet);

    var now = Instant.now(clock);
    timesheet.approve(caller.userId(), now);
    timesheetRepository.save(timesheet);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("timesheet.approved")
            .entityType("timesheet")
            .entityId(timesheet.getId())
            .details(
                Map.of(
                    "approved_by", caller.userId(),
                    "toil_days", timesheet.getToilDays().toPlainString()))
            .build());

    if (timesheet.hasToil()) {
      eventPublisher.publishEvent(
          new ToilAccrualRequestedEvent(
              timesheet.getId(), timesheet.getEmployeeId(), timesheet.getToilDays(), now));
    }

    log.info(
        "Timesheet {} approved by {}; {} TOIL day(s) queued for accrual",
        timesheet.getId(),
        caller.userId(),
        timesheet.getToilDays());
    return timesheet;
  }

  private Timesheet reject(Timesheet timesheet, String reason, CallerIdentity caller) {
    var trimmed = reason != null ? reason.trim() : "";
    if (trimmed.length() < MIN_REJECTION_REASON_LENGTH) {
      throw new ValidationException(
          "REJECTION_REASON_TOO_SHORT",
          "Rejection reason required",
          "Give a rejection reason of at least "
              + MIN_REJECTION_REASON_LENGTH
              + " characters so the employee knows what to fix");
    }
    if (timesheet.isRejected()) {
      log.debug("Timesheet {} already rejected; returning current state", timesheet.getId());
      return timesheet;
    }
    if (timesheet.getApprovedAt() != null) {
      throw new ResourceConflictException(
          "ALREADY_APPROVED",
          "Already approved",
          "Timesheet " + timesheet.getId() + " was approved and can no longer be rejected");
    }
    requireAwaitingApproval(timesheet);

    timesheet.reject(trimmed);
    timesheetRepository.save(timesheet);

    var details = new HashMap<String, Object>();
    details.put("rejected_by", caller.userId());
    details.put("reason", trimmed);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("timesheet.rejected")
            .entityType("timesheet")
            .entityId(timesheet.getId())
            .details(details)
            .build());

    log.info("Timesheet {} rejected by {}", timesheet.getId(), caller.userId());
    return timesheet;
  }

  /**
   * Cancels an accrued timesheet and takes its TOIL back out of the allocation. Refused while the
   * accrual is still in flight or once any of the allocation has been used.
   */
  @Transactional
  public Timesheet cancel(UUID timesheetId, CallerIdentity caller) {
    var timesheet = findTimesheet(timesheetId);
    var employee = findEmployee(timesheet.getEmployeeId());

    if (!caller.isPrivileged()
        && !caller.is(employee.getUserId())
        && !accessPolicy.isSupervisorOf(employee, caller)) {
      throw new ForbiddenException(
          "CANCEL_NOT_ALLOWED",
          "Access denied",
          "Only the employee, their supervisor or an administrator can cancel this timesheet");
    }
    if (timesheet.getStatus() == TimesheetStatus.CANCELLED) {
      log.debug("Timesheet {} already cancelled", timesheetId);
      return timesheet;
    }
    if (timesheet.getStatus() != TimesheetStatus.SUBMITTED) {
      throw new ResourceConflictException(
          "NOT_SUBMITTED",
          "Timesheet not submitted",
          "Only approved timesheets can be cancelled; edit or abandon the draft instead");
    }
    if (timesheet.isAwaitingAccrual()) {
      throw new ResourceConflictException(
          "ACCRUAL_IN_PROGRESS",
          "Accrual in progress",
          "TOIL for timesheet " + timesheetId + " is still being accrued. Try again shortly.");
    }

    var details = new HashMap<String, Object>();
    details.put("cancelled_by", caller.userId());
    if (timesheet.getToilAllocationId() != null) {
      var release = allocationLedgerManager.releaseContribution(timesheet);
      details.put("allocation_id", release.allocationId().toString());
      details.put("released_days", release.releasedDays().toPlainString());
      details.put("allocation_cancelled", release.cancelled());
    }

    timesheet.cancel();
    timesheetRepository.save(timesheet);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("timesheet.cancelled")
            .entityType("timesheet")
            .entityId(timesheetId)
            .details(details)
            .build());

    log.info("Timesheet {} cancelled by {}", timesheetId, caller.userId());
    return timesheet;
  }

  private static void requireAwaitingApproval(Timesheet timesheet) {
    if (!timesheet.isAwaitingApproval()) {
      throw new ResourceConflictException(
          "APPROVAL_NOT_REQUESTED",
          "Approval not requested",
          "Timesheet " + timesheet.getId() + " has not been submitted for approval");
    }
  }

  private Timesheet findTimesheet(UUID timesheetId) {
    return timesheetRepository
        .findById(timesheetId)
        .orElseThrow(() -> new ResourceNotFoundException("Timesheet", timesheetId));
  }

  private Employee findEmployee(UUID employeeId) {
    return employeeRepository
        .findById(employeeId)
        .orElseThrow(() -> new ResourceNotFoundException("Employee", employeeId));
  }
}
