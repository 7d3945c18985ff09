package io.b2mash.toil.allocation;

import io.b2mash.toil.audit.AuditEventBuilder;
import io.b2mash.toil.audit.AuditService;
import io.b2mash.toil.config.ToilProperties;
import io.b2mash.toil.directory.EmployeeLockService;
import io.b2mash.toil.exception.InfrastructureException;
import io.b2mash.toil.exception.ResourceConflictException;
import io.b2mash.toil.exception.ResourceNotFoundException;
import io.b2mash.toil.ledger.LeaveLedgerService;
import io.b2mash.toil.timesheet.Timesheet;
import io.b2mash.toil.timesheet.TimesheetRepository;
import io.b2mash.toil.timesheet.ToilCalculator;
import io.b2mash.toil.timesheet.ToilStatus;
import jakarta.persistence.PersistenceException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.ErrorResponseException;

/**
 * Owns every change to TOIL allocations: crediting approved timesheets, taking credit back on
 * cancellation, and keeping timesheet usage status in line with the ledger.
 *
 * <p>All allocation read-modify-writes hold the employee row lock, so accruals and debits for one
 * employee are serialised while different employees proceed in parallel.
 */
@Service
public class AllocationLedgerManager {

  private static final Logger log = LoggerFactory.getLogger(AllocationLedgerManager.class);

  private final TimesheetRepository timesheetRepository;
  private final LeaveAllocationRepository allocationRepository;
  private final LeaveLedgerService ledgerService;
  private final EmployeeLockService employeeLockService;
  private final AuditService auditService;
  private final ToilProperties properties;
  private final Clock clock;
  private final TransactionTemplate accrualTx;
  private final TransactionTemplate compensationTx;

  public AllocationLedgerManager(
      TimesheetRepository timesheetRepository,
      LeaveAllocationRepository allocationRepository,
      LeaveLedgerService ledgerService,
      EmployeeLockService employeeLockService,
      AuditService auditService,
      ToilProperties properties,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this.timesheetRepository = timesheetRepository;
    this.allocationRepository = allocationRepository;
    this.ledgerService = ledgerService;
    this.employeeLockService = employeeLockService;
    this.auditService = auditService;
    this.properties = properties;
    this.clock = clock;
    this.accrualTx = new TransactionTemplate(transactionManager);
    this.compensationTx = new TransactionTemplate(transactionManager);
    this.compensationTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * Credits an approved timesheet's TOIL to the employee's open allocation, creating one if no
   * window is open today. Safe to call more than once for the same timesheet.
   *
   * <p>On failure the whole accrual rolls back, then a separate transaction puts the timesheet back
   * to DRAFT / PENDING_ACCRUAL with no allocation before the error is rethrown. The timesheet
   * records whether the failure was retryable.
   *
   * @throws InfrastructureException for lock and persistence failures (retryable)
   * @throws ResourceConflictException if the timesheet is not eligible for accrual or a data
   *     constraint rejects the write
   * @throws ResourceNotFoundException if the timesheet does not exist
   */
  public AccrualResult accrue(UUID timesheetId) {
    try {
      return accrualTx.execute(status -> accrueInTransaction(timesheetId));
    } catch (RuntimeException e) {
      RuntimeException failure = translate(timesheetId, e);
      compensate(timesheetId, failure);
      throw failure;
    }
  }

  private AccrualResult accrueInTransaction(UUID timesheetId) {
    var timesheet =
        timesheetRepository
            .findById(timesheetId)
            .orElseThrow(() -> new ResourceNotFoundException("Timesheet", timesheetId));

    if (timesheet.isAccrued()) {
      log.info(
          "Timesheet {} already accrued to allocation {}; nothing to do",
          timesheetId,
          timesheet.getToilAllocationId());
      return AccrualResult.alreadyAccrued(timesheetId, timesheet.getToilAllocationId());
    }
    if (!timesheet.isAwaitingAccrual()) {
      throw new ResourceConflictException(
          "NOT_ELIGIBLE_FOR_ACCRUAL",
          "Timesheet not eligible for accrual",
          "Timesheet "
              + timesheetId
              + " is "
              + timesheet.getStatus()
              + "/"
              + timesheet.getToilStatus()
              + " and cannot accrue TOIL");
    }

    var days = ToilCalculator.allocationDays(timesheet.getToilDays());
    if (days.signum() == 0) {
      timesheet.markNothingToAccrue();
      timesheetRepository.save(timesheet);
      return AccrualResult.nothingToAccrue(timesheetId);
    }

    // 1. Serialise with every other allocation change for this employee
    employeeLockService.lock(timesheet.getEmployeeId());

    // 2. Top up the window that is open today, or start a new one
    var today = LocalDate.now(clock);
    var open = allocationRepository.findOpenOn(timesheet.getEmployeeId(), today);
    boolean toppedUp = !open.isEmpty();
    LeaveAllocation allocation;
    if (toppedUp) {
      allocation = open.get(0);
      allocation.topUp(days, timesheet.getTotalToilHours());
    } else {
      allocation =
          new LeaveAllocation(
              timesheet.getEmployeeId(),
              today,
              today.plusMonths(properties.allocationValidityMonths()),
              days,
              timesheet.getTotalToilHours(),
              timesheetId);
    }
    allocation = allocationRepository.save(allocation);

    // 3. Credit the ledger
    ledgerService.appendCredit(allocation, timesheetId, days);

    // 4. Link the timesheet
    timesheet.markAccrued(allocation.getId(), days);
    timesheetRepository.save(timesheet);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("timesheet.toil_accrued")
            .entityType("timesheet")
            .entityId(timesheetId)
            .details(
                Map.of(
                    "allocation_id", allocation.getId().toString(),
                    "credited_days", days.toPlainString(),
                    "allocation_total", allocation.getNewLeavesAllocated().toPlainString(),
                    "topped_up", toppedUp))
            .build());

    log.info(
        "Accrued {} TOIL day(s) from timesheet {} to allocation {} ({}; total {})",
        days,
        timesheetId,
        allocation.getId(),
        toppedUp ? "top-up" : "new",
        allocation.getNewLeavesAllocated());

    return new AccrualResult(timesheetId, allocation.getId(), days, toppedUp, false);
  }

  private void compensate(UUID timesheetId, RuntimeException failure) {
    try {
      compensationTx.executeWithoutResult(
          status ->
              timesheetRepository
                  .findById(timesheetId)
                  .filter(Timesheet::isAwaitingAccrual)
                  .ifPresent(timesheet -> revertToDraft(timesheet, failure)));
    } catch (RuntimeException compensationFailure) {
      failure.addSuppressed(compensationFailure);
      log.error(
          "Could not revert timesheet {} after accrual failure; the pending-accrual sweeper will"
              + " pick it up",
          timesheetId,
          compensationFailure);
    }
  }

  private void revertToDraft(Timesheet timesheet, RuntimeException failure) {
    timesheet.markAccrualFailed(
        failure.getMessage(), failure instanceof InfrastructureException);
    timesheetRepository.save(timesheet);

    var details = new HashMap<String, Object>();
    details.put("error", failure.getMessage() != null ? failure.getMessage() : "unknown");
    details.put("retryable", failure instanceof InfrastructureException);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("timesheet.toil_accrual_failed")
            .entityType("timesheet")
            .entityId(timesheet.getId())
            .details(details)
            .build());

    log.warn(
        "Accrual failed for timesheet {}; reverted to DRAFT/PENDING_ACCRUAL: {}",
        timesheet.getId(),
        failure.getMessage());
  }

  private static RuntimeException translate(UUID timesheetId, RuntimeException e) {
    if (e instanceof ErrorResponseException) {
      return e;
    }
    // Retrying the same rows hits the same constraint
    if (e instanceof DataIntegrityViolationException) {
      return new ResourceConflictException(
          "ACCRUAL_INTEGRITY_VIOLATION",
          "Accrual rejected by a data constraint",
          "Could not record TOIL accrual for timesheet " + timesheetId + ": " + e.getMessage(),
          e);
    }
    if (e instanceof DataAccessException
        || e instanceof TransactionException
        || e instanceof PersistenceException) {
      return new InfrastructureException(
          "ACCRUAL_PERSISTENCE_FAILURE",
          "Could not record TOIL accrual for timesheet " + timesheetId + ": " + e.getMessage(),
          e);
    }
    return e;
  }

  /**
   * Takes a cancelled timesheet's own contribution back out of its allocation and posts the
   * reversal. Refused once any of the allocation has been consumed or it has expired.
   *
   * @throws ResourceConflictException with code TOIL_CONSUMED or TOIL_EXPIRED
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public ReleaseResult releaseContribution(Timesheet timesheet) {
    var allocationId = timesheet.getToilAllocationId();
    employeeLockService.lock(timesheet.getEmployeeId());

    var allocation =
        allocationRepository
            .findById(allocationId)
            .orElseThrow(() -> new ResourceNotFoundException("Leave allocation", allocationId));

    var today = LocalDate.now(clock);
    if (!properties.isWindowOpen(allocation.getFromDate(), allocation.getToDate(), today)) {
      throw new ResourceConflictException(
          "TOIL_EXPIRED",
          "TOIL already expired",
          "The TOIL from this timesheet expired on "
              + allocation.getToDate()
              + " and can no longer be cancelled");
    }

    var balance = ledgerService.allocationBalance(allocationId);
    var consumed = allocation.getNewLeavesAllocated().subtract(balance);
    if (consumed.signum() > 0) {
      throw new ResourceConflictException(
          "TOIL_CONSUMED",
          "TOIL already used",
          "Cannot cancel: "
              + consumed.stripTrailingZeros().toPlainString()
              + " day(s) of the linked TOIL allocation have been used. Cancel the dependent leave"
              + " applications first.");
    }

    var days = timesheet.getToilAccruedDays();
    boolean cancelled = allocation.reduce(days, timesheet.getTotalToilHours());
    allocationRepository.save(allocation);
    ledgerService.appendAllocationReversal(allocation, timesheet.getId(), days);

    log.info(
        "Released {} day(s) of allocation {} for cancelled timesheet {} (remaining {}{})",
        days,
        allocationId,
        timesheet.getId(),
        allocation.getNewLeavesAllocated(),
        cancelled ? ", allocation cancelled" : "");

    return new ReleaseResult(allocationId, days, allocation.getNewLeavesAllocated(), cancelled);
  }

  /**
   * Sets PARTIALLY_USED / FULLY_USED / ACCRUED on the timesheets feeding an allocation from its
   * current ledger balance. Display only.
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public void refreshUsageStatus(UUID allocationId) {
    var allocation =
        allocationRepository
            .findById(allocationId)
            .orElseThrow(() -> new ResourceNotFoundException("Leave allocation", allocationId));
    var balance = ledgerService.allocationBalance(allocationId);
    var usage = usageFor(allocation.getNewLeavesAllocated(), balance);
    var timesheets =
        timesheetRepository.findByToilAllocationIdAndToilStatusIn(
            allocationId, ToilStatus.USAGE_STATES);
    for (var timesheet : timesheets) {
      if (timesheet.getToilStatus() != usage) {
        timesheet.updateUsage(usage);
        timesheetRepository.save(timesheet);
      }
    }
  }

  static ToilStatus usageFor(BigDecimal allocated, BigDecimal balance) {
    if (balance.signum() <= 0) {
      return ToilStatus.FULLY_USED;
    }
    return balance.compareTo(allocated) < 0 ? ToilStatus.PARTIALLY_USED : ToilStatus.ACCRUED;
  }
}
