package io.b2mash.toil.leave;

import io.b2mash.toil.allocation.AllocationLedgerManager;
import io.b2mash.toil.allocation.LeaveAllocation;
import io.b2mash.toil.allocation.LeaveAllocationRepository;
import io.b2mash.toil.audit.AuditEventBuilder;
import io.b2mash.toil.audit.AuditService;
import io.b2mash.toil.config.ToilProperties;
import io.b2mash.toil.consumption.AvailableAllocation;
import io.b2mash.toil.consumption.ConsumptionSlice;
import io.b2mash.toil.consumption.FifoConsumptionPlanner;
import io.b2mash.toil.consumption.FifoConsumptionTracker;
import io.b2mash.toil.directory.Employee;
import io.b2mash.toil.directory.EmployeeAccessPolicy;
import io.b2mash.toil.directory.EmployeeLockService;
import io.b2mash.toil.directory.EmployeeSetupService;
import io.b2mash.toil.directory.EmployeeRepository;
import io.b2mash.toil.exception.ForbiddenException;
import io.b2mash.toil.exception.ResourceNotFoundException;
import io.b2mash.toil.exception.ValidationException;
import io.b2mash.toil.ledger.LeaveLedgerEntry;
import io.b2mash.toil.ledger.LeaveLedgerService;
import io.b2mash.toil.ledger.TransactionType;
import io.b2mash.toil.security.CallerIdentity;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records TOIL taken as leave. Days are debited from allocations oldest-first at submission; a
 * cancellation posts matching reversals. Both run under the employee lock so they serialise with
 * accruals and cancellations for the same employee.
 */
@Service
public class LeaveApplicationService {

  private static final Logger log = LoggerFactory.getLogger(LeaveApplicationService.class);

  private final LeaveApplicationRepository leaveApplicationRepository;
  private final LeaveAllocationRepository allocationRepository;
  private final EmployeeRepository employeeRepository;
  private final EmployeeAccessPolicy accessPolicy;
  private final EmployeeLockService employeeLockService;
  private final EmployeeSetupService employeeSetupService;
  private final FifoConsumptionTracker consumptionTracker;
  private final LeaveLedgerService ledgerService;
  private final AllocationLedgerManager allocationLedgerManager;
  private final AuditService auditService;
  private final ToilProperties properties;
  private final Clock clock;

  public LeaveApplicationService(
      LeaveApplicationRepository leaveApplicationRepository,
      LeaveAllocationRepository allocationRepository,
      EmployeeRepository employeeRepository,
      EmployeeAccessPolicy accessPolicy,
      EmployeeLockService employeeLockService,
      EmployeeSetupService employeeSetupService,
      FifoConsumptionTracker consumptionTracker,
      LeaveLedgerService ledgerService,
      AllocationLedgerManager allocationLedgerManager,
      AuditService auditService,
      ToilProperties properties,
      Clock clock) {
    this.leaveApplicationRepository = leaveApplicationRepository;
    this.allocationRepository = allocationRepository;
    this.employeeRepository = employeeRepository;
    this.accessPolicy = accessPolicy;
    this.employeeLockService = employeeLockService;
    this.employeeSetupService = employeeSetupService;
    this.consumptionTracker = consumptionTracker;
    this.ledgerService = ledgerService;
    this.allocationLedgerManager = allocationLedgerManager;
    this.auditService = auditService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Records leave and debits it from the employee's TOIL.
   *
   * @param employeeId target employee, or null for the caller's own record
   * @throws ValidationException SUPERVISOR_NOT_CONFIGURED when the employee has no working approval
   *     route, INSUFFICIENT_TOIL_BALANCE when the balance cannot cover the request
   */
  @Transactional
  public LeaveApplicationDetail submit(
      UUID employeeId,
      LocalDate fromDate,
      LocalDate toDate,
      boolean halfDay,
      String description,
      CallerIdentity caller) {
    var employee = resolveEmployee(employeeId, caller);
    var days = validateDays(fromDate, toDate, halfDay);
    var approver = requireApprovalRoute(employee);

    employeeLockService.lock(employee.getId());

    var today = LocalDate.now(clock);
    var balance =
        ledgerService.spendableBalance(employee.getId(), today, properties.grantCutoff(today));
    if (days.compareTo(balance) > 0) {
      throw FifoConsumptionPlanner.insufficient(balance, days);
    }
    var available = consumptionTracker.availableAllocations(employee.getId(), today);
    var slices = FifoConsumptionPlanner.plan(available, days);

    var application =
        leaveApplicationRepository.save(
            new LeaveApplication(
                employee.getId(), fromDate, toDate, halfDay, description, approver));

    var byId =
        available.stream()
            .collect(Collectors.toMap(AvailableAllocation::allocationId, Function.identity()));
    var allocations = loadAllocations(slices);
    for (var slice : slices) {
      ledgerService.appendLeaveDebit(
          allocations.get(slice.allocationId()), application.getId(), slice.days());
    }
    slices.forEach(slice -> allocationLedgerManager.refreshUsageStatus(slice.allocationId()));

    var warnings = expiryWarnings(slices, byId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("leave_application.submitted")
            .entityType("leave_application")
            .entityId(application.getId())
            .details(
                Map.of(
                    "employee_id", employee.getId().toString(),
                    "days", days.toPlainString(),
                    "allocations", slices.size()))
            .build());

    log.info(
        "Recorded leave {} for employee {}: {} day(s) across {} allocation(s)",
        application.getId(),
        employee.getId(),
        days,
        slices.size());
    return new LeaveApplicationDetail(application, slices, warnings);
  }

  /** Restores the debited days. Cancelling twice is a no-op. */
  @Transactional
  public LeaveApplicationDetail cancel(UUID leaveApplicationId, CallerIdentity caller) {
    var application = findApplication(leaveApplicationId);
    requireOwnerOrPrivileged(application.getEmployeeId(), caller);

    if (application.isCancelled()) {
      log.debug("Leave application {} already cancelled", leaveApplicationId);
      return detail(application, List.of());
    }

    employeeLockService.lock(application.getEmployeeId());

    var today = LocalDate.now(clock);
    var debits = ledgerService.entriesFor(TransactionType.LEAVE_APPLICATION, leaveApplicationId);
    var touched = new LinkedHashSet<UUID>();
    var restored = BigDecimal.ZERO;
    for (var debit : debits) {
      if (debit.isExpired()
          || !properties.isWindowOpen(debit.getFromDate(), debit.getToDate(), today)) {
        // Days from an expired allocation are gone either way
        continue;
      }
      ledgerService.appendLeaveReversal(debit);
      touched.add(debit.getAllocationId());
      restored = restored.add(debit.getLeaves().negate());
    }
    touched.forEach(allocationLedgerManager::refreshUsageStatus);

    application.cancel();
    leaveApplicationRepository.save(application);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("leave_application.cancelled")
            .entityType("leave_application")
            .entityId(leaveApplicationId)
            .details(Map.of("restored_days", restored.toPlainString()))
            .build());

    log.info(
        "Cancelled leave {}; restored {} day(s) to {} allocation(s)",
        leaveApplicationId,
        restored,
        touched.size());
    return detail(application, List.of());
  }

  @Transactional(readOnly = true)
  public LeaveApplicationDetail getApplication(UUID leaveApplicationId, CallerIdentity caller) {
    var application = findApplication(leaveApplicationId);
    accessPolicy.requireReadAccess(application.getEmployeeId(), caller);
    return detail(application, List.of());
  }

  @Transactional(readOnly = true)
  public List<LeaveApplication> listMine(CallerIdentity caller) {
    var self = accessPolicy.requireSelf(caller);
    return leaveApplicationRepository.findByEmployeeIdOrderByFromDateDesc(self.getId());
  }

  private LeaveApplicationDetail detail(LeaveApplication application, List<String> warnings) {
    var slices =
        ledgerService.entriesFor(TransactionType.LEAVE_APPLICATION, application.getId()).stream()
            .map(debit -> new ConsumptionSlice(debit.getAllocationId(), debit.getLeaves().negate()))
            .toList();
    return new LeaveApplicationDetail(application, slices, warnings);
  }

  private Map<UUID, LeaveAllocation> loadAllocations(List<ConsumptionSlice> slices) {
    var ids = slices.stream().map(ConsumptionSlice::allocationId).toList();
    return allocationRepository.findAllById(ids).stream()
        .collect(Collectors.toMap(LeaveAllocation::getId, Function.identity()));
  }

  private List<String> expiryWarnings(
      List<ConsumptionSlice> slices, Map<UUID, AvailableAllocation> available) {
    var warnings = new ArrayList<String>();
    for (var slice : slices) {
      var allocation = available.get(slice.allocationId());
      if (allocation == null) {
        continue;
      }
      var left = allocation.balance().subtract(slice.days());
      boolean expiresSoon = allocation.daysUntilExpiry() <= properties.expiringSoonWindowDays();
      if (left.signum() > 0 && expiresSoon) {
        warnings.add(
            left.stripTrailingZeros().toPlainString()
                + " day(s) of TOIL expire on "
                + allocation.toDate());
      }
    }
    return warnings;
  }

  private String requireApprovalRoute(Employee employee) {
    var report = employeeSetupService.validateSetup(employee.getId());
    if (!report.valid()) {
      throw new ValidationException(
          "SUPERVISOR_NOT_CONFIGURED",
          "Supervisor not configured",
          "Cannot record leave for "
              + employee.getName()
              + ": "
              + String.join("; ", report.issues()));
    }
    return report.supervisorUser();
  }

  private Employee resolveEmployee(UUID employeeId, CallerIdentity caller) {
    if (employeeId == null) {
      return accessPolicy.requireSelf(caller);
    }
    var employee =
        employeeRepository
            .findById(employeeId)
            .orElseThrow(() -> new ResourceNotFoundException("Employee", employeeId));
    if (!caller.isPrivileged() && !caller.is(employee.getUserId())) {
      throw new ForbiddenException(
          "NOT_LEAVE_OWNER", "Access denied", "You can only apply for your own leave");
    }
    return employee;
  }

  private void requireOwnerOrPrivileged(UUID employeeId, CallerIdentity caller) {
    if (caller.isPrivileged()) {
      return;
    }
    var owner = employeeRepository.findById(employeeId).orElse(null);
    if (owner == null || !caller.is(owner.getUserId())) {
      throw new ForbiddenException(
          "NOT_LEAVE_OWNER", "Access denied", "Only the employee can cancel their leave");
    }
  }

  private LeaveApplication findApplication(UUID leaveApplicationId) {
    return leaveApplicationRepository
        .findById(leaveApplicationId)
        .orElseThrow(() -> new ResourceNotFoundException("Leave application", leaveApplicationId));
  }

  private static BigDecimal validateDays(LocalDate fromDate, LocalDate toDate, boolean halfDay) {
    if (toDate.isBefore(fromDate)) {
      throw new ValidationException(
          "INVALID_PERIOD", "Invalid period", "Leave must not end before it starts");
    }
    if (halfDay && !fromDate.equals(toDate)) {
      throw new ValidationException(
          "INVALID_HALF_DAY", "Invalid half day", "A half day must start and end on the same date");
    }
    return LeaveApplication.leaveDays(fromDate, toDate, halfDay);
  }

  public record LeaveApplicationDetail(
      LeaveApplication application, List<ConsumptionSlice> slices, List<String> warnings) {}
}
