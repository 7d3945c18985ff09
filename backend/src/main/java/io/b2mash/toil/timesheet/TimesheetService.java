package io.b2mash.toil.timesheet;

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
import io.b2mash.toil.timesheet.ToilCalculator.BreakdownLine;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Draft editing and read access for timesheets. TOIL totals are recomputed on every draft save. */
@Service
public class TimesheetService {

  private static final Logger log = LoggerFactory.getLogger(TimesheetService.class);

  private static final BigDecimal MAX_HOURS_PER_LOG = new BigDecimal("24");

  private final TimesheetRepository timesheetRepository;
  private final TimeLogRepository timeLogRepository;
  private final EmployeeRepository employeeRepository;
  private final EmployeeAccessPolicy accessPolicy;
  private final AuditService auditService;

  public TimesheetService(
      TimesheetRepository timesheetRepository,
      TimeLogRepository timeLogRepository,
      EmployeeRepository employeeRepository,
      EmployeeAccessPolicy accessPolicy,
      AuditService auditService) {
    this.timesheetRepository = timesheetRepository;
    this.timeLogRepository = timeLogRepository;
    this.employeeRepository = employeeRepository;
    this.accessPolicy = accessPolicy;
    this.auditService = auditService;
  }

  /**
   * Creates a draft. Employees create their own; a privileged caller may name any employee.
   *
   * @param employeeId target employee, or null for the caller's own record
   */
  @Transactional
  public TimesheetDetail createDraft(
      UUID employeeId,
      LocalDate startDate,
      LocalDate endDate,
      List<TimeLogInput> logs,
      CallerIdentity caller) {
    UUID ownerId = resolveOwner(employeeId, caller);
    validatePeriod(startDate, endDate, logs);

    var timesheet = timesheetRepository.save(new Timesheet(ownerId, startDate, endDate));
    var saved = replaceLogs(timesheet, logs);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("timesheet.created")
            .entityType("timesheet")
            .entityId(timesheet.getId())
            .details(
                Map.of(
                    "employee_id", ownerId.toString(),
                    "toil_hours", timesheet.getTotalToilHours().toPlainString()))
            .build());

    log.info(
        "Created timesheet {} for employee {} with {} TOIL hours",
        timesheet.getId(),
        ownerId,
        timesheet.getTotalToilHours());
    return new TimesheetDetail(timesheet, saved);
  }

  /** Replaces the period and time logs of an editable draft and recomputes its TOIL totals. */
  @Transactional
  public TimesheetDetail updateDraft(
      UUID timesheetId,
      LocalDate startDate,
      LocalDate endDate,
      List<TimeLogInput> logs,
      CallerIdentity caller) {
    var timesheet = findTimesheet(timesheetId);
    requireOwnerOrPrivileged(timesheet, caller);
    if (!timesheet.isEditable()) {
      throw new ResourceConflictException(
          "TIMESHEET_NOT_EDITABLE",
          "Timesheet not editable",
          "Timesheet "
              + timesheetId
              + " is "
              + timesheet.getStatus()
              + "/"
              + timesheet.getToilStatus()
              + " and can no longer be edited");
    }
    validatePeriod(startDate, endDate, logs);

    timesheet.changePeriod(startDate, endDate);
    var saved = replaceLogs(timesheet, logs);
    log.debug(
        "Updated draft timesheet {}: {} TOIL hours", timesheetId, timesheet.getTotalToilHours());
    return new TimesheetDetail(timesheet, saved);
  }

  @Transactional(readOnly = true)
  public TimesheetDetail getTimesheet(UUID timesheetId, CallerIdentity caller) {
    var timesheet = findTimesheet(timesheetId);
    accessPolicy.requireReadAccess(timesheet.getEmployeeId(), caller);
    return new TimesheetDetail(
        timesheet, timeLogRepository.findByTimesheetIdOrderByPositionAsc(timesheetId));
  }

  @Transactional(readOnly = true)
  public List<Timesheet> listMine(CallerIdentity caller) {
    var self = accessPolicy.requireSelf(caller);
    return timesheetRepository.findByEmployeeIdOrderByStartDateDesc(self.getId());
  }

  /**
   * TOIL-bearing timesheets of the caller's direct reports. Defaults to those awaiting a decision
   * or accrual.
   */
  @Transactional(readOnly = true)
  public List<Timesheet> listTeamRequests(CallerIdentity caller, List<ToilStatus> statuses) {
    var supervisor = accessPolicy.requireSelf(caller);
    var reportIds =
        employeeRepository.findBySupervisorIdOrderByNameAsc(supervisor.getId()).stream()
            .map(Employee::getId)
            .toList();
    if (reportIds.isEmpty()) {
      return List.of();
    }
    var filter =
        statuses == null || statuses.isEmpty()
            ? EnumSet.of(ToilStatus.PENDING_ACCRUAL)
            : EnumSet.copyOf(statuses);
    return timesheetRepository.findToilRequests(reportIds, filter);
  }

  /** Recomputes TOIL from the stored logs without saving anything. */
  @Transactional(readOnly = true)
  public ToilPreview calculatePreview(UUID timesheetId, CallerIdentity caller) {
    var timesheet = findTimesheet(timesheetId);
    accessPolicy.requireReadAccess(timesheet.getEmployeeId(), caller);
    var logs = timeLogRepository.findByTimesheetIdOrderByPositionAsc(timesheetId);
    var hours = ToilCalculator.toilHours(logs);
    var days = ToilCalculator.toilDays(hours);
    return new ToilPreview(
        timesheetId,
        hours,
        days,
        ToilCalculator.allocationDays(days),
        ToilCalculator.breakdown(logs));
  }

  Timesheet findTimesheet(UUID timesheetId) {
    return timesheetRepository
        .findById(timesheetId)
        .orElseThrow(() -> new ResourceNotFoundException("Timesheet", timesheetId));
  }

  private List<TimeLog> replaceLogs(Timesheet timesheet, List<TimeLogInput> inputs) {
    timeLogRepository.deleteByTimesheetId(timesheet.getId());
    var logs = new ArrayList<TimeLog>();
    int position = 0;
    for (var input : inputs) {
      logs.add(
          new TimeLog(
              timesheet.getId(),
              position++,
              input.date(),
              input.hours(),
              input.billable(),
              input.activityType(),
              input.description()));
    }
    var saved = timeLogRepository.saveAll(logs);

    var hours = ToilCalculator.toilHours(saved);
    timesheet.applyToilTotals(hours, ToilCalculator.toilDays(hours));
    timesheetRepository.save(timesheet);
    return saved;
  }

  private UUID resolveOwner(UUID employeeId, CallerIdentity caller) {
    if (employeeId == null) {
      return accessPolicy.requireSelf(caller).getId();
    }
    var employee =
        employeeRepository
            .findById(employeeId)
            .orElseThrow(() -> new ResourceNotFoundException("Employee", employeeId));
    if (!caller.isPrivileged() && !caller.is(employee.getUserId())) {
      throw new ForbiddenException(
          "NOT_TIMESHEET_OWNER",
          "Access denied",
          "You can only create timesheets for yourself");
    }
    return employee.getId();
  }

  void requireOwnerOrPrivileged(Timesheet timesheet, CallerIdentity caller) {
    if (caller.isPrivileged()) {
      return;
    }
    var owner = employeeRepository.findById(timesheet.getEmployeeId()).orElse(null);
    if (owner == null || !caller.is(owner.getUserId())) {
      throw new ForbiddenException(
          "NOT_TIMESHEET_OWNER",
          "Access denied",
          "Only the employee who owns timesheet " + timesheet.getId() + " can do this");
    }
  }

  private static void validatePeriod(
      LocalDate startDate, LocalDate endDate, List<TimeLogInput> logs) {
    if (endDate.isBefore(startDate)) {
      throw new ValidationException(
          "INVALID_PERIOD", "Invalid period", "End date must not be before start date");
    }
    for (var input : logs) {
      if (input.date().isBefore(startDate) || input.date().isAfter(endDate)) {
        throw new ValidationException(
            "LOG_OUTSIDE_PERIOD",
            "Time log outside period",
            "Time log on " + input.date() + " falls outside " + startDate + ".." + endDate);
      }
      if (input.hours().signum() < 0 || input.hours().compareTo(MAX_HOURS_PER_LOG) > 0) {
        throw new ValidationException(
            "INVALID_HOURS",
            "Invalid hours",
            "Time log hours must be between 0 and 24, got " + input.hours());
      }
    }
  }

  // --- Value types ---

  public record TimeLogInput(
      LocalDate date,
      BigDecimal hours,
      boolean billable,
      String activityType,
      String description) {}

  public record TimesheetDetail(Timesheet timesheet, List<TimeLog> logs) {}

  public record ToilPreview(
      UUID timesheetId,
      BigDecimal toilHours,
      BigDecimal toilDays,
      BigDecimal allocationDays,
      List<BreakdownLine> breakdown) {}
}
