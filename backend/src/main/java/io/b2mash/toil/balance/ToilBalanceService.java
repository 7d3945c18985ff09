package io.b2mash.toil.balance;

import io.b2mash.toil.config.ToilProperties;
import io.b2mash.toil.consumption.AvailableAllocation;
import io.b2mash.toil.consumption.FifoConsumptionTracker;
import io.b2mash.toil.directory.EmployeeAccessPolicy;
import io.b2mash.toil.exception.ValidationException;
import io.b2mash.toil.ledger.LeaveLedgerEntry;
import io.b2mash.toil.ledger.LeaveLedgerService;
import io.b2mash.toil.ledger.TransactionType;
import io.b2mash.toil.security.CallerIdentity;
import io.b2mash.toil.timesheet.TimesheetRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only TOIL balance and ledger views. All figures are sums over unexpired ledger entries;
 * the available figure also leaves out windows that closed before tonight's expiry run. Nothing
 * here takes a lock.
 */
@Service
public class ToilBalanceService {

  private final LeaveLedgerService ledgerService;
  private final FifoConsumptionTracker consumptionTracker;
  private final TimesheetRepository timesheetRepository;
  private final EmployeeAccessPolicy accessPolicy;
  private final ToilProperties properties;
  private final Clock clock;

  public ToilBalanceService(
      LeaveLedgerService ledgerService,
      FifoConsumptionTracker consumptionTracker,
      TimesheetRepository timesheetRepository,
      EmployeeAccessPolicy accessPolicy,
      ToilProperties properties,
      Clock clock) {
    this.ledgerService = ledgerService;
    this.consumptionTracker = consumptionTracker;
    this.timesheetRepository = timesheetRepository;
    this.accessPolicy = accessPolicy;
    this.properties = properties;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public ToilBalance balance(UUID employeeId, CallerIdentity caller) {
    accessPolicy.requireReadAccess(employeeId, caller);
    var today = LocalDate.now(clock);

    var available =
        ledgerService.spendableBalance(employeeId, today, properties.grantCutoff(today));
    var accrued = ledgerService.employeeTotal(employeeId, TransactionType.ACCRUAL_TYPES);
    var consumed =
        ledgerService.employeeTotal(employeeId, TransactionType.CONSUMPTION_TYPES).negate();
    var expiringSoon =
        ledgerService.balanceEndingBetween(
            employeeId, today, today.plusDays(properties.expiringSoonWindowDays()));
    var pending = timesheetRepository.sumPendingToilDays(employeeId);

    var allocations = consumptionTracker.availableAllocations(employeeId, today);
    var earliestExpiry =
        allocations.stream()
            .map(AvailableAllocation::toDate)
            .min(Comparator.naturalOrder())
            .orElse(null);

    return new ToilBalance(
        employeeId,
        today,
        available,
        accrued,
        consumed,
        expiringSoon.signum() > 0 ? expiringSoon : BigDecimal.ZERO,
        pending != null ? pending : BigDecimal.ZERO,
        earliestExpiry,
        allocations);
  }

  /**
   * Ledger entries posted between {@code from} and {@code to} (inclusive, in the service time
   * zone), newest first. Missing bounds default to the configured window ending today.
   */
  @Transactional(readOnly = true)
  public List<LedgerLine> ledger(
      UUID employeeId, LocalDate from, LocalDate to, CallerIdentity caller) {
    accessPolicy.requireReadAccess(employeeId, caller);
    var today = LocalDate.now(clock);
    var end = to != null ? to : today;
    var start = from != null ? from : end.minusDays(properties.ledgerDefaultWindowDays());
    if (end.isBefore(start)) {
      throw new ValidationException(
          "INVALID_RANGE", "Invalid date range", "'from' must not be after 'to'");
    }

    var zone = clock.getZone();
    return ledgerService
        .history(
            employeeId,
            start.atStartOfDay(zone).toInstant(),
            end.plusDays(1).atStartOfDay(zone).toInstant())
        .stream()
        .map(entry -> LedgerLine.from(entry, today))
        .toList();
  }

  @Transactional(readOnly = true)
  public List<AvailableAllocation> availableAllocations(UUID employeeId, CallerIdentity caller) {
    accessPolicy.requireReadAccess(employeeId, caller);
    return consumptionTracker.availableAllocations(employeeId, LocalDate.now(clock));
  }

  // --- Value types ---

  public record ToilBalance(
      UUID employeeId,
      LocalDate asOf,
      BigDecimal available,
      BigDecimal totalAccrued,
      BigDecimal totalConsumed,
      BigDecimal expiringSoon,
      BigDecimal pendingAccrual,
      LocalDate earliestExpiryDate,
      List<AvailableAllocation> allocations) {}

  /** @param daysUntilExpiry negative once the entry's allocation window has closed */
  public record LedgerLine(
      UUID id,
      UUID allocationId,
      TransactionType transactionType,
      UUID transactionRef,
      BigDecimal leaves,
      boolean expired,
      LocalDate fromDate,
      LocalDate toDate,
      Instant createdAt,
      long daysUntilExpiry) {

    static LedgerLine from(LeaveLedgerEntry entry, LocalDate today) {
      return new LedgerLine(
          entry.getId(),
          entry.getAllocationId(),
          entry.getTransactionType(),
          entry.getTransactionRef(),
          entry.getLeaves(),
          entry.isExpired(),
          entry.getFromDate(),
          entry.getToDate(),
          entry.getCreatedAt(),
          ChronoUnit.DAYS.between(today, entry.getToDate()));
    }
  }
}
