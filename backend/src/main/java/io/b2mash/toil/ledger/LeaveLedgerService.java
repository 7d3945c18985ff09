package io.b2mash.toil.ledger;

import io.b2mash.toil.allocation.LeaveAllocation;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only access to the leave ledger. Every balance in the system is a sum over these entries;
 * allocation totals are never trusted for balance.
 */
@Service
public class LeaveLedgerService {

  private static final Logger log = LoggerFactory.getLogger(LeaveLedgerService.class);

  private final LeaveLedgerEntryRepository ledgerRepository;

  public LeaveLedgerService(LeaveLedgerEntryRepository ledgerRepository) {
    this.ledgerRepository = ledgerRepository;
  }

  @Transactional
  public LeaveLedgerEntry appendCredit(
      LeaveAllocation allocation, UUID timesheetId, BigDecimal days) {
    return append(allocation, TransactionType.ALLOCATION, timesheetId, requirePositive(days));
  }

  @Transactional
  public LeaveLedgerEntry appendAllocationReversal(
      LeaveAllocation allocation, UUID timesheetId, BigDecimal days) {
    return append(
        allocation,
        TransactionType.ALLOCATION_REVERSAL,
        timesheetId,
        requirePositive(days).negate());
  }

  @Transactional
  public LeaveLedgerEntry appendLeaveDebit(
      LeaveAllocation allocation, UUID leaveApplicationId, BigDecimal days) {
    return append(
        allocation,
        TransactionType.LEAVE_APPLICATION,
        leaveApplicationId,
        requirePositive(days).negate());
  }

  /** Restores a debit. The reversal lands on the same allocation and window as the debit. */
  @Transactional
  public LeaveLedgerEntry appendLeaveReversal(LeaveLedgerEntry debit) {
    if (debit.getTransactionType() != TransactionType.LEAVE_APPLICATION || debit.isCredit()) {
      throw new IllegalArgumentException("Only leave debits can be reversed, got " + debit.getId());
    }
    var entry =
        new LeaveLedgerEntry(
            debit.getEmployeeId(),
            debit.getAllocationId(),
            TransactionType.LEAVE_APPLICATION_REVERSAL,
            debit.getTransactionRef(),
            debit.getLeaves().negate(),
            debit.getFromDate(),
            debit.getToDate());
    return save(entry);
  }

  @Transactional(readOnly = true)
  public BigDecimal allocationBalance(UUID allocationId) {
    return orZero(ledgerRepository.sumUnexpiredByAllocation(allocationId));
  }

  @Transactional(readOnly = true)
  public BigDecimal employeeBalance(UUID employeeId) {
    return orZero(ledgerRepository.sumUnexpiredByEmployee(employeeId));
  }

  /** Sum of entries whose allocation window is still open on {@code asOf}. */
  @Transactional(readOnly = true)
  public BigDecimal spendableBalance(UUID employeeId, LocalDate asOf, LocalDate grantCutoff) {
    return orZero(ledgerRepository.sumSpendableByEmployee(employeeId, asOf, grantCutoff));
  }

  @Transactional(readOnly = true)
  public BigDecimal employeeTotal(UUID employeeId, Set<TransactionType> types) {
    return orZero(ledgerRepository.sumUnexpiredByEmployeeAndTypes(employeeId, types));
  }

  @Transactional(readOnly = true)
  public BigDecimal balanceEndingBetween(UUID employeeId, LocalDate from, LocalDate to) {
    return orZero(ledgerRepository.sumUnexpiredEndingBetween(employeeId, from, to));
  }

  @Transactional(readOnly = true)
  public Map<UUID, BigDecimal> balancesByAllocation(UUID employeeId) {
    return ledgerRepository.unexpiredBalancesByAllocation(employeeId).stream()
        .collect(
            Collectors.toMap(
                LeaveLedgerEntryRepository.AllocationBalance::getAllocationId,
                b -> orZero(b.getBalance())));
  }

  /** Employees holding unexpired balance in allocations that end inside {@code [from, to]}. */
  @Transactional(readOnly = true)
  public List<LeaveLedgerEntryRepository.ExpiringBalance> expiringBalances(
      LocalDate from, LocalDate to) {
    return ledgerRepository.findBalancesEndingBetween(from, to);
  }

  /** Flags entries of allocations closed by {@code asOf} as expired. */
  @Transactional
  public int expireClosedAllocations(LocalDate grantCutoff, LocalDate asOf) {
    return ledgerRepository.expireEntriesOfClosedAllocations(grantCutoff, asOf);
  }

  @Transactional(readOnly = true)
  public List<LeaveLedgerEntry> entriesFor(TransactionType type, UUID transactionRef) {
    return ledgerRepository.findByTransactionTypeAndTransactionRef(type, transactionRef);
  }

  @Transactional(readOnly = true)
  public List<LeaveLedgerEntry> history(UUID employeeId, Instant from, Instant to) {
    return ledgerRepository.findForEmployeeBetween(employeeId, from, to);
  }

  private LeaveLedgerEntry append(
      LeaveAllocation allocation, TransactionType type, UUID transactionRef, BigDecimal leaves) {
    Objects.requireNonNull(allocation.getId(), "allocation must be persisted before posting");
    var entry =
        new LeaveLedgerEntry(
            allocation.getEmployeeId(),
            allocation.getId(),
            type,
            transactionRef,
            leaves,
            allocation.getFromDate(),
            allocation.getToDate());
    return save(entry);
  }

  private LeaveLedgerEntry save(LeaveLedgerEntry entry) {
    var saved = ledgerRepository.save(entry);
    log.debug(
        "Posted ledger entry: type={}, allocation={}, leaves={}",
        entry.getTransactionType(),
        entry.getAllocationId(),
        entry.getLeaves());
    return saved;
  }

  private static BigDecimal requirePositive(BigDecimal days) {
    if (days == null || days.signum() <= 0) {
      throw new IllegalArgumentException("Ledger quantity must be positive, got " + days);
    }
    return days;
  }

  static BigDecimal orZero(BigDecimal value) {
    return value != null ? value : BigDecimal.ZERO;
  }
}
