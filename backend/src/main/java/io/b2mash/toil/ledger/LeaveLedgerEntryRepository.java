package io.b2mash.toil.ledger;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeaveLedgerEntryRepository extends JpaRepository<LeaveLedgerEntry, UUID> {

  /** Per-allocation unexpired balance projection. */
  interface AllocationBalance {
    UUID getAllocationId();

    BigDecimal getBalance();
  }

  /** Unexpired balance an employee holds in allocations ending inside a date range. */
  interface ExpiringBalance {
    UUID getEmployeeId();

    BigDecimal getBalance();

    LocalDate getEarliestExpiry();
  }

  @Query(
      """
      SELECT SUM(e.leaves) FROM LeaveLedgerEntry e
      WHERE e.allocationId = :allocationId AND e.expired = false
      """)
  BigDecimal sumUnexpiredByAllocation(@Param("allocationId") UUID allocationId);

  @Query(
      """
      SELECT SUM(e.leaves) FROM LeaveLedgerEntry e
      WHERE e.employeeId = :employeeId AND e.expired = false
      """)
  BigDecimal sumUnexpiredByEmployee(@Param("employeeId") UUID employeeId);

  /**
   * Balance an employee can spend on {@code asOf}: unexpired entries whose allocation window is
   * still open, even if the nightly expiry run has not flagged the closed ones yet.
   */
  @Query(
      """
      SELECT SUM(e.leaves) FROM LeaveLedgerEntry e
      WHERE e.employeeId = :employeeId
        AND e.expired = false
        AND e.toDate >= :asOf
        AND e.fromDate >= :grantCutoff
      """)
  BigDecimal sumSpendableByEmployee(
      @Param("employeeId") UUID employeeId,
      @Param("asOf") LocalDate asOf,
      @Param("grantCutoff") LocalDate grantCutoff);

  @Query(
      """
      SELECT SUM(e.leaves) FROM LeaveLedgerEntry e
      WHERE e.employeeId = :employeeId
        AND e.expired = false
        AND e.transactionType IN :types
      """)
  BigDecimal sumUnexpiredByEmployeeAndTypes(
      @Param("employeeId") UUID employeeId, @Param("types") Collection<TransactionType> types);

  @Query(
      """
      SELECT SUM(e.leaves) FROM LeaveLedgerEntry e
      WHERE e.employeeId = :employeeId
        AND e.expired = false
        AND e.toDate >= :from
        AND e.toDate <= :to
      """)
  BigDecimal sumUnexpiredEndingBetween(
      @Param("employeeId") UUID employeeId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  @Query(
      """
      SELECT e.allocationId AS allocationId, SUM(e.leaves) AS balance
      FROM LeaveLedgerEntry e
      WHERE e.employeeId = :employeeId AND e.expired = false
      GROUP BY e.allocationId
      """)
  List<AllocationBalance> unexpiredBalancesByAllocation(@Param("employeeId") UUID employeeId);

  @Query(
      """
      SELECT e.employeeId AS employeeId, SUM(e.leaves) AS balance, MIN(e.toDate) AS earliestExpiry
      FROM LeaveLedgerEntry e
      WHERE e.expired = false
        AND e.toDate >= :from
        AND e.toDate <= :to
      GROUP BY e.employeeId
      HAVING SUM(e.leaves) > 0
      """)
  List<ExpiringBalance> findBalancesEndingBetween(
      @Param("from") LocalDate from, @Param("to") LocalDate to);

  @Query(
      """
      SELECT e FROM LeaveLedgerEntry e
      WHERE e.employeeId = :employeeId
        AND e.createdAt >= :from
        AND e.createdAt < :to
      ORDER BY e.createdAt DESC
      """)
  List<LeaveLedgerEntry> findForEmployeeBetween(
      @Param("employeeId") UUID employeeId,
      @Param("from") Instant from,
      @Param("to") Instant to);

  List<LeaveLedgerEntry> findByTransactionTypeAndTransactionRef(
      TransactionType transactionType, UUID transactionRef);

  /**
   * Flags every unexpired entry belonging to an allocation whose window has closed by {@code asOf}:
   * granted before {@code grantCutoff}, or ending before {@code asOf}. Both tests use each
   * allocation's own dates.
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE LeaveLedgerEntry e SET e.expired = true
      WHERE e.expired = false
        AND e.allocationId IN (
          SELECT a.id FROM LeaveAllocation a
          WHERE a.fromDate < :grantCutoff OR a.toDate < :asOf)
      """)
  int expireEntriesOfClosedAllocations(
      @Param("grantCutoff") LocalDate grantCutoff, @Param("asOf") LocalDate asOf);
}
