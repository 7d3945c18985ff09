package io.b2mash.toil.timesheet;

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

public interface TimesheetRepository extends JpaRepository<Timesheet, UUID> {

  List<Timesheet> findByEmployeeIdOrderByStartDateDesc(UUID employeeId);

  /** TOIL-bearing timesheets of the given employees (a supervisor's reports). */
  @Query(
      """
      SELECT t FROM Timesheet t
      WHERE t.employeeId IN :employeeIds
        AND t.totalToilHours > 0
        AND t.toilStatus IN :toilStatuses
      ORDER BY t.startDate DESC
      """)
  List<Timesheet> findToilRequests(
      @Param("employeeIds") Collection<UUID> employeeIds,
      @Param("toilStatuses") Collection<ToilStatus> toilStatuses);

  List<Timesheet> findByToilAllocationIdAndToilStatusIn(
      UUID toilAllocationId, Collection<ToilStatus> toilStatuses);

  /**
   * Approved timesheets still waiting for their allocation, untouched since {@code before}. A
   * timesheet whose last accrual failed for a non-retryable reason is left out.
   */
  @Query(
      """
      SELECT t FROM Timesheet t
      WHERE t.status <> :cancelled
        AND t.toilStatus = :pending
        AND t.approvedAt IS NOT NULL
        AND t.toilAllocationId IS NULL
        AND (t.lastAccrualError IS NULL OR t.lastAccrualRetryable = true)
        AND t.updatedAt < :before
      ORDER BY t.approvedAt ASC
      """)
  List<Timesheet> findStalledAccruals(
      @Param("before") Instant before,
      @Param("pending") ToilStatus pending,
      @Param("cancelled") TimesheetStatus cancelled);

  default List<Timesheet> findStalledAccruals(Instant before) {
    return findStalledAccruals(before, ToilStatus.PENDING_ACCRUAL, TimesheetStatus.CANCELLED);
  }

  /** TOIL days submitted or approved but not yet credited to an allocation. */
  @Query(
      """
      SELECT SUM(t.toilDays) FROM Timesheet t
      WHERE t.employeeId = :employeeId
        AND t.status <> :cancelled
        AND t.toilStatus = :pending
        AND t.toilAllocationId IS NULL
      """)
  BigDecimal sumPendingToilDays(
      @Param("employeeId") UUID employeeId,
      @Param("pending") ToilStatus pending,
      @Param("cancelled") TimesheetStatus cancelled);

  default BigDecimal sumPendingToilDays(UUID employeeId) {
    return sumPendingToilDays(employeeId, ToilStatus.PENDING_ACCRUAL, TimesheetStatus.CANCELLED);
  }

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Timesheet t SET t.toilStatus = :expired, t.updatedAt = :now
      WHERE t.toilStatus IN :fromStatuses
        AND t.toilAllocationId IN (
          SELECT a.id FROM LeaveAllocation a
          WHERE a.fromDate < :grantCutoff OR a.toDate < :asOf)
      """)
  int markExpiredForClosedAllocations(
      @Param("grantCutoff") LocalDate grantCutoff,
      @Param("asOf") LocalDate asOf,
      @Param("expired") ToilStatus expired,
      @Param("fromStatuses") Collection<ToilStatus> fromStatuses,
      @Param("now") Instant now);
}
