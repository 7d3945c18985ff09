package io.b2mash.toil.allocation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeaveAllocationRepository extends JpaRepository<LeaveAllocation, UUID> {

  /** Active TOIL allocations whose window contains {@code today}, latest expiry first. */
  @Query(
      """
      SELECT a FROM LeaveAllocation a
      WHERE a.employeeId = :employeeId
        AND a.status = :status
        AND a.toilAllocation = true
        AND a.fromDate <= :today
        AND a.toDate >= :today
      ORDER BY a.toDate DESC, a.createdAt DESC
      """)
  List<LeaveAllocation> findOpenOn(
      @Param("employeeId") UUID employeeId,
      @Param("today") LocalDate today,
      @Param("status") AllocationStatus status);

  default List<LeaveAllocation> findOpenOn(UUID employeeId, LocalDate today) {
    return findOpenOn(employeeId, today, AllocationStatus.ACTIVE);
  }

  /** Active TOIL allocations still open on {@code today}, oldest grant first. */
  @Query(
      """
      SELECT a FROM LeaveAllocation a
      WHERE a.employeeId = :employeeId
        AND a.status = :status
        AND a.toilAllocation = true
        AND a.toDate >= :today
        AND a.fromDate >= :grantCutoff
      ORDER BY a.fromDate ASC, a.createdAt ASC
      """)
  List<LeaveAllocation> findUnexpiredInFifoOrder(
      @Param("employeeId") UUID employeeId,
      @Param("today") LocalDate today,
      @Param("grantCutoff") LocalDate grantCutoff,
      @Param("status") AllocationStatus status);

  default List<LeaveAllocation> findUnexpiredInFifoOrder(
      UUID employeeId, LocalDate today, LocalDate grantCutoff) {
    return findUnexpiredInFifoOrder(employeeId, today, grantCutoff, AllocationStatus.ACTIVE);
  }

  List<LeaveAllocation> findByEmployeeIdOrderByFromDateDesc(UUID employeeId);
}
