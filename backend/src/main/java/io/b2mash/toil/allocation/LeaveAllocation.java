package io.b2mash.toil.allocation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A TOIL credit grant with a fixed validity window. Timesheets accrued while the window is open
 * top up the same allocation instead of creating overlapping grants. {@code newLeavesAllocated} is
 * a cached total; the ledger is the source of truth for what remains.
 */
@Entity
@Table(name = "leave_allocations")
public class LeaveAllocation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "employee_id", nullable = false)
  private UUID employeeId;

  @Column(name = "from_date", nullable = false)
  private LocalDate fromDate;

  @Column(name = "to_date", nullable = false)
  private LocalDate toDate;

  @Column(name = "new_leaves_allocated", nullable = false, precision = 10, scale = 3)
  private BigDecimal newLeavesAllocated;

  @Column(name = "toil_hours", nullable = false, precision = 10, scale = 2)
  private BigDecimal toilHours;

  @Column(name = "source_timesheet_id")
  private UUID sourceTimesheetId;

  @Column(name = "is_toil_allocation", nullable = false)
  private boolean toilAllocation;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private AllocationStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected LeaveAllocation() {}

  public LeaveAllocation(
      UUID employeeId,
      LocalDate fromDate,
      LocalDate toDate,
      BigDecimal days,
      BigDecimal toilHours,
      UUID sourceTimesheetId) {
    this.employeeId = Objects.requireNonNull(employeeId, "employeeId must not be null");
    this.fromDate = Objects.requireNonNull(fromDate, "fromDate must not be null");
    this.toDate = Objects.requireNonNull(toDate, "toDate must not be null");
    if (toDate.isBefore(fromDate)) {
      throw new IllegalArgumentException("toDate must not precede fromDate");
    }
    this.newLeavesAllocated = requirePositive(days);
    this.toilHours = toilHours != null ? toilHours : BigDecimal.ZERO;
    this.sourceTimesheetId = sourceTimesheetId;
    this.toilAllocation = true;
    this.status = AllocationStatus.ACTIVE;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  /** Adds a later timesheet's whole-day credit to this still-open allocation. */
  public void topUp(BigDecimal days, BigDecimal hours) {
    if (status != AllocationStatus.ACTIVE) {
      throw new IllegalStateException("Cannot top up a cancelled allocation " + id);
    }
    this.newLeavesAllocated = this.newLeavesAllocated.add(requirePositive(days));
    this.toilHours = this.toilHours.add(hours != null ? hours : BigDecimal.ZERO);
    this.updatedAt = Instant.now();
  }

  /**
   * Removes one contributor's credit. The allocation is cancelled once nothing is left.
   *
   * @return true if the allocation was cancelled by this reduction
   */
  public boolean reduce(BigDecimal days, BigDecimal hours) {
    if (status != AllocationStatus.ACTIVE) {
      throw new IllegalStateException("Cannot reduce a cancelled allocation " + id);
    }
    var remaining = this.newLeavesAllocated.subtract(requirePositive(days));
    var remainingHours = this.toilHours.subtract(hours != null ? hours : BigDecimal.ZERO);
    this.toilHours = remainingHours.signum() > 0 ? remainingHours : BigDecimal.ZERO;
    this.updatedAt = Instant.now();
    if (remaining.signum() <= 0) {
      this.newLeavesAllocated = BigDecimal.ZERO;
      this.status = AllocationStatus.CANCELLED;
      return true;
    }
    this.newLeavesAllocated = remaining;
    return false;
  }

  public boolean isOpenOn(LocalDate date) {
    return status == AllocationStatus.ACTIVE && !date.isBefore(fromDate) && !date.isAfter(toDate);
  }

  private static BigDecimal requirePositive(BigDecimal days) {
    if (days == null || days.signum() <= 0) {
      throw new IllegalArgumentException("Allocation days must be positive, got " + days);
    }
    return days;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getEmployeeId() {
    return employeeId;
  }

  public LocalDate getFromDate() {
    return fromDate;
  }

  public LocalDate getToDate() {
    return toDate;
  }

  public BigDecimal getNewLeavesAllocated() {
    return newLeavesAllocated;
  }

  public BigDecimal getToilHours() {
    return toilHours;
  }

  public UUID getSourceTimesheetId() {
    return sourceTimesheetId;
  }

  public boolean isToilAllocation() {
    return toilAllocation;
  }

  public AllocationStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
