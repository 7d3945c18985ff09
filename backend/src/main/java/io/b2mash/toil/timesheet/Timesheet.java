package io.b2mash.toil.timesheet;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A period of logged work for one employee, and the TOIL it earns.
 *
 * <p>State is the pair (document status, TOIL status):
 *
 * <ul>
 *   <li>DRAFT / NOT_APPLICABLE: being edited
 *   <li>DRAFT / PENDING_ACCRUAL with approval requested: waiting for the supervisor
 *   <li>DRAFT / REJECTED: sent back, editable and resubmittable
 *   <li>SUBMITTED / PENDING_ACCRUAL: approved, accrual job in flight
 *   <li>SUBMITTED / ACCRUED (then PARTIALLY_USED, FULLY_USED, EXPIRED): linked to an allocation
 *   <li>DRAFT / PENDING_ACCRUAL with approval kept: accrual failed and was compensated
 *   <li>CANCELLED / CANCELLED
 * </ul>
 */
@Entity
@Table(name = "timesheets")
public class Timesheet {

  private static final int MAX_ERROR_LENGTH = 1000;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "employee_id", nullable = false, updatable = false)
  private UUID employeeId;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "end_date", nullable = false)
  private LocalDate endDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TimesheetStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "toil_status", nullable = false, length = 30)
  private ToilStatus toilStatus;

  @Column(name = "total_toil_hours", nullable = false, precision = 10, scale = 2)
  private BigDecimal totalToilHours;

  @Column(name = "toil_days", nullable = false, precision = 10, scale = 3)
  private BigDecimal toilDays;

  @Column(name = "toil_allocation_id")
  private UUID toilAllocationId;

  @Column(name = "toil_accrued_days", precision = 10, scale = 3)
  private BigDecimal toilAccruedDays;

  @Column(name = "approval_requested_at")
  private Instant approvalRequestedAt;

  @Column(name = "approved_by", length = 255)
  private String approvedBy;

  @Column(name = "approved_at")
  private Instant approvedAt;

  @Column(name = "rejection_reason", columnDefinition = "TEXT")
  private String rejectionReason;

  @Column(name = "last_accrual_error", columnDefinition = "TEXT")
  private String lastAccrualError;

  @Column(name = "last_accrual_retryable", nullable = false)
  private boolean lastAccrualRetryable;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected Timesheet() {}

  public Timesheet(UUID employeeId, LocalDate startDate, LocalDate endDate) {
    this.employeeId = Objects.requireNonNull(employeeId, "employeeId must not be null");
    this.status = TimesheetStatus.DRAFT;
    this.toilStatus = ToilStatus.NOT_APPLICABLE;
    this.totalToilHours = BigDecimal.ZERO.setScale(2);
    this.toilDays = BigDecimal.ZERO.setScale(3);
    changePeriod(startDate, endDate);
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  // --- Draft editing ---

  /** Editable while in draft and not waiting on, or holding, an approval. */
  public boolean isEditable() {
    return status == TimesheetStatus.DRAFT && approvalRequestedAt == null && approvedAt == null;
  }

  public void changePeriod(LocalDate startDate, LocalDate endDate) {
    Objects.requireNonNull(startDate, "startDate must not be null");
    Objects.requireNonNull(endDate, "endDate must not be null");
    if (endDate.isBefore(startDate)) {
      throw new IllegalArgumentException("endDate must not precede startDate");
    }
    this.startDate = startDate;
    this.endDate = endDate;
  }

  /** Stores freshly computed totals. Submitted timesheets keep the totals they were approved on. */
  public void applyToilTotals(BigDecimal hours, BigDecimal days) {
    requireStatus(TimesheetStatus.DRAFT, "recompute TOIL");
    this.totalToilHours = hours;
    this.toilDays = days;
  }

  public boolean hasToil() {
    return totalToilHours.signum() > 0;
  }

  // --- Approval ---

  public boolean isAwaitingApproval() {
    return status == TimesheetStatus.DRAFT && approvalRequestedAt != null && approvedAt == null;
  }

  public void requestApproval(Instant requestedAt) {
    requireStatus(TimesheetStatus.DRAFT, "request approval");
    this.approvalRequestedAt = requestedAt;
    this.rejectionReason = null;
    this.toilStatus = hasToil() ? ToilStatus.PENDING_ACCRUAL : ToilStatus.NOT_APPLICABLE;
  }

  public void approve(String approver, Instant at) {
    if (!isAwaitingApproval()) {
      throw new IllegalStateException("Timesheet " + id + " is not awaiting approval");
    }
    this.status = TimesheetStatus.SUBMITTED;
    this.approvedBy = approver;
    this.approvedAt = at;
    this.toilStatus = hasToil() ? ToilStatus.PENDING_ACCRUAL : ToilStatus.NOT_APPLICABLE;
  }

  public void reject(String reason) {
    if (!isAwaitingApproval()) {
      throw new IllegalStateException("Timesheet " + id + " is not awaiting approval");
    }
    this.toilStatus = ToilStatus.REJECTED;
    this.rejectionReason = reason;
    this.approvalRequestedAt = null;
  }

  public boolean isRejected() {
    return status == TimesheetStatus.DRAFT && toilStatus == ToilStatus.REJECTED;
  }

  // --- Accrual ---

  /** Approved with TOIL to credit and no allocation linked yet. */
  public boolean isAwaitingAccrual() {
    return status != TimesheetStatus.CANCELLED
        && toilStatus == ToilStatus.PENDING_ACCRUAL
        && approvedAt != null
        && toilAllocationId == null;
  }

  public boolean isAccrued() {
    return status == TimesheetStatus.SUBMITTED && toilAllocationId != null;
  }

  public void markAccrued(UUID allocationId, BigDecimal accruedDays) {
    if (!isAwaitingAccrual()) {
      throw new IllegalStateException("Timesheet " + id + " is not awaiting accrual");
    }
    this.status = TimesheetStatus.SUBMITTED;
    this.toilStatus = ToilStatus.ACCRUED;
    this.toilAllocationId = Objects.requireNonNull(allocationId);
    this.toilAccruedDays = accruedDays;
    this.lastAccrualError = null;
    this.lastAccrualRetryable = false;
  }

  /** Approved timesheet with nothing to credit. */
  public void markNothingToAccrue() {
    this.status = TimesheetStatus.SUBMITTED;
    this.toilStatus = ToilStatus.NOT_APPLICABLE;
  }

  /**
   * Compensation after a failed accrual: back to an unlinked draft. The approval is kept so the
   * retry path can accrue without another supervisor decision. Only retryable failures are picked
   * up again by the sweeper; the rest wait for the supervisor to approve again.
   */
  public void markAccrualFailed(String error, boolean retryable) {
    this.status = TimesheetStatus.DRAFT;
    this.toilStatus = ToilStatus.PENDING_ACCRUAL;
    this.toilAllocationId = null;
    this.toilAccruedDays = null;
    this.lastAccrualError =
        error != null && error.length() > MAX_ERROR_LENGTH
            ? error.substring(0, MAX_ERROR_LENGTH)
            : error;
    this.lastAccrualRetryable = retryable;
  }

  /** Display status only; follows how much of the linked allocation is left. */
  public void updateUsage(ToilStatus usage) {
    if (!ToilStatus.USAGE_STATES.contains(usage) || !ToilStatus.USAGE_STATES.contains(toilStatus)) {
      throw new IllegalStateException("Cannot move TOIL status " + toilStatus + " to " + usage);
    }
    this.toilStatus = usage;
  }

  // --- Cancellation ---

  public void cancel() {
    requireStatus(TimesheetStatus.SUBMITTED, "cancel");
    this.status = TimesheetStatus.CANCELLED;
    this.toilStatus = ToilStatus.CANCELLED;
  }

  private void requireStatus(TimesheetStatus expected, String action) {
    if (this.status != expected) {
      throw new IllegalStateException(
          "Cannot " + action + " timesheet in status " + this.status + "; expected " + expected);
    }
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getEmployeeId() {
    return employeeId;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public TimesheetStatus getStatus() {
    return status;
  }

  public ToilStatus getToilStatus() {
    return toilStatus;
  }

  public BigDecimal getTotalToilHours() {
    return totalToilHours;
  }

  public BigDecimal getToilDays() {
    return toilDays;
  }

  public UUID getToilAllocationId() {
    return toilAllocationId;
  }

  public BigDecimal getToilAccruedDays() {
    return toilAccruedDays;
  }

  public Instant getApprovalRequestedAt() {
    return approvalRequestedAt;
  }

  public String getApprovedBy() {
    return approvedBy;
  }

  public Instant getApprovedAt() {
    return approvedAt;
  }

  public String getRejectionReason() {
    return rejectionReason;
  }

  public String getLastAccrualError() {
    return lastAccrualError;
  }

  public boolean isLastAccrualRetryable() {
    return lastAccrualRetryable;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public long getVersion() {
    return version;
  }
}
