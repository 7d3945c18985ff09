package io.b2mash.toil.leave;

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
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/** TOIL taken as time off. Its days are debited from allocations when it is recorded. */
@Entity
@Table(name = "leave_applications")
public class LeaveApplication {

  static final BigDecimal HALF_DAY = new BigDecimal("0.5");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "employee_id", nullable = false, updatable = false)
  private UUID employeeId;

  @Column(name = "from_date", nullable = false, updatable = false)
  private LocalDate fromDate;

  @Column(name = "to_date", nullable = false, updatable = false)
  private LocalDate toDate;

  @Column(name = "half_day", nullable = false, updatable = false)
  private boolean halfDay;

  @Column(
      name = "total_leave_days",
      nullable = false,
      updatable = false,
      precision = 10,
      scale = 3)
  private BigDecimal totalLeaveDays;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private LeaveApplicationStatus status;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "leave_approver", length = 255, updatable = false)
  private String leaveApprover;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected LeaveApplication() {}

  public LeaveApplication(
      UUID employeeId,
      LocalDate fromDate,
      LocalDate toDate,
      boolean halfDay,
      String description,
      String leaveApprover) {
    this.employeeId = Objects.requireNonNull(employeeId, "employeeId must not be null");
    this.fromDate = Objects.requireNonNull(fromDate, "fromDate must not be null");
    this.toDate = Objects.requireNonNull(toDate, "toDate must not be null");
    this.halfDay = halfDay;
    this.totalLeaveDays = leaveDays(fromDate, toDate, halfDay);
    this.status = LeaveApplicationStatus.APPROVED;
    this.description = description;
    this.leaveApprover = leaveApprover;
  }

  /** Inclusive calendar days, or half a day for a single-day half-day request. */
  public static BigDecimal leaveDays(LocalDate fromDate, LocalDate toDate, boolean halfDay) {
    if (toDate.isBefore(fromDate)) {
      throw new IllegalArgumentException("toDate must not precede fromDate");
    }
    if (halfDay) {
      if (!fromDate.equals(toDate)) {
        throw new IllegalArgumentException("A half day must start and end on the same date");
      }
      return HALF_DAY;
    }
    return BigDecimal.valueOf(ChronoUnit.DAYS.between(fromDate, toDate) + 1);
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

  public boolean isCancelled() {
    return status == LeaveApplicationStatus.CANCELLED;
  }

  public void cancel() {
    this.status = LeaveApplicationStatus.CANCELLED;
  }

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

  public boolean isHalfDay() {
    return halfDay;
  }

  public BigDecimal getTotalLeaveDays() {
    return totalLeaveDays;
  }

  public LeaveApplicationStatus getStatus() {
    return status;
  }

  public String getDescription() {
    return description;
  }

  /** Login of the supervisor the leave was recorded against. */
  public String getLeaveApprover() {
    return leaveApprover;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
