package io.b2mash.toil.timesheet;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/** One line of a timesheet. Owned by exactly one timesheet and replaced wholesale on draft save. */
@Entity
@Table(name = "timesheet_time_logs")
public class TimeLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "timesheet_id", nullable = false, updatable = false)
  private UUID timesheetId;

  @Column(name = "position", nullable = false)
  private int position;

  @Column(name = "log_date", nullable = false)
  private LocalDate logDate;

  @Column(name = "hours", nullable = false, precision = 6, scale = 2)
  private BigDecimal hours;

  @Column(name = "is_billable", nullable = false)
  private boolean billable;

  @Column(name = "activity_type", length = 100)
  private String activityType;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  protected TimeLog() {}

  public TimeLog(
      UUID timesheetId,
      int position,
      LocalDate logDate,
      BigDecimal hours,
      boolean billable,
      String activityType,
      String description) {
    this.timesheetId = timesheetId;
    this.position = position;
    this.logDate = Objects.requireNonNull(logDate, "logDate must not be null");
    this.hours = Objects.requireNonNull(hours, "hours must not be null");
    this.billable = billable;
    this.activityType = activityType;
    this.description = description;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTimesheetId() {
    return timesheetId;
  }

  public int getPosition() {
    return position;
  }

  public LocalDate getLogDate() {
    return logDate;
  }

  public BigDecimal getHours() {
    return hours;
  }

  public boolean isBillable() {
    return billable;
  }

  public String getActivityType() {
    return activityType;
  }

  public String getDescription() {
    return description;
  }
}
