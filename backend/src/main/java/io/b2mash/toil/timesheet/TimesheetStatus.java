package io.b2mash.toil.timesheet;

/** Document status. Only DRAFT timesheets are editable. */
public enum TimesheetStatus {
  DRAFT,
  SUBMITTED,
  CANCELLED
}
