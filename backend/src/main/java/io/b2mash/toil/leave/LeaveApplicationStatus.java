package io.b2mash.toil.leave;

public enum LeaveApplicationStatus {
  APPROVED,
  CANCELLED
}
