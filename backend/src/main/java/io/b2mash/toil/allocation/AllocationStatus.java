package io.b2mash.toil.allocation;

public enum AllocationStatus {
  ACTIVE,
  CANCELLED
}
