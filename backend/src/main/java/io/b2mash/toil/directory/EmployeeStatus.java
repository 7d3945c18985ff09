package io.b2mash.toil.directory;

public enum EmployeeStatus {
  ACTIVE,
  INACTIVE
}
