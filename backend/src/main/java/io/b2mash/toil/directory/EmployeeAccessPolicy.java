package io.b2mash.toil.directory;

import io.b2mash.toil.exception.ForbiddenException;
import io.b2mash.toil.exception.ResourceNotFoundException;
import io.b2mash.toil.exception.ValidationException;
import io.b2mash.toil.security.CallerIdentity;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Read access to an employee's TOIL data: the employee, their supervisor, or a privileged caller.
 */
@Component
public class EmployeeAccessPolicy {

  private final EmployeeRepository employeeRepository;

  public EmployeeAccessPolicy(EmployeeRepository employeeRepository) {
    this.employeeRepository = employeeRepository;
  }

  public Employee requireReadAccess(UUID employeeId, CallerIdentity caller) {
    var employee =
        employeeRepository
            .findById(employeeId)
            .orElseThrow(() -> new ResourceNotFoundException("Employee", employeeId));
    if (caller.isPrivileged()
        || caller.is(employee.getUserId())
        || isSupervisorOf(employee, caller)) {
      return employee;
    }
    throw new ForbiddenException(
        "EMPLOYEE_ACCESS_DENIED",
        "Access denied",
        "You can only view TOIL data for yourself or the employees you supervise");
  }

  public boolean isSupervisorOf(Employee employee, CallerIdentity caller) {
    if (!employee.hasSupervisor()) {
      return false;
    }
    return employeeRepository
        .findById(employee.getSupervisorId())
        .map(supervisor -> caller.is(supervisor.getUserId()))
        .orElse(false);
  }

  /** Resolves the employee record linked to the caller's identity. */
  public Employee requireSelf(CallerIdentity caller) {
    return employeeRepository
        .findByUserId(caller.userId())
        .orElseThrow(
            () ->
                new ValidationException(
                    "NO_EMPLOYEE_RECORD",
                    "No employee record",
                    "No employee record is linked to user " + caller.userId()));
  }
}
