package io.b2mash.toil.timesheet;

import io.b2mash.toil.directory.Employee;
import io.b2mash.toil.directory.EmployeeRepository;
import io.b2mash.toil.directory.UserAccount;
import io.b2mash.toil.directory.UserAccountRepository;
import io.b2mash.toil.exception.ForbiddenException;
import io.b2mash.toil.exception.ValidationException;
import io.b2mash.toil.security.CallerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides who may approve an employee's TOIL. Each broken link in the approval route fails with
 * its own error so the fix is obvious: no supervisor, supervisor record gone, supervisor without a
 * login, disabled login, or simply the wrong caller.
 */
@Component
public class SupervisorApprovalGuard {

  private static final Logger log = LoggerFactory.getLogger(SupervisorApprovalGuard.class);

  private final EmployeeRepository employeeRepository;
  private final UserAccountRepository userAccountRepository;

  public SupervisorApprovalGuard(
      EmployeeRepository employeeRepository, UserAccountRepository userAccountRepository) {
    this.employeeRepository = employeeRepository;
    this.userAccountRepository = userAccountRepository;
  }

  /**
   * Passes if the caller may approve or reject TOIL for {@code employee}. Privileged callers always
   * pass.
   */
  public void requireApprover(Employee employee, CallerIdentity caller) {
    if (caller.isPrivileged()) {
      log.debug(
          "Privileged caller {} bypasses supervisor check for {}",
          caller.userId(),
          employee.getId());
      return;
    }
    String supervisorUser = resolveApprovalRoute(employee);
    if (!caller.is(supervisorUser)) {
      log.warn(
          "User {} attempted to approve TOIL for employee {} supervised by {}",
          caller.userId(),
          employee.getId(),
          supervisorUser);
      throw new ForbiddenException(
          "NOT_SUPERVISOR",
          "Not the supervisor",
          "Only the supervisor of " + employee.getName() + " can approve or reject this TOIL");
    }
  }

  /**
   * Checks the employee has a usable approver and returns the supervisor's linked identity.
   *
   * @throws ValidationException with code SUPERVISOR_NOT_ASSIGNED, SUPERVISOR_NOT_FOUND,
   *     SUPERVISOR_NO_USER or SUPERVISOR_ACCOUNT_DISABLED
   */
  public String resolveApprovalRoute(Employee employee) {
    if (!employee.hasSupervisor()) {
      throw new ValidationException(
          "SUPERVISOR_NOT_ASSIGNED",
          "No supervisor assigned",
          "Employee "
              + employee.getName()
              + " has no supervisor. Ask HR to assign one before TOIL can be approved.");
    }
    var supervisor =
        employeeRepository
            .findById(employee.getSupervisorId())
            .orElseThrow(
                () ->
                    new ValidationException(
                        "SUPERVISOR_NOT_FOUND",
                        "Supervisor not found",
                        "Supervisor "
                            + employee.getSupervisorId()
                            + " of employee "
                            + employee.getName()
                            + " does not exist"));
    if (supervisor.getUserId() == null) {
      throw new ValidationException(
          "SUPERVISOR_NO_USER",
          "Supervisor has no login",
          "Supervisor "
              + supervisor.getName()
              + " has no linked user account and cannot approve TOIL");
    }
    boolean enabled =
        userAccountRepository
            .findById(supervisor.getUserId())
            .map(UserAccount::isEnabled)
            .orElse(false);
    if (!enabled) {
      throw new ValidationException(
          "SUPERVISOR_ACCOUNT_DISABLED",
          "Supervisor account disabled",
          "The user account of supervisor " + supervisor.getName() + " is disabled or missing");
    }
    return supervisor.getUserId();
  }
}
