package io.b2mash.toil.directory;

import io.b2mash.toil.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reports every configuration problem that would block an employee's TOIL approvals, so HR can
 * fix them before a timesheet gets stuck.
 */
@Service
public class EmployeeSetupService {

  private final EmployeeRepository employeeRepository;
  private final UserAccountRepository userAccountRepository;

  public EmployeeSetupService(
      EmployeeRepository employeeRepository, UserAccountRepository userAccountRepository) {
    this.employeeRepository = employeeRepository;
    this.userAccountRepository = userAccountRepository;
  }

  @Transactional(readOnly = true)
  public SetupReport validateSetup(UUID employeeId) {
    var employee =
        employeeRepository
            .findById(employeeId)
            .orElseThrow(() -> new ResourceNotFoundException("Employee", employeeId));

    var issues = new ArrayList<String>();
    if (!employee.isActive()) {
      issues.add("Employee " + employee.getName() + " is not active");
    }

    PersonSummary supervisorSummary = null;
    String supervisorUser = null;
    if (!employee.hasSupervisor()) {
      issues.add("No supervisor assigned. Set a supervisor on the employee record.");
    } else {
      var supervisor = employeeRepository.findById(employee.getSupervisorId()).orElse(null);
      if (supervisor == null) {
        issues.add("Supervisor " + employee.getSupervisorId() + " does not exist");
      } else {
        supervisorSummary = PersonSummary.from(supervisor);
        supervisorUser = supervisor.getUserId();
        if (supervisorUser == null) {
          issues.add("Supervisor " + supervisor.getName() + " has no linked user account");
        } else {
          var account = userAccountRepository.findById(supervisorUser).orElse(null);
          if (account == null || !account.isEnabled()) {
            issues.add("Supervisor account " + supervisorUser + " is disabled or missing");
          }
        }
        if (!supervisor.isActive()) {
          issues.add("Supervisor " + supervisor.getName() + " is not active");
        }
      }
    }

    return new SetupReport(
        issues.isEmpty(),
        PersonSummary.from(employee),
        supervisorSummary,
        supervisorUser,
        List.copyOf(issues));
  }

  public record SetupReport(
      boolean valid,
      PersonSummary employee,
      PersonSummary supervisor,
      String supervisorUser,
      List<String> issues) {}

  public record PersonSummary(UUID id, String name, String userId, EmployeeStatus status) {

    static PersonSummary from(Employee employee) {
      return new PersonSummary(
          employee.getId(), employee.getName(), employee.getUserId(), employee.getStatus());
    }
  }
}
