package io.b2mash.toil.directory;

import io.b2mash.toil.security.CallerIdentity;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** The caller's reporting line: who reports to them and which TOIL role that gives them. */
@Service
public class EmployeeTeamService {

  private final EmployeeRepository employeeRepository;
  private final EmployeeAccessPolicy accessPolicy;

  public EmployeeTeamService(
      EmployeeRepository employeeRepository, EmployeeAccessPolicy accessPolicy) {
    this.employeeRepository = employeeRepository;
    this.accessPolicy = accessPolicy;
  }

  /** Active employees whose supervisor is the caller, by name. */
  @Transactional(readOnly = true)
  public List<Employee> myTeam(CallerIdentity caller) {
    var self = accessPolicy.requireSelf(caller);
    return employeeRepository.findBySupervisorIdAndStatusOrderByNameAsc(
        self.getId(), EmployeeStatus.ACTIVE);
  }

  /**
   * HR for privileged callers, SUPERVISOR for anyone with an active report, EMPLOYEE otherwise.
   * Privileged callers need no employee record.
   */
  @Transactional(readOnly = true)
  public CallerRole roleOf(CallerIdentity caller) {
    if (caller.isPrivileged()) {
      var employeeId = employeeRepository.findByUserId(caller.userId()).map(Employee::getId);
      return new CallerRole(ToilRole.HR, employeeId.orElse(null), 0);
    }
    var self = accessPolicy.requireSelf(caller);
    var reports =
        employeeRepository.countBySupervisorIdAndStatus(self.getId(), EmployeeStatus.ACTIVE);
    return new CallerRole(
        reports > 0 ? ToilRole.SUPERVISOR : ToilRole.EMPLOYEE, self.getId(), reports);
  }

  public enum ToilRole {
    HR,
    SUPERVISOR,
    EMPLOYEE
  }

  public record CallerRole(ToilRole role, UUID employeeId, long subordinatesCount) {}
}
