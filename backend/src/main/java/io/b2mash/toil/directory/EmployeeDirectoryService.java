package io.b2mash.toil.directory;

import io.b2mash.toil.audit.AuditEventBuilder;
import io.b2mash.toil.audit.AuditService;
import io.b2mash.toil.exception.ValidationException;
import java.util.HashMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Upserts employees and user accounts pushed from the HR directory. */
@Service
public class EmployeeDirectoryService {

  private static final Logger log = LoggerFactory.getLogger(EmployeeDirectoryService.class);

  private final EmployeeRepository employeeRepository;
  private final UserAccountRepository userAccountRepository;
  private final AuditService auditService;

  public EmployeeDirectoryService(
      EmployeeRepository employeeRepository,
      UserAccountRepository userAccountRepository,
      AuditService auditService) {
    this.employeeRepository = employeeRepository;
    this.userAccountRepository = userAccountRepository;
    this.auditService = auditService;
  }

  @Transactional
  public Employee upsertEmployee(
      UUID id, String name, String userId, UUID supervisorId, EmployeeStatus status) {
    if (id.equals(supervisorId)) {
      throw new ValidationException(
          "SELF_SUPERVISION", "Invalid supervisor", "An employee cannot supervise themselves");
    }
    if (supervisorId != null && !employeeRepository.existsById(supervisorId)) {
      throw new ValidationException(
          "SUPERVISOR_NOT_FOUND",
          "Supervisor not found",
          "Supervisor " + supervisorId + " does not exist");
    }

    var existing = employeeRepository.findById(id);
    Employee employee;
    if (existing.isPresent()) {
      employee = existing.get();
      employee.updateProfile(name, userId, supervisorId, status);
    } else {
      employee = new Employee(id, name, userId, supervisorId);
      if (status != null && status != EmployeeStatus.ACTIVE) {
        employee.updateProfile(name, userId, supervisorId, status);
      }
    }
    employee = employeeRepository.save(employee);

    var details = new HashMap<String, Object>();
    details.put("name", name);
    details.put("status", employee.getStatus().name());
    if (supervisorId != null) {
      details.put("supervisor_id", supervisorId.toString());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(existing.isPresent() ? "employee.updated" : "employee.created")
            .entityType("employee")
            .entityId(id)
            .details(details)
            .build());

    log.info("Upserted employee {} (supervisor={})", id, supervisorId);
    return employee;
  }

  @Transactional
  public UserAccount upsertUserAccount(String userId, String email, boolean enabled) {
    var account =
        userAccountRepository
            .findById(userId)
            .map(
                existing -> {
                  existing.update(email, enabled);
                  return existing;
                })
            .orElseGet(() -> new UserAccount(userId, email, enabled));
    account = userAccountRepository.save(account);
    log.info("Upserted user account {} (enabled={})", userId, enabled);
    return account;
  }
}
