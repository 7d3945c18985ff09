package io.b2mash.toil.directory;

import io.b2mash.toil.config.ToilProperties;
import io.b2mash.toil.exception.InfrastructureException;
import io.b2mash.toil.exception.ResourceNotFoundException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Acquires the per-employee row lock that serialises every allocation read-modify-write (accrual,
 * cancellation, leave debits). Must run inside the caller's transaction; the lock is released on
 * commit or rollback.
 */
@Service
public class EmployeeLockService {

  private static final Logger log = LoggerFactory.getLogger(EmployeeLockService.class);

  private final EmployeeRepository employeeRepository;
  private final ToilProperties properties;

  @PersistenceContext private EntityManager entityManager;

  public EmployeeLockService(EmployeeRepository employeeRepository, ToilProperties properties) {
    this.employeeRepository = employeeRepository;
    this.properties = properties;
  }

  /**
   * Locks the employee row with {@code SELECT ... FOR UPDATE}, bounded by {@code
   * toil.lock-timeout}.
   *
   * @throws ResourceNotFoundException if the employee does not exist
   * @throws InfrastructureException if the lock cannot be acquired in time (retryable)
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public Employee lock(UUID employeeId) {
    applyLockTimeout();
    try {
      return employeeRepository
          .findByIdForUpdate(employeeId)
          .orElseThrow(() -> new ResourceNotFoundException("Employee", employeeId));
    } catch (PessimisticLockingFailureException e) {
      log.warn("Timed out waiting for TOIL lock on employee {}", employeeId);
      throw new InfrastructureException(
          "LOCK_TIMEOUT",
          "Another TOIL operation for employee " + employeeId + " is in progress",
          e);
    }
  }

  private void applyLockTimeout() {
    // SET LOCAL scope: reverts when the surrounding transaction ends
    entityManager
        .createNativeQuery("SELECT set_config('lock_timeout', :timeout, true)")
        .setParameter("timeout", properties.lockTimeout().toMillis() + "ms")
        .getSingleResult();
  }
}
