package io.b2mash.toil.directory;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EmployeeRepository extends JpaRepository<Employee, UUID> {

  Optional<Employee> findByUserId(String userId);

  List<Employee> findBySupervisorIdOrderByNameAsc(UUID supervisorId);

  List<Employee> findBySupervisorIdAndStatusOrderByNameAsc(
      UUID supervisorId, EmployeeStatus status);

  long countBySupervisorIdAndStatus(UUID supervisorId, EmployeeStatus status);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT e FROM Employee e WHERE e.id = :id")
  Optional<Employee> findByIdForUpdate(@Param("id") UUID id);
}
