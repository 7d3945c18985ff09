package io.b2mash.toil.leave;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LeaveApplicationRepository extends JpaRepository<LeaveApplication, UUID> {

  List<LeaveApplication> findByEmployeeIdOrderByFromDateDesc(UUID employeeId);
}
