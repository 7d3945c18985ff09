package io.b2mash.toil.timesheet;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimeLogRepository extends JpaRepository<TimeLog, UUID> {

  List<TimeLog> findByTimesheetIdOrderByPositionAsc(UUID timesheetId);

  @Modifying(flushAutomatically = true)
  @Query("DELETE FROM TimeLog l WHERE l.timesheetId = :timesheetId")
  int deleteByTimesheetId(@Param("timesheetId") UUID timesheetId);
}
