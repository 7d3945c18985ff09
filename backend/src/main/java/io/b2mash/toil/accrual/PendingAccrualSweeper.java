package io.b2mash.toil.accrual;

import io.b2mash.toil.config.AccrualExecutorConfiguration;
import io.b2mash.toil.config.ToilProperties;
import io.b2mash.toil.timesheet.TimesheetRepository;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-queues approved timesheets that never got their allocation: jobs lost to a restart, rejected
 * by a full queue, or given up after retries. Only timesheets idle for longer than the grace period
 * are picked, so in-flight jobs are left alone.
 */
@Component
public class PendingAccrualSweeper {

  private static final Logger log = LoggerFactory.getLogger(PendingAccrualSweeper.class);

  private final TimesheetRepository timesheetRepository;
  private final TaskExecutor accrualExecutor;
  private final AccrualWorker accrualWorker;
  private final ToilProperties properties;
  private final Clock clock;

  public PendingAccrualSweeper(
      TimesheetRepository timesheetRepository,
      @Qualifier(AccrualExecutorConfiguration.ACCRUAL_EXECUTOR) TaskExecutor accrualExecutor,
      AccrualWorker accrualWorker,
      ToilProperties properties,
      Clock clock) {
    this.timesheetRepository = timesheetRepository;
    this.accrualExecutor = accrualExecutor;
    this.accrualWorker = accrualWorker;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelayString = "${toil.accrual.sweep-interval:PT10M}",
      initialDelayString = "${toil.accrual.sweep-interval:PT10M}")
  public void sweep() {
    var before = Instant.now(clock).minus(properties.accrual().sweepGrace());
    var stalled = timesheetRepository.findStalledAccruals(before);
    if (stalled.isEmpty()) {
      return;
    }

    int queued = 0;
    for (var timesheet : stalled) {
      try {
        accrualExecutor.execute(() -> accrualWorker.process(timesheet.getId()));
        queued++;
      } catch (TaskRejectedException e) {
        log.warn(
            "Accrual queue full; {} stalled timesheet(s) left for the next sweep",
            stalled.size() - queued);
        break;
      }
    }
    log.info(
        "Pending-accrual sweep re-queued {} of {} stalled timesheet(s)", queued, stalled.size());
  }
}
