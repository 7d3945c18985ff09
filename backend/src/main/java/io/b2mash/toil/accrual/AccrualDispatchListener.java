package io.b2mash.toil.accrual;

import io.b2mash.toil.config.AccrualExecutorConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands approved timesheets to the accrual worker pool once the approval has committed. A job
 * rejected by a full queue is left for {@link PendingAccrualSweeper}.
 */
@Component
public class AccrualDispatchListener {

  private static final Logger log = LoggerFactory.getLogger(AccrualDispatchListener.class);

  private final TaskExecutor accrualExecutor;
  private final AccrualWorker accrualWorker;

  public AccrualDispatchListener(
      @Qualifier(AccrualExecutorConfiguration.ACCRUAL_EXECUTOR) TaskExecutor accrualExecutor,
      AccrualWorker accrualWorker) {
    this.accrualExecutor = accrualExecutor;
    this.accrualWorker = accrualWorker;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onAccrualRequested(ToilAccrualRequestedEvent event) {
    dispatch(event);
  }

  void dispatch(ToilAccrualRequestedEvent event) {
    try {
      accrualExecutor.execute(() -> accrualWorker.process(event.timesheetId()));
      log.debug(
          "Queued accrual of {} TOIL day(s) for timesheet {}",
          event.toilDays(),
          event.timesheetId());
    } catch (TaskRejectedException e) {
      log.warn(
          "Accrual queue full; timesheet {} will be picked up by the pending-accrual sweeper",
          event.timesheetId());
    }
  }
}
