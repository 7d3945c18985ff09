package io.b2mash.toil.allocation;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of {@link AllocationLedgerManager#accrue(UUID)}.
 *
 * @param allocationId the allocation credited; null when there was nothing to credit
 * @param creditedDays whole days added by this call; zero for replays
 * @param toppedUp true if an existing open allocation was increased
 * @param alreadyAccrued true if the timesheet had been accrued by an earlier delivery
 */
public record AccrualResult(
    UUID timesheetId,
    UUID allocationId,
    BigDecimal creditedDays,
    boolean toppedUp,
    boolean alreadyAccrued) {

  static AccrualResult alreadyAccrued(UUID timesheetId, UUID allocationId) {
    return new AccrualResult(timesheetId, allocationId, BigDecimal.ZERO, false, true);
  }

  static AccrualResult nothingToAccrue(UUID timesheetId) {
    return new AccrualResult(timesheetId, null, BigDecimal.ZERO, false, false);
  }
}
