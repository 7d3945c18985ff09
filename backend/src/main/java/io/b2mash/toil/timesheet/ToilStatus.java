package io.b2mash.toil.timesheet;

import java.util.EnumSet;
import java.util.Set;

public enum ToilStatus {
  NOT_APPLICABLE,
  PENDING_ACCRUAL,
  ACCRUED,
  PARTIALLY_USED,
  FULLY_USED,
  EXPIRED,
  REJECTED,
  CANCELLED;

  /** Display states of an accrued timesheet; only these follow allocation usage and expiry. */
  public static final Set<ToilStatus> USAGE_STATES =
      EnumSet.of(ACCRUED, PARTIALLY_USED, FULLY_USED);
}
