package io.b2mash.toil.ledger;

import java.util.EnumSet;
import java.util.Set;

/** What produced a ledger entry. Credits and their reversals vs. leave debits and theirs. */
public enum TransactionType {
  ALLOCATION,
  ALLOCATION_REVERSAL,
  LEAVE_APPLICATION,
  LEAVE_APPLICATION_REVERSAL;

  public static final Set<TransactionType> ACCRUAL_TYPES =
      EnumSet.of(ALLOCATION, ALLOCATION_REVERSAL);

  public static final Set<TransactionType> CONSUMPTION_TYPES =
      EnumSet.of(LEAVE_APPLICATION, LEAVE_APPLICATION_REVERSAL);
}
