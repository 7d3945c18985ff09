package io.b2mash.toil.consumption;

import io.b2mash.toil.exception.ValidationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** Splits a request across allocations, draining the oldest first. */
public final class FifoConsumptionPlanner {

  private FifoConsumptionPlanner() {}

  /**
   * @param available allocations in FIFO order, as returned by {@link FifoConsumptionTracker}
   * @throws ValidationException INSUFFICIENT_TOIL_BALANCE if the allocations cannot cover the
   *     request
   */
  public static List<ConsumptionSlice> plan(
      List<AvailableAllocation> available, BigDecimal requestedDays) {
    if (requestedDays == null || requestedDays.signum() <= 0) {
      throw new ValidationException(
          "INVALID_LEAVE_DAYS", "Invalid leave days", "Requested days must be positive");
    }

    var total =
        available.stream()
            .map(AvailableAllocation::balance)
            .filter(balance -> balance.signum() > 0)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    if (total.compareTo(requestedDays) < 0) {
      throw insufficient(total, requestedDays);
    }

    var slices = new ArrayList<ConsumptionSlice>();
    var remaining = requestedDays;
    for (var allocation : available) {
      if (remaining.signum() <= 0) {
        break;
      }
      if (allocation.balance().signum() <= 0) {
        continue;
      }
      var take = allocation.balance().min(remaining);
      slices.add(new ConsumptionSlice(allocation.allocationId(), take));
      remaining = remaining.subtract(take);
    }
    return slices;
  }

  public static ValidationException insufficient(BigDecimal available, BigDecimal requested) {
    return new ValidationException(
        "INSUFFICIENT_TOIL_BALANCE",
        "Insufficient TOIL balance",
        "Requested "
            + requested.stripTrailingZeros().toPlainString()
            + " day(s) but only "
            + available.stripTrailingZeros().toPlainString()
            + " day(s) of TOIL are available");
  }
}
