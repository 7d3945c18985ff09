package io.b2mash.toil.timesheet;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Pure TOIL arithmetic. Only non-billable hours earn TOIL; a TOIL day is eight hours; allocations
 * are granted in whole days, rounded up.
 */
public final class ToilCalculator {

  public static final BigDecimal HOURS_PER_DAY = new BigDecimal("8");

  private static final BigDecimal ZERO_HOURS = BigDecimal.ZERO.setScale(2);
  private static final BigDecimal ZERO_DAYS = BigDecimal.ZERO.setScale(3);

  private ToilCalculator() {}

  /** Sum of non-billable hours, rounded to 2 decimals. */
  public static BigDecimal toilHours(Collection<TimeLog> logs) {
    if (logs == null || logs.isEmpty()) {
      return ZERO_HOURS;
    }
    return logs.stream()
        .filter(log -> !log.isBillable())
        .map(TimeLog::getHours)
        .reduce(BigDecimal.ZERO, BigDecimal::add)
        .setScale(2, RoundingMode.HALF_UP);
  }

  /** {@code hours / 8} rounded to 3 decimals; zero for zero or negative input. */
  public static BigDecimal toilDays(BigDecimal hours) {
    if (hours == null || hours.signum() <= 0) {
      return ZERO_DAYS;
    }
    return hours.divide(HOURS_PER_DAY, 3, RoundingMode.HALF_UP);
  }

  /** Whole days credited for an accrual: 0.75 becomes 1, 2.0 stays 2. */
  public static BigDecimal allocationDays(BigDecimal toilDays) {
    if (toilDays == null || toilDays.signum() <= 0) {
      return BigDecimal.ZERO;
    }
    return toilDays.setScale(0, RoundingMode.CEILING);
  }

  public static List<BreakdownLine> breakdown(List<TimeLog> logs) {
    return logs.stream()
        .filter(log -> !log.isBillable())
        .map(
            log ->
                new BreakdownLine(
                    log.getLogDate(),
                    log.getHours().setScale(2, RoundingMode.HALF_UP),
                    log.getActivityType(),
                    log.getDescription()))
        .toList();
  }

  public record BreakdownLine(
      LocalDate date, BigDecimal hours, String activityType, String description) {}
}
