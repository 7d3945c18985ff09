package io.b2mash.toil.config;

import java.time.Duration;
import java.time.LocalDate;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables for TOIL accrual, expiry and reporting.
 *
 * @param allocationValidityMonths how long an allocation stays usable after its from-date
 * @param expiringSoonWindowDays horizon for the "expiring soon" balance and reminder job
 * @param ledgerDefaultWindowDays ledger history returned when no date range is given
 * @param lockTimeout how long to wait for the per-employee row lock before giving up
 * @param accrual background accrual worker settings
 * @param expiry cron expressions for the expiry and reminder jobs
 */
@ConfigurationProperties(prefix = "toil")
public record ToilProperties(
    @DefaultValue("6") int allocationValidityMonths,
    @DefaultValue("30") int expiringSoonWindowDays,
    @DefaultValue("120") int ledgerDefaultWindowDays,
    @DefaultValue("5s") Duration lockTimeout,
    @DefaultValue Accrual accrual,
    @DefaultValue Expiry expiry) {

  /** Allocations granted before this date are past their validity on {@code asOf}. */
  public LocalDate grantCutoff(LocalDate asOf) {
    return asOf.minusMonths(allocationValidityMonths);
  }

  /**
   * Whether TOIL granted for {@code [fromDate, toDate]} can still be spent on {@code asOf}. The
   * window closes at whichever comes first, the end date or the validity period, so month-end
   * clamping never leaves days that are unspendable but not yet expired.
   */
  public boolean isWindowOpen(LocalDate fromDate, LocalDate toDate, LocalDate asOf) {
    return !fromDate.isBefore(grantCutoff(asOf)) && !toDate.isBefore(asOf);
  }

  public record Accrual(
      @DefaultValue("4") int workerPoolSize,
      @DefaultValue("500") int queueCapacity,
      @DefaultValue("3") int maxAttempts,
      @DefaultValue("2s") Duration initialBackoff,
      @DefaultValue("2.0") double backoffMultiplier,
      @DefaultValue("30s") Duration maxBackoff,
      @DefaultValue("PT10M") Duration sweepInterval,
      @DefaultValue("5m") Duration sweepGrace) {}

  public record Expiry(
      @DefaultValue("0 15 1 * * *") String cron,
      @DefaultValue("0 0 9 * * MON") String reminderCron) {}
}
