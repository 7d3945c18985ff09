package io.b2mash.toil;

import io.b2mash.toil.config.ToilProperties;
import io.b2mash.toil.timesheet.Timesheet;
import io.b2mash.toil.timesheet.ToilCalculator;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/** Shared builders for unit tests. Entities get their ids through reflection. */
public final class ToilFixtures {

  public static final LocalDate TODAY = LocalDate.of(2025, 3, 14);

  private ToilFixtures() {}

  public static Clock fixedClock() {
    return Clock.fixed(TODAY.atTime(10, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
  }

  public static ToilProperties properties() {
    return new ToilProperties(
        6,
        30,
        120,
        Duration.ofSeconds(5),
        new ToilProperties.Accrual(
            2,
            10,
            3,
            Duration.ofMillis(1),
            2.0,
            Duration.ofMillis(4),
            Duration.ofMinutes(10),
            Duration.ofMinutes(5)),
        new ToilProperties.Expiry("-", "-"));
  }

  public static <T> T withId(T entity, UUID id) {
    try {
      var field = entity.getClass().getDeclaredField("id");
      field.setAccessible(true);
      field.set(entity, id);
      return entity;
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot set id on " + entity.getClass(), e);
    }
  }

  /** A draft with the given TOIL hours, not yet submitted. */
  public static Timesheet draft(UUID employeeId, String toilHours) {
    var timesheet = withId(new Timesheet(employeeId, TODAY.minusDays(6), TODAY), UUID.randomUUID());
    var hours = new BigDecimal(toilHours).setScale(2);
    timesheet.applyToilTotals(hours, ToilCalculator.toilDays(hours));
    return timesheet;
  }

  /** Approved and waiting for the accrual job: SUBMITTED / PENDING_ACCRUAL. */
  public static Timesheet approved(UUID employeeId, String toilHours) {
    var timesheet = draft(employeeId, toilHours);
    timesheet.requestApproval(Instant.parse("2025-03-14T08:00:00Z"));
    timesheet.approve("user_supervisor", Instant.parse("2025-03-14T09:00:00Z"));
    return timesheet;
  }

  /** Accrued to {@code allocationId} with the whole-day credit for its hours. */
  public static Timesheet accrued(UUID employeeId, String toilHours, UUID allocationId) {
    var timesheet = approved(employeeId, toilHours);
    timesheet.markAccrued(allocationId, ToilCalculator.allocationDays(timesheet.getToilDays()));
    return timesheet;
  }
}
