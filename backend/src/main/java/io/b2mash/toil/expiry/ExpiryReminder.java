package io.b2mash.toil.expiry;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/** TOIL an employee will lose unless used before {@code earliestExpiry}. */
public record ExpiryReminder(
    UUID employeeId,
    String employeeName,
    String userId,
    BigDecimal expiringDays,
    LocalDate earliestExpiry) {}
