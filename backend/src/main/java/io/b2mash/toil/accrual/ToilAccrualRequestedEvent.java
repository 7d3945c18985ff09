package io.b2mash.toil.accrual;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a timesheet with TOIL is approved. Handled after the approving transaction
 * commits; the accrual itself runs on the background worker pool.
 */
public record ToilAccrualRequestedEvent(
    UUID timesheetId, UUID employeeId, BigDecimal toilDays, Instant requestedAt) {}
