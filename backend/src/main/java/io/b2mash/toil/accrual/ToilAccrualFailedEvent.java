package io.b2mash.toil.accrual;

import java.util.UUID;

/**
 * Accrual gave up for this delivery. {@code retryable} failures are picked up again by the
 * pending-accrual sweeper.
 */
public record ToilAccrualFailedEvent(
    UUID timesheetId, String errorCode, String message, boolean retryable, int attempts) {}
