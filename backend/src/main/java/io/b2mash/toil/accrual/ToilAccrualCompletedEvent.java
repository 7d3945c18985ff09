package io.b2mash.toil.accrual;

import java.math.BigDecimal;
import java.util.UUID;

public record ToilAccrualCompletedEvent(
    UUID timesheetId, UUID allocationId, BigDecimal creditedDays, boolean toppedUp, int attempts) {}
