package io.b2mash.toil.allocation;

import java.math.BigDecimal;
import java.util.UUID;

/** A cancelled timesheet's contribution taken back out of its allocation. */
public record ReleaseResult(
    UUID allocationId, BigDecimal releasedDays, BigDecimal remainingDays, boolean cancelled) {}
