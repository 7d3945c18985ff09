package io.b2mash.toil.consumption;

import java.math.BigDecimal;
import java.util.UUID;

/** The part of a leave request drawn from one allocation. */
public record ConsumptionSlice(UUID allocationId, BigDecimal days) {}
