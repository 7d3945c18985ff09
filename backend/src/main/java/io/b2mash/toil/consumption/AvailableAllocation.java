package io.b2mash.toil.consumption;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * An allocation that can still be drawn on.
 *
 * @param allocated the allocation's cached total
 * @param balance what is left according to the ledger
 */
public record AvailableAllocation(
    UUID allocationId,
    BigDecimal allocated,
    BigDecimal balance,
    LocalDate fromDate,
    LocalDate toDate,
    UUID sourceTimesheetId,
    long daysUntilExpiry) {}
