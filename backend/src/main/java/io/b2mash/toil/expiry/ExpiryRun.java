package io.b2mash.toil.expiry;

import java.time.LocalDate;

/**
 * Result of one expiry pass.
 *
 * @param cutoff allocations granted before this date were expired
 */
public record ExpiryRun(
    LocalDate asOf, LocalDate cutoff, int entriesExpired, int timesheetsExpired) {}
