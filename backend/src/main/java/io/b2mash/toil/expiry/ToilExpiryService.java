package io.b2mash.toil.expiry;

import io.b2mash.toil.config.ToilProperties;
import io.b2mash.toil.ledger.LeaveLedgerService;
import io.b2mash.toil.timesheet.TimesheetRepository;
import io.b2mash.toil.timesheet.ToilStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Expires TOIL older than the validity period. An allocation expires once its own from-date is
 * strictly before {@code asOf - validityMonths} or its to-date has passed, the same rule FIFO
 * consumption and the balance apply. Every unexpired ledger entry on it is flagged in one bulk
 * update, so re-running for the same day changes nothing.
 */
@Service
public class ToilExpiryService {

  private static final Logger log = LoggerFactory.getLogger(ToilExpiryService.class);

  private final LeaveLedgerService ledgerService;
  private final TimesheetRepository timesheetRepository;
  private final ToilProperties properties;
  private final Clock clock;

  public ToilExpiryService(
      LeaveLedgerService ledgerService,
      TimesheetRepository timesheetRepository,
      ToilProperties properties,
      Clock clock) {
    this.ledgerService = ledgerService;
    this.timesheetRepository = timesheetRepository;
    this.properties = properties;
    this.clock = clock;
  }

  @Transactional
  public ExpiryRun expireAsOf(LocalDate asOf) {
    var cutoff = properties.grantCutoff(asOf);

    int entries = ledgerService.expireClosedAllocations(cutoff, asOf);
    int timesheets =
        timesheetRepository.markExpiredForClosedAllocations(
            cutoff, asOf, ToilStatus.EXPIRED, ToilStatus.USAGE_STATES, Instant.now(clock));

    if (entries > 0 || timesheets > 0) {
      log.info(
          "TOIL expiry as of {}: {} ledger entries and {} timesheet(s) expired (granted before {})",
          asOf,
          entries,
          timesheets,
          cutoff);
    } else {
      log.debug("TOIL expiry as of {}: nothing granted before {} left to expire", asOf, cutoff);
    }
    return new ExpiryRun(asOf, cutoff, entries, timesheets);
  }
}
