package io.b2mash.toil.expiry;

import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Daily job that expires TOIL past its validity window. */
@Component
public class ToilExpiryProcessor {

  private static final Logger log = LoggerFactory.getLogger(ToilExpiryProcessor.class);

  private final ToilExpiryService expiryService;
  private final Clock clock;

  public ToilExpiryProcessor(ToilExpiryService expiryService, Clock clock) {
    this.expiryService = expiryService;
    this.clock = clock;
  }

  @Scheduled(cron = "${toil.expiry.cron:0 15 1 * * *}")
  public void expireToil() {
    log.info("TOIL expiry job started");
    try {
      var run = expiryService.expireAsOf(LocalDate.now(clock));
      log.info(
          "TOIL expiry job completed: {} entries, {} timesheets",
          run.entriesExpired(),
          run.timesheetsExpired());
    } catch (Exception e) {
      log.error("TOIL expiry job failed; the next run will pick up where this one stopped", e);
    }
  }
}
