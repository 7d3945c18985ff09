package io.b2mash.toil.expiry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Default notifier: writes the reminder to the log. A delivery adapter replaces it as @Primary. */
@Component
public class LoggingExpiryReminderNotifier implements ExpiryReminderNotifier {

  private static final Logger log = LoggerFactory.getLogger(LoggingExpiryReminderNotifier.class);

  @Override
  public void notify(ExpiryReminder reminder) {
    log.info(
        "TOIL expiry reminder: employee={} ({}) has {} day(s) expiring from {}",
        reminder.employeeId(),
        reminder.employeeName(),
        reminder.expiringDays().stripTrailingZeros().toPlainString(),
        reminder.earliestExpiry());
  }
}
