package io.b2mash.toil.expiry;

import io.b2mash.toil.config.ToilProperties;
import io.b2mash.toil.directory.EmployeeRepository;
import io.b2mash.toil.ledger.LeaveLedgerService;
import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Weekly nudge for employees with TOIL expiring inside the expiring-soon window. */
@Component
public class ToilExpiryReminderJob {

  private static final Logger log = LoggerFactory.getLogger(ToilExpiryReminderJob.class);

  private final LeaveLedgerService ledgerService;
  private final EmployeeRepository employeeRepository;
  private final ExpiryReminderNotifier notifier;
  private final ToilProperties properties;
  private final Clock clock;

  public ToilExpiryReminderJob(
      LeaveLedgerService ledgerService,
      EmployeeRepository employeeRepository,
      ExpiryReminderNotifier notifier,
      ToilProperties properties,
      Clock clock) {
    this.ledgerService = ledgerService;
    this.employeeRepository = employeeRepository;
    this.notifier = notifier;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(cron = "${toil.expiry.reminder-cron:0 0 9 * * MON}")
  public void sendReminders() {
    var today = LocalDate.now(clock);
    sendReminders(today, today.plusDays(properties.expiringSoonWindowDays()));
  }

  /** @return number of reminders handed to the notifier */
  int sendReminders(LocalDate from, LocalDate to) {
    var balances = ledgerService.expiringBalances(from, to);
    int sent = 0;
    for (var balance : balances) {
      try {
        var employee = employeeRepository.findById(balance.getEmployeeId()).orElse(null);
        if (employee == null || !employee.isActive()) {
          continue;
        }
        notifier.notify(
            new ExpiryReminder(
                employee.getId(),
                employee.getName(),
                employee.getUserId(),
                balance.getBalance(),
                balance.getEarliestExpiry()));
        sent++;
      } catch (Exception e) {
        log.error("TOIL expiry reminder failed for employee {}", balance.getEmployeeId(), e);
      }
    }
    log.info("TOIL expiry reminders: {} sent for balances expiring {}..{}", sent, from, to);
    return sent;
  }
}
