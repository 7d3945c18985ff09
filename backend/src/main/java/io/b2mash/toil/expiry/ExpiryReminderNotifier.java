package io.b2mash.toil.expiry;

/** Outbound port for expiry reminders. Delivery (email, chat) lives outside this service. */
public interface ExpiryReminderNotifier {

  void notify(ExpiryReminder reminder);
}
