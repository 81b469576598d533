package io.b2mash.lms.user;

public record NotificationPreferences(boolean email, boolean sms, boolean push) {

  public static NotificationPreferences defaults() {
    return new NotificationPreferences(true, false, false);
  }
}
