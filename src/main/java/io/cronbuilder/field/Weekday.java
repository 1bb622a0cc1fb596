package io.cronbuilder.field;

import java.util.Locale;

/** Represents a day of the week. */
public enum Weekday {
  MONDAY(1),
  TUESDAY(2),
  WEDNESDAY(3),
  THURSDAY(4),
  FRIDAY(5),
  SATURDAY(6),
  SUNDAY(7);

  private final int isoNumber;

  Weekday(int isoNumber) {
    this.isoNumber = isoNumber;
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int number() {
    return isoNumber;
  }

  /**
   * Returns the three-letter cron abbreviation (MON, TUE, ..., SUN).
   *
   * @return the cron day of week name
   */
  public String cronName() {
    return name().substring(0, 3).toUpperCase(Locale.ROOT);
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(java.time.DayOfWeek dow) {
    return values()[dow.getValue() - 1];
  }
}
