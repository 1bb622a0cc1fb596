package io.cronbuilder;

import io.cronbuilder.field.CronField;
import io.cronbuilder.field.Weekday;
import java.util.Locale;
import java.util.Objects;

/**
 * A fluent builder for 5-field (or 6-field, with seconds) cron expressions.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * String cron = new CronBuilder().weekly(Weekday.MONDAY, 9, 30).build();
 * // "30 9 * * MON"
 * }</pre>
 *
 * <p>Every setter validates its argument when called and returns this builder. Later calls
 * overwrite earlier ones for the same field. A rejected value is never stored.
 *
 * <p>Instances are not thread-safe; use one builder per expression from a single thread.
 */
public final class CronBuilder {
  private static final String WEEKDAYS = "MON-FRI";

  private String second;
  private String minute = CronField.WILDCARD;
  private String hour = CronField.WILDCARD;
  private String dayOfMonth = CronField.WILDCARD;
  private String month = CronField.WILDCARD;
  private String dayOfWeek = CronField.WILDCARD;

  /**
   * Sets the second (0-59), switching the output to the 6-field form.
   *
   * @param second the second value
   * @return this builder
   * @throws CronBuilderException if the second is outside 0-59
   */
  public CronBuilder withSeconds(int second) {
    this.second = CronField.SECOND.exact(second, "second");
    return this;
  }

  /**
   * Sets a recurring interval in seconds (e.g. every 10 seconds = 10), switching the output to
   * the 6-field form.
   *
   * @param interval the second interval
   * @return this builder
   * @throws CronBuilderException if the interval is outside 1-59
   */
  public CronBuilder withSecondInterval(int interval) {
    this.second = CronField.SECOND.step(interval, "interval");
    return this;
  }

  /**
   * Sets the minute (0-59).
   *
   * @param minute the minute value
   * @return this builder
   * @throws CronBuilderException if the minute is outside 0-59
   */
  public CronBuilder withMinute(int minute) {
    this.minute = CronField.MINUTE.exact(minute, "minute");
    return this;
  }

  /**
   * Sets a recurring interval in minutes (e.g. every 5 minutes = 5).
   *
   * @param interval the minute interval
   * @return this builder
   * @throws CronBuilderException if the interval is outside 1-59
   */
  public CronBuilder withMinuteInterval(int interval) {
    this.minute = CronField.MINUTE.step(interval, "interval");
    return this;
  }

  /**
   * Runs every minute.
   *
   * @return this builder
   */
  public CronBuilder minutely() {
    this.minute = CronField.WILDCARD;
    return this;
  }

  /**
   * Sets the hour (0-23).
   *
   * @param hour the hour value
   * @return this builder
   * @throws CronBuilderException if the hour is outside 0-23
   */
  public CronBuilder withHour(int hour) {
    this.hour = CronField.HOUR.exact(hour, "hour");
    return this;
  }

  /**
   * Sets a recurring interval in hours (e.g. every 4 hours = 4).
   *
   * @param interval the hour interval
   * @return this builder
   * @throws CronBuilderException if the interval is outside 1-23
   */
  public CronBuilder withHourInterval(int interval) {
    this.hour = CronField.HOUR.step(interval, "interval");
    return this;
  }

  /**
   * Runs at the top of every hour.
   *
   * @return this builder
   */
  public CronBuilder hourly() {
    this.minute = "0";
    this.hour = CronField.WILDCARD;
    return this;
  }

  /**
   * Runs daily at midnight.
   *
   * @return this builder
   */
  public CronBuilder daily() {
    return daily(0, 0);
  }

  /**
   * Runs daily at the top of the given hour.
   *
   * @param hour the hour value (0-23)
   * @return this builder
   * @throws CronBuilderException if the hour is out of range
   */
  public CronBuilder daily(int hour) {
    return daily(hour, 0);
  }

  /**
   * Runs daily at the given time.
   *
   * @param hour the hour value (0-23)
   * @param minute the minute value (0-59)
   * @return this builder
   * @throws CronBuilderException if the hour or minute is out of range
   */
  public CronBuilder daily(int hour, int minute) {
    return withHour(hour).withMinute(minute);
  }

  /**
   * Sets the day of the month (1-31).
   *
   * @param day the day of the month
   * @return this builder
   * @throws CronBuilderException if the day is outside 1-31
   */
  public CronBuilder onDayOfMonth(int day) {
    this.dayOfMonth = CronField.DAY_OF_MONTH.exact(day, "day");
    return this;
  }

  /**
   * Runs weekly on the given day at midnight.
   *
   * @param day the day of the week
   * @return this builder
   */
  public CronBuilder weekly(Weekday day) {
    return weekly(day, 0, 0);
  }

  /**
   * Runs weekly on the given day at the top of the given hour.
   *
   * @param day the day of the week
   * @param hour the hour value (0-23)
   * @return this builder
   * @throws CronBuilderException if the hour is out of range
   */
  public CronBuilder weekly(Weekday day, int hour) {
    return weekly(day, hour, 0);
  }

  /**
   * Runs weekly on the given day and time.
   *
   * @param day the day of the week
   * @param hour the hour value (0-23)
   * @param minute the minute value (0-59)
   * @return this builder
   * @throws CronBuilderException if the hour or minute is out of range
   */
  public CronBuilder weekly(Weekday day, int hour, int minute) {
    return withHour(hour).withMinute(minute).onDayOfWeek(day);
  }

  /**
   * Restricts the schedule to Monday through Friday.
   *
   * @return this builder
   */
  public CronBuilder weekdays() {
    this.dayOfWeek = WEEKDAYS;
    return this;
  }

  /**
   * Sets the month (1-12).
   *
   * @param month the month value
   * @return this builder
   * @throws CronBuilderException if the month is outside 1-12
   */
  public CronBuilder onMonth(int month) {
    this.month = CronField.MONTH.exact(month, "month");
    return this;
  }

  /**
   * Runs monthly on the given day at midnight.
   *
   * @param dayOfMonth the day of the month (1-31)
   * @return this builder
   * @throws CronBuilderException if the day is out of range
   */
  public CronBuilder monthly(int dayOfMonth) {
    return monthly(dayOfMonth, 0, 0);
  }

  /**
   * Runs monthly on the given day at the top of the given hour.
   *
   * @param dayOfMonth the day of the month (1-31)
   * @param hour the hour value (0-23)
   * @return this builder
   * @throws CronBuilderException if the day or hour is out of range
   */
  public CronBuilder monthly(int dayOfMonth, int hour) {
    return monthly(dayOfMonth, hour, 0);
  }

  /**
   * Runs monthly on the given day and time.
   *
   * @param dayOfMonth the day of the month (1-31)
   * @param hour the hour value (0-23)
   * @param minute the minute value (0-59)
   * @return this builder
   * @throws CronBuilderException if any value is out of range
   */
  public CronBuilder monthly(int dayOfMonth, int hour, int minute) {
    return onDayOfMonth(dayOfMonth).withHour(hour).withMinute(minute);
  }

  /**
   * Sets the day of the week from the enumeration (MON, TUE, ...).
   *
   * @param day the day of the week
   * @return this builder
   */
  public CronBuilder onDayOfWeek(Weekday day) {
    this.dayOfWeek = day.cronName();
    return this;
  }

  /**
   * Sets the day of the week from a java.time.DayOfWeek.
   *
   * @param day the day of the week
   * @return this builder
   */
  public CronBuilder onDayOfWeek(java.time.DayOfWeek day) {
    return onDayOfWeek(Weekday.fromDayOfWeek(day));
  }

  /**
   * Sets the day of the week from a raw cron token such as {@code "mon"} or {@code "TUE-THU"}.
   *
   * <p>The token is upper-cased and stored as-is; its format is not checked, so dialect
   * specific tokens pass through.
   *
   * @param cronDayOfWeek the raw day-of-week token
   * @return this builder
   */
  public CronBuilder onDayOfWeek(String cronDayOfWeek) {
    Objects.requireNonNull(cronDayOfWeek, "cronDayOfWeek");
    this.dayOfWeek = cronDayOfWeek.toUpperCase(Locale.ROOT);
    return this;
  }

  /**
   * Runs annually on the given month and day at midnight.
   *
   * @param month the month (1-12)
   * @param dayOfMonth the day of the month (1-31)
   * @return this builder
   * @throws CronBuilderException if the month or day is out of range
   */
  public CronBuilder annually(int month, int dayOfMonth) {
    return annually(month, dayOfMonth, 0, 0);
  }

  /**
   * Runs annually on the given month and day at the top of the given hour.
   *
   * @param month the month (1-12)
   * @param dayOfMonth the day of the month (1-31)
   * @param hour the hour value (0-23)
   * @return this builder
   * @throws CronBuilderException if any value is out of range
   */
  public CronBuilder annually(int month, int dayOfMonth, int hour) {
    return annually(month, dayOfMonth, hour, 0);
  }

  /**
   * Runs annually on the given month, day and time.
   *
   * @param month the month (1-12)
   * @param dayOfMonth the day of the month (1-31)
   * @param hour the hour value (0-23)
   * @param minute the minute value (0-59)
   * @return this builder
   * @throws CronBuilderException if any value is out of range
   */
  public CronBuilder annually(int month, int dayOfMonth, int hour, int minute) {
    return onMonth(month).onDayOfMonth(dayOfMonth).withHour(hour).withMinute(minute);
  }

  /**
   * Renders the cron expression.
   *
   * <p>The result has five fields, or six with a leading seconds field once a seconds value
   * has been set. Building does not change the builder and may be repeated.
   *
   * @return the cron expression
   * @throws CronBuilderException if both day of month and day of week are restricted
   */
  public String build() {
    if (!CronField.WILDCARD.equals(dayOfMonth) && !CronField.WILDCARD.equals(dayOfWeek)) {
      throw CronBuilderException.ambiguous(dayOfMonth, dayOfWeek);
    }

    String fields = String.join(" ", minute, hour, dayOfMonth, month, dayOfWeek);
    if (second != null) {
      return second + " " + fields;
    }
    return fields;
  }

  /**
   * Returns the cron expression, as {@link #build()}.
   *
   * @return the cron expression
   * @throws CronBuilderException if both day of month and day of week are restricted
   */
  @Override
  public String toString() {
    return build();
  }
}
