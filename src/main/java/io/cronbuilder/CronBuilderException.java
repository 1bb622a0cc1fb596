package io.cronbuilder;

import java.util.Optional;

/** Exception thrown when a cron field is out of range or a schedule is ambiguous. */
public final class CronBuilderException extends RuntimeException {
  /** The error kind. */
  private final ErrorKind kind;

  /** The name of the rejected parameter, for range errors. */
  private final String parameter;

  /** The inclusive lower bound, for range errors. */
  private final Integer min;

  /** The inclusive upper bound, for range errors. */
  private final Integer max;

  private CronBuilderException(
      ErrorKind kind, String message, String parameter, Integer min, Integer max) {
    super(message);
    this.kind = kind;
    this.parameter = parameter;
    this.min = min;
    this.max = max;
  }

  /**
   * Creates a new range error.
   *
   * @param parameter the name of the rejected parameter
   * @param min the inclusive lower bound
   * @param max the inclusive upper bound
   * @param value the rejected value
   * @return a new CronBuilderException for a range error
   */
  public static CronBuilderException range(String parameter, int min, int max, int value) {
    return new CronBuilderException(
        ErrorKind.RANGE,
        String.format("%s must be between %d and %d, got %d", parameter, min, max, value),
        parameter,
        min,
        max);
  }

  /**
   * Creates a new ambiguous schedule error.
   *
   * @param dayOfMonth the day-of-month field value
   * @param dayOfWeek the day-of-week field value
   * @return a new CronBuilderException for an ambiguous schedule
   */
  public static CronBuilderException ambiguous(String dayOfMonth, String dayOfWeek) {
    return new CronBuilderException(
        ErrorKind.AMBIGUOUS_SCHEDULE,
        String.format(
            "ambiguous schedule: day of month (%s) and day of week (%s) cannot both be set",
            dayOfMonth, dayOfWeek),
        null,
        null,
        null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the name of the rejected parameter, if available.
   *
   * @return the parameter name, or empty for non-range errors
   */
  public Optional<String> parameter() {
    return Optional.ofNullable(parameter);
  }

  /**
   * Returns the inclusive lower bound of the rejected parameter, if available.
   *
   * @return the lower bound, or empty for non-range errors
   */
  public Optional<Integer> min() {
    return Optional.ofNullable(min);
  }

  /**
   * Returns the inclusive upper bound of the rejected parameter, if available.
   *
   * @return the upper bound, or empty for non-range errors
   */
  public Optional<Integer> max() {
    return Optional.ofNullable(max);
  }
}
