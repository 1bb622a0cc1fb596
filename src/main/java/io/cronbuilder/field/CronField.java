package io.cronbuilder.field;

import io.cronbuilder.CronBuilderException;

/** A numeric position in a cron expression, with its inclusive bounds. */
public enum CronField {
  SECOND(0, 59),
  MINUTE(0, 59),
  HOUR(0, 23),
  DAY_OF_MONTH(1, 31),
  MONTH(1, 12);

  /** The token matching every value of a field. */
  public static final String WILDCARD = "*";

  private final int min;
  private final int max;

  CronField(int min, int max) {
    this.min = min;
    this.max = max;
  }

  /**
   * Returns the smallest value accepted by this field.
   *
   * @return the inclusive lower bound
   */
  public int min() {
    return min;
  }

  /**
   * Returns the largest value accepted by this field.
   *
   * @return the inclusive upper bound
   */
  public int max() {
    return max;
  }

  /**
   * Renders an exact value for this field.
   *
   * @param value the value to render
   * @param parameter the parameter name reported on failure
   * @return the decimal token
   * @throws CronBuilderException if the value is outside [min, max]
   */
  public String exact(int value, String parameter) {
    if (value < min || value > max) {
      throw CronBuilderException.range(parameter, min, max, value);
    }
    return String.valueOf(value);
  }

  /**
   * Renders a step pattern ({@code *}/N) for this field.
   *
   * <p>Steps start at 1 and cannot exceed the field's upper bound.
   *
   * @param interval the step size
   * @param parameter the parameter name reported on failure
   * @return the step token
   * @throws CronBuilderException if the interval is outside [1, max]
   */
  public String step(int interval, String parameter) {
    if (interval < 1 || interval > max) {
      throw CronBuilderException.range(parameter, 1, max, interval);
    }
    return WILDCARD + "/" + interval;
  }
}
