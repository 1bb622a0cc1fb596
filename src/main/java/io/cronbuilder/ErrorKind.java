package io.cronbuilder;

/** The type of error raised while building a cron expression. */
public enum ErrorKind {
  /** Range error - a field value falls outside its inclusive bounds. */
  RANGE("range"),
  /** Ambiguous schedule - both day-of-month and day-of-week are restricted. */
  AMBIGUOUS_SCHEDULE("ambiguous_schedule");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
