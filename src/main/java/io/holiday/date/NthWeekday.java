package io.holiday.date;

/**
 * The nth occurrence of a weekday in a month.
 *
 * <p>{@link #FIFTH} only exists in some months of some years; resolving it carries forward (or
 * back) to the nearest year that has one. {@link #LAST} always exists.
 */
public enum NthWeekday {
  FIRST(1, "first"),
  SECOND(2, "second"),
  THIRD(3, "third"),
  FOURTH(4, "fourth"),
  FIFTH(5, "fifth"),
  LAST(6, "last");

  private final int number;
  private final String displayName;

  NthWeekday(int number, String displayName) {
    this.number = number;
    this.displayName = displayName;
  }

  /**
   * Returns the numeric encoding (1-5, or 6 for Last).
   *
   * @return the ordinal number
   */
  public int number() {
    return number;
  }

  /**
   * Checks whether this is a numbered rank equal to the given count of occurrences. {@link #LAST}
   * never equals a count.
   *
   * @param count the occurrence count within a month
   * @return true if this rank is exactly that count
   */
  public boolean isRank(int count) {
    return this != LAST && number == count;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Returns the NthWeekday for a number. Values above 5 all mean {@link #LAST}.
   *
   * @param n the ordinal number
   * @return the corresponding NthWeekday
   * @throws IllegalArgumentException if n is zero or negative
   */
  public static NthWeekday fromNumber(int n) {
    if (n <= 0) {
      throw new IllegalArgumentException("nth weekday must be non-zero, got " + n);
    }
    return n > 5 ? LAST : values()[n - 1];
  }
}
