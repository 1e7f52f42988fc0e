package io.holiday.eval;

import java.time.LocalDate;

/** Month arithmetic on {@link LocalDate} used by the occurrence search. */
public final class CalendarMath {
  private CalendarMath() {}

  /**
   * Returns the first day of the date's month.
   *
   * @param date any day in the month
   * @return day 1 of that month
   */
  public static LocalDate firstDayOfMonth(LocalDate date) {
    return date.withDayOfMonth(1);
  }

  /**
   * Returns the last day of the date's month, leap years included.
   *
   * @param date any day in the month
   * @return the final day of that month
   */
  public static LocalDate lastDayOfMonth(LocalDate date) {
    // December of LocalDate.MAX's year has no following month
    return date.withDayOfMonth(date.lengthOfMonth());
  }

  /**
   * Counts the occurrences of the date's weekday from day 1 of its month through the date.
   *
   * @param date the date
   * @return the rank of the date's weekday within its month (1-5)
   */
  public static int weekdayOccurrence(LocalDate date) {
    return (date.getDayOfMonth() - 1) / 7 + 1;
  }

  /**
   * Checks that no later day in the date's month falls on the same weekday.
   *
   * @param date the date
   * @return true if the date is the final occurrence of its weekday in its month
   */
  public static boolean isLastWeekday(LocalDate date) {
    return date.getDayOfMonth() + 7 > date.lengthOfMonth();
  }
}
