package io.holiday.date;

import io.holiday.AnnualDate;
import io.holiday.eval.PatternComparator;

/**
 * Sealed interface for the rules that describe a date repeating once per year.
 *
 * <ul>
 *   <li>{@link DayOfMonth} - "oct 31"
 *   <li>{@link NthWeekdayOfMonth} - "fourth thursday of nov"
 * </ul>
 *
 * <p>Patterns sort by month first. Within a month a fixed day sorts before any nth weekday, fixed
 * days sort by day, and nth weekdays sort by rank and then by weekday (Sunday first). This order
 * is for listing holidays, not a calendar order.
 */
public sealed interface RecurrencePattern extends AnnualDate, Comparable<RecurrencePattern>
    permits DayOfMonth, NthWeekdayOfMonth {

  /**
   * Returns the month this pattern falls in.
   *
   * @return the month
   */
  MonthName month();

  @Override
  default int compareTo(RecurrencePattern other) {
    return PatternComparator.INSTANCE.compare(this, other);
  }
}
