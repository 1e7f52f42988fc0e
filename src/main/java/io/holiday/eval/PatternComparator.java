package io.holiday.eval;

import io.holiday.date.DayOfMonth;
import io.holiday.date.NthWeekdayOfMonth;
import io.holiday.date.RecurrencePattern;
import java.util.Comparator;

/**
 * Orders recurrence patterns for listing.
 *
 * <p>Months compare first. Within one month a {@link DayOfMonth} always sorts before a {@link
 * NthWeekdayOfMonth}, even when the nth weekday falls earlier in the month in a given year.
 */
public final class PatternComparator implements Comparator<RecurrencePattern> {
  /** The shared instance. */
  public static final PatternComparator INSTANCE = new PatternComparator();

  private static final Comparator<DayOfMonth> FIXED =
      Comparator.comparing(DayOfMonth::month).thenComparingInt(DayOfMonth::day);

  private static final Comparator<NthWeekdayOfMonth> NTH =
      Comparator.comparing(NthWeekdayOfMonth::month)
          .thenComparing(NthWeekdayOfMonth::nth)
          .thenComparingInt(n -> n.weekday().sundayIndex());

  private PatternComparator() {}

  @Override
  public int compare(RecurrencePattern a, RecurrencePattern b) {
    if (a instanceof DayOfMonth fa && b instanceof DayOfMonth fb) {
      return FIXED.compare(fa, fb);
    }
    if (a instanceof NthWeekdayOfMonth na && b instanceof NthWeekdayOfMonth nb) {
      return NTH.compare(na, nb);
    }
    if (a.month() != b.month()) {
      return a.month().compareTo(b.month());
    }
    return a instanceof DayOfMonth ? -1 : 1;
  }
}
