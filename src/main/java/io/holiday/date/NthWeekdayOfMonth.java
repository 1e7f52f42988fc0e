package io.holiday.date;

import io.holiday.display.Display;
import io.holiday.eval.CalendarMath;
import io.holiday.eval.Evaluator;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * The nth weekday of a month, e.g. "fourth thursday of nov" or "last monday of may".
 *
 * @param nth which occurrence of the weekday
 * @param weekday the weekday
 * @param month the month
 */
public record NthWeekdayOfMonth(NthWeekday nth, Weekday weekday, MonthName month)
    implements RecurrencePattern {

  /** Creates a new NthWeekdayOfMonth. */
  public NthWeekdayOfMonth {
    Objects.requireNonNull(nth, "nth");
    Objects.requireNonNull(weekday, "weekday");
    Objects.requireNonNull(month, "month");
  }

  /**
   * Creates a pattern from numbers, where {@code nth} 1-5 is a rank and anything above 5 means
   * the last occurrence.
   *
   * @param nth the ordinal number, must be non-zero
   * @param weekday the weekday
   * @param month the month number (1-12)
   * @return the pattern
   */
  public static NthWeekdayOfMonth of(int nth, Weekday weekday, int month) {
    return new NthWeekdayOfMonth(NthWeekday.fromNumber(nth), weekday, MonthName.of(month));
  }

  /**
   * Derives the pattern a date is an instance of, always as a numbered rank. A date that is the
   * last of its weekday in its month yields its rank (4 or 5), never {@link NthWeekday#LAST}.
   *
   * @param date the date
   * @return the pattern with the date's rank, weekday and month
   */
  public static NthWeekdayOfMonth from(LocalDate date) {
    return new NthWeekdayOfMonth(
        NthWeekday.fromNumber(CalendarMath.weekdayOccurrence(date)),
        Weekday.fromDayOfWeek(date.getDayOfWeek()),
        MonthName.fromMonth(date.getMonth()));
  }

  @Override
  public Optional<LocalDate> nextFrom(LocalDate date) {
    return Evaluator.nextFrom(this, date);
  }

  @Override
  public Optional<LocalDate> previousFrom(LocalDate date) {
    return Evaluator.previousFrom(this, date);
  }

  @Override
  public boolean matches(LocalDate date) {
    return Evaluator.matches(this, date);
  }

  @Override
  public String toString() {
    return Display.render(this);
  }
}
