package io.holiday;

import io.holiday.catalog.HolidayCatalog;
import io.holiday.date.DayOfMonth;
import io.holiday.date.MonthName;
import io.holiday.date.NthWeekday;
import io.holiday.date.NthWeekdayOfMonth;
import io.holiday.date.RecurrencePattern;
import io.holiday.date.Weekday;
import io.holiday.parser.Parser;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A named annually repeating date.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Holiday pastover = Holiday.nth("Pastover", NthWeekday.FIRST, Weekday.FRIDAY, MonthName.APRIL);
 * pastover.inYear(2021);                         // 2021-04-02
 * pastover.matches(LocalDate.of(2022, 4, 1));    // true
 *
 * Holiday thanksgiving = Holiday.parse("thanksgiving");
 * LocalDate next = thanksgiving.afterToday();
 * }</pre>
 *
 * <p>Two holidays are equal when both name and pattern are equal. They sort by pattern, then by
 * name.
 *
 * @param name the display name
 * @param pattern the recurrence pattern
 */
public record Holiday(String name, RecurrencePattern pattern)
    implements AnnualDate, Comparable<Holiday> {

  private static final Comparator<Holiday> ORDER =
      Comparator.comparing(Holiday::pattern).thenComparing(Holiday::name);

  /** Creates a new Holiday. */
  public Holiday {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(pattern, "pattern");
  }

  /**
   * Creates a holiday on a fixed day of the month.
   *
   * @param name the display name
   * @param month the month
   * @param day the day of the month
   * @return the holiday
   */
  public static Holiday fixed(String name, MonthName month, int day) {
    return new Holiday(name, new DayOfMonth(month, day));
  }

  /**
   * Creates a holiday on the nth weekday of a month.
   *
   * @param name the display name
   * @param nth which occurrence of the weekday
   * @param weekday the weekday
   * @param month the month
   * @return the holiday
   */
  public static Holiday nth(String name, NthWeekday nth, Weekday weekday, MonthName month) {
    return new Holiday(name, new NthWeekdayOfMonth(nth, weekday, month));
  }

  /**
   * Resolves a holiday name from the catalog, or failing that, a pattern expression such as
   * "fourth thursday of november". A parsed pattern is named after the input text.
   *
   * @param input the name or expression
   * @return the holiday
   * @throws HolidayException if the input is neither
   */
  public static Holiday parse(String input) throws HolidayException {
    Optional<Holiday> named = HolidayCatalog.lookup(input);
    if (named.isPresent()) {
      return named.get();
    }
    return new Holiday(input.trim(), Parser.parsePattern(input));
  }

  /**
   * Determines the date of this holiday in a given year.
   *
   * @param year the year
   * @return the occurrence on or after January 1 of that year
   */
  public LocalDate inYear(int year) {
    return after(LocalDate.of(year, 1, 1));
  }

  @Override
  public Optional<LocalDate> nextFrom(LocalDate date) {
    return pattern.nextFrom(date);
  }

  @Override
  public Optional<LocalDate> previousFrom(LocalDate date) {
    return pattern.previousFrom(date);
  }

  @Override
  public boolean matches(LocalDate date) {
    return pattern.matches(date);
  }

  /**
   * Returns a lazy stream of occurrences on or after the given date.
   *
   * @param from the start date (inclusive)
   * @return a stream of occurrences
   */
  public Stream<LocalDate> occurrences(LocalDate from) {
    return iter().at(from).stream();
  }

  /**
   * Returns a lazy stream of occurrences where from &lt;= occurrence &lt; to.
   *
   * @param from the start date (inclusive)
   * @param to the end date (exclusive)
   * @return a stream of occurrences in the range
   */
  public Stream<LocalDate> between(LocalDate from, LocalDate to) {
    return occurrences(from).takeWhile(d -> d.isBefore(to));
  }

  @Override
  public int compareTo(Holiday other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return name;
  }
}
