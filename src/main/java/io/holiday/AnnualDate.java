package io.holiday;

import io.holiday.eval.OccurrenceIterator;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Something that happens once every year and can be resolved against a reference date.
 *
 * <p>The successor search is inclusive of the reference date, the predecessor search is exclusive:
 *
 * <pre>{@code
 * AnnualDate thanksgiving = UnitedStatesHolidays.THANKSGIVING;
 * thanksgiving.after(LocalDate.of(2020, 11, 26));  // 2020-11-26
 * thanksgiving.before(LocalDate.of(2020, 11, 26)); // 2019-11-28
 * }</pre>
 */
public interface AnnualDate {

  /**
   * Finds the earliest occurrence on or after the given date.
   *
   * @param date the reference date (inclusive)
   * @return the occurrence, or empty if none exists within the search horizon or the
   *     representable date range
   */
  Optional<LocalDate> nextFrom(LocalDate date);

  /**
   * Finds the latest occurrence strictly before the given date.
   *
   * @param date the reference date (exclusive)
   * @return the occurrence, or empty if none exists within the search horizon or the
   *     representable date range
   */
  Optional<LocalDate> previousFrom(LocalDate date);

  /**
   * Checks if a concrete date is an occurrence.
   *
   * @param date the date to check
   * @return true if the date is an occurrence
   */
  boolean matches(LocalDate date);

  /**
   * The next occurrence, including the given date itself (successor).
   *
   * @param date the reference date
   * @return the occurrence
   * @throws DateTimeException if there is no such occurrence
   */
  default LocalDate after(LocalDate date) {
    return nextFrom(date)
        .orElseThrow(
            () -> new DateTimeException("no occurrence of " + this + " on or after " + date));
  }

  /**
   * The previous occurrence, excluding the given date itself (predecessor).
   *
   * @param date the reference date
   * @return the occurrence
   * @throws DateTimeException if there is no such occurrence
   */
  default LocalDate before(LocalDate date) {
    return previousFrom(date)
        .orElseThrow(() -> new DateTimeException("no occurrence of " + this + " before " + date));
  }

  /**
   * The next occurrence including today.
   *
   * @return the occurrence
   */
  default LocalDate afterToday() {
    return afterToday(Clock.systemDefaultZone());
  }

  /**
   * The next occurrence including today, where today is read from the given clock.
   *
   * @param clock the clock supplying today's date
   * @return the occurrence
   */
  default LocalDate afterToday(Clock clock) {
    return after(LocalDate.now(clock));
  }

  /**
   * The previous occurrence excluding today.
   *
   * @return the occurrence
   */
  default LocalDate beforeToday() {
    return beforeToday(Clock.systemDefaultZone());
  }

  /**
   * The previous occurrence excluding today, where today is read from the given clock.
   *
   * @param clock the clock supplying today's date
   * @return the occurrence
   */
  default LocalDate beforeToday(Clock clock) {
    return before(LocalDate.now(clock));
  }

  /**
   * The earliest occurrence a {@link LocalDate} can represent.
   *
   * @return the first occurrence
   */
  default LocalDate firstDate() {
    return after(LocalDate.MIN);
  }

  /**
   * The latest occurrence a {@link LocalDate} can represent.
   *
   * @return the last occurrence
   */
  default LocalDate lastDate() {
    return before(LocalDate.MAX);
  }

  /**
   * Returns an iterator over every representable occurrence. Position it with {@link
   * OccurrenceIterator#at(LocalDate)} before walking it.
   *
   * @return a new iterator
   */
  default OccurrenceIterator iter() {
    return new OccurrenceIterator(this);
  }
}
