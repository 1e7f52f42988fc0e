package io.holiday.eval;

import io.holiday.date.DayOfMonth;
import io.holiday.date.NthWeekday;
import io.holiday.date.NthWeekdayOfMonth;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves recurrence patterns against reference dates.
 *
 * <h2>Search</h2>
 *
 * <p>A fixed day is found by walking the calendar one day at a time from the reference date. An
 * nth weekday jumps straight to its target month (day 1 going forward, the last day going
 * backward, crossing at most one year boundary) and then walks that month one day at a time, so
 * its cost does not depend on where in the year the reference date falls.
 *
 * <h2>Search Horizon</h2>
 *
 * <p>SEARCH_HORIZON_YEARS (400): the Gregorian calendar repeats every 400 years, so any pattern
 * that occurs at all occurs within 400 years of any date. A search that walks further, or that
 * steps past {@link LocalDate#MIN} or {@link LocalDate#MAX}, gives up and returns empty.
 *
 * <p>The longest real gap is a fifth weekday in February, which needs a leap year whose February
 * starts on that weekday; the gap can reach 40 years.
 */
public final class Evaluator {
  private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

  /** Maximum distance in years between the reference date and a result. */
  private static final int SEARCH_HORIZON_YEARS = 400;

  private Evaluator() {}

  /**
   * Finds the earliest date on or after {@code date} that falls on the fixed day.
   *
   * @param pattern the fixed day
   * @param date the reference date (inclusive)
   * @return the occurrence, or empty if none can be represented
   */
  public static Optional<LocalDate> nextFrom(DayOfMonth pattern, LocalDate date) {
    try {
      LocalDate check = date;
      while (withinHorizon(date, check)) {
        if (matches(pattern, check)) {
          return Optional.of(check);
        }
        check = check.plusDays(1);
      }
    } catch (DateTimeException e) {
      log.debug("{} has no occurrence on or after {}: {}", pattern, date, e.getMessage());
      return Optional.empty();
    }
    log.debug("{} not found within {} years after {}", pattern, SEARCH_HORIZON_YEARS, date);
    return Optional.empty();
  }

  /**
   * Finds the latest date strictly before {@code date} that falls on the fixed day.
   *
   * @param pattern the fixed day
   * @param date the reference date (exclusive)
   * @return the occurrence, or empty if none can be represented
   */
  public static Optional<LocalDate> previousFrom(DayOfMonth pattern, LocalDate date) {
    try {
      LocalDate check = date.minusDays(1);
      while (withinHorizon(date, check)) {
        if (matches(pattern, check)) {
          return Optional.of(check);
        }
        check = check.minusDays(1);
      }
    } catch (DateTimeException e) {
      log.debug("{} has no occurrence before {}: {}", pattern, date, e.getMessage());
      return Optional.empty();
    }
    log.debug("{} not found within {} years before {}", pattern, SEARCH_HORIZON_YEARS, date);
    return Optional.empty();
  }

  /**
   * Finds the earliest date on or after {@code date} that is the nth weekday.
   *
   * @param pattern the nth weekday
   * @param date the reference date (inclusive)
   * @return the occurrence, or empty if none can be represented
   */
  public static Optional<LocalDate> nextFrom(NthWeekdayOfMonth pattern, LocalDate date) {
    int target = pattern.month().number();
    try {
      LocalDate check = date;
      while (withinHorizon(date, check)) {
        if (matches(pattern, check)) {
          return Optional.of(check);
        }
        int month = check.getMonthValue();
        if (month < target) {
          check = CalendarMath.firstDayOfMonth(check).withMonth(target);
        } else if (month > target) {
          check = LocalDate.of(check.getYear() + 1, target, 1);
        } else {
          check = check.plusDays(1);
        }
      }
    } catch (DateTimeException e) {
      log.debug("{} has no occurrence on or after {}: {}", pattern, date, e.getMessage());
      return Optional.empty();
    }
    log.debug("{} not found within {} years after {}", pattern, SEARCH_HORIZON_YEARS, date);
    return Optional.empty();
  }

  /**
   * Finds the latest date strictly before {@code date} that is the nth weekday.
   *
   * @param pattern the nth weekday
   * @param date the reference date (exclusive)
   * @return the occurrence, or empty if none can be represented
   */
  public static Optional<LocalDate> previousFrom(NthWeekdayOfMonth pattern, LocalDate date) {
    int target = pattern.month().number();
    try {
      LocalDate check = date.minusDays(1);
      while (withinHorizon(date, check)) {
        if (matches(pattern, check)) {
          return Optional.of(check);
        }
        int month = check.getMonthValue();
        if (month > target) {
          check =
              CalendarMath.lastDayOfMonth(CalendarMath.firstDayOfMonth(check).withMonth(target));
        } else if (month < target) {
          check = CalendarMath.lastDayOfMonth(LocalDate.of(check.getYear() - 1, target, 1));
        } else {
          check = check.minusDays(1);
        }
      }
    } catch (DateTimeException e) {
      log.debug("{} has no occurrence before {}: {}", pattern, date, e.getMessage());
      return Optional.empty();
    }
    log.debug("{} not found within {} years before {}", pattern, SEARCH_HORIZON_YEARS, date);
    return Optional.empty();
  }

  /**
   * Checks if a date falls on the fixed day, in any year.
   *
   * @param pattern the fixed day
   * @param date the date to check
   * @return true if month and day match
   */
  public static boolean matches(DayOfMonth pattern, LocalDate date) {
    return date.getMonthValue() == pattern.month().number()
        && date.getDayOfMonth() == pattern.day();
  }

  /**
   * Checks if a date is the nth weekday, in any year. For {@link NthWeekday#LAST} the date must be
   * the final occurrence of its weekday in the month; for a numbered rank the occurrence count up
   * to and including the date must equal the rank.
   *
   * @param pattern the nth weekday
   * @param date the date to check
   * @return true if the date is an occurrence
   */
  public static boolean matches(NthWeekdayOfMonth pattern, LocalDate date) {
    if (date.getDayOfWeek() != pattern.weekday().toDayOfWeek()
        || date.getMonthValue() != pattern.month().number()) {
      return false;
    }
    if (pattern.nth() == NthWeekday.LAST) {
      return CalendarMath.isLastWeekday(date);
    }
    return pattern.nth().isRank(CalendarMath.weekdayOccurrence(date));
  }

  private static boolean withinHorizon(LocalDate start, LocalDate check) {
    return Math.abs((long) check.getYear() - start.getYear()) <= SEARCH_HORIZON_YEARS;
  }
}
