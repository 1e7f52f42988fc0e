package io.holiday.catalog;

import static io.holiday.date.MonthName.DECEMBER;
import static io.holiday.date.MonthName.JANUARY;
import static io.holiday.date.MonthName.MARCH;

import io.holiday.Holiday;
import java.util.List;

/** Holidays recognized around the world. */
public final class GlobalHolidays {
  private GlobalHolidays() {}

  /** New Year's Day: January 1. */
  public static final Holiday NEW_YEARS_DAY = Holiday.fixed("New Year's Day", JANUARY, 1);

  /** St. Patrick's Day: March 17. */
  public static final Holiday ST_PATRICKS_DAY = Holiday.fixed("St. Patrick's Day", MARCH, 17);

  /** Christmas Eve: December 24. */
  public static final Holiday CHRISTMAS_EVE = Holiday.fixed("Christmas Eve", DECEMBER, 24);

  /** Christmas: December 25. */
  public static final Holiday CHRISTMAS = Holiday.fixed("Christmas", DECEMBER, 25);

  /** New Year's Eve: December 31. */
  public static final Holiday NEW_YEARS_EVE = Holiday.fixed("New Year's Eve", DECEMBER, 31);

  /**
   * Returns every holiday in this class.
   *
   * @return the holidays in declaration order
   */
  public static List<Holiday> all() {
    return List.of(NEW_YEARS_DAY, ST_PATRICKS_DAY, CHRISTMAS_EVE, CHRISTMAS, NEW_YEARS_EVE);
  }
}
