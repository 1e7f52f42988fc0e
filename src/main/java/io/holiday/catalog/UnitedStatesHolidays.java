package io.holiday.catalog;

import static io.holiday.date.MonthName.APRIL;
import static io.holiday.date.MonthName.FEBRUARY;
import static io.holiday.date.MonthName.JANUARY;
import static io.holiday.date.MonthName.JULY;
import static io.holiday.date.MonthName.JUNE;
import static io.holiday.date.MonthName.MARCH;
import static io.holiday.date.MonthName.MAY;
import static io.holiday.date.MonthName.NOVEMBER;
import static io.holiday.date.MonthName.OCTOBER;
import static io.holiday.date.MonthName.SEPTEMBER;
import static io.holiday.date.NthWeekday.FIRST;
import static io.holiday.date.NthWeekday.FOURTH;
import static io.holiday.date.NthWeekday.LAST;
import static io.holiday.date.NthWeekday.SECOND;
import static io.holiday.date.NthWeekday.THIRD;
import static io.holiday.date.Weekday.MONDAY;
import static io.holiday.date.Weekday.SATURDAY;
import static io.holiday.date.Weekday.SUNDAY;
import static io.holiday.date.Weekday.THURSDAY;

import io.holiday.Holiday;
import java.util.List;

/** Holidays observed in the United States. */
public final class UnitedStatesHolidays {
  private UnitedStatesHolidays() {}

  /** Martin Luther King Jr. Day: 3rd Monday in January. */
  public static final Holiday MLK_DAY =
      Holiday.nth("Martin Luther King Jr. Day", THIRD, MONDAY, JANUARY);

  /** Groundhog Day: February 2. */
  public static final Holiday GROUNDHOG_DAY = Holiday.fixed("Groundhog Day", FEBRUARY, 2);

  /** Super Bowl Sunday: 1st Sunday in February. */
  public static final Holiday SUPER_BOWL_SUNDAY =
      Holiday.nth("Super Bowl Sunday", FIRST, SUNDAY, FEBRUARY);

  /** Presidents' Day: 3rd Monday in February. */
  public static final Holiday PRESIDENTS_DAY =
      Holiday.nth("Presidents' Day", THIRD, MONDAY, FEBRUARY);

  /** Valentine's Day: February 14. */
  public static final Holiday VALENTINES_DAY = Holiday.fixed("Valentine's Day", FEBRUARY, 14);

  /** Daylight Saving Time Starts: 2nd Sunday in March. */
  public static final Holiday DST_START =
      Holiday.nth("Daylight Saving Time Starts", SECOND, SUNDAY, MARCH);

  /** April Fools' Day: April 1. */
  public static final Holiday APRIL_FOOLS_DAY = Holiday.fixed("April Fools' Day", APRIL, 1);

  /** Kentucky Derby: 1st Saturday in May. */
  public static final Holiday KENTUCKY_DERBY = Holiday.nth("Kentucky Derby", FIRST, SATURDAY, MAY);

  /** Memorial Day: Last Monday in May. */
  public static final Holiday MEMORIAL_DAY = Holiday.nth("Memorial Day", LAST, MONDAY, MAY);

  /** Mother's Day: 2nd Sunday in May. */
  public static final Holiday MOTHERS_DAY = Holiday.nth("Mother's Day", SECOND, SUNDAY, MAY);

  /** Flag Day: June 14. */
  public static final Holiday FLAG_DAY = Holiday.fixed("Flag Day", JUNE, 14);

  /** Father's Day: 3rd Sunday in June. */
  public static final Holiday FATHERS_DAY = Holiday.nth("Father's Day", THIRD, SUNDAY, JUNE);

  /** Independence Day: July 4. */
  public static final Holiday INDEPENDENCE_DAY = Holiday.fixed("Independence Day", JULY, 4);

  /** Labor Day: 1st Monday in September. */
  public static final Holiday LABOR_DAY = Holiday.nth("Labor Day", FIRST, MONDAY, SEPTEMBER);

  /** Columbus Day: 2nd Monday in October. */
  public static final Holiday COLUMBUS_DAY = Holiday.nth("Columbus Day", SECOND, MONDAY, OCTOBER);

  /** Halloween: October 31. */
  public static final Holiday HALLOWEEN = Holiday.fixed("Halloween", OCTOBER, 31);

  /** Daylight Saving Time Ends: 1st Sunday in November. */
  public static final Holiday DST_END =
      Holiday.nth("Daylight Saving Time Ends", FIRST, SUNDAY, NOVEMBER);

  /** Veterans Day: November 11. */
  public static final Holiday VETERANS_DAY = Holiday.fixed("Veterans Day", NOVEMBER, 11);

  /** Thanksgiving: 4th Thursday in November. */
  public static final Holiday THANKSGIVING =
      Holiday.nth("Thanksgiving", FOURTH, THURSDAY, NOVEMBER);

  /**
   * Returns every holiday in this class.
   *
   * @return the holidays in calendar order
   */
  public static List<Holiday> all() {
    return List.of(
        MLK_DAY,
        GROUNDHOG_DAY,
        SUPER_BOWL_SUNDAY,
        PRESIDENTS_DAY,
        VALENTINES_DAY,
        DST_START,
        APRIL_FOOLS_DAY,
        KENTUCKY_DERBY,
        MEMORIAL_DAY,
        MOTHERS_DAY,
        FLAG_DAY,
        FATHERS_DAY,
        INDEPENDENCE_DAY,
        LABOR_DAY,
        COLUMBUS_DAY,
        HALLOWEEN,
        DST_END,
        VETERANS_DAY,
        THANKSGIVING);
  }
}
