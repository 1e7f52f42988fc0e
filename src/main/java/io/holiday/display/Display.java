package io.holiday.display;

import io.holiday.date.DayOfMonth;
import io.holiday.date.NthWeekdayOfMonth;
import io.holiday.date.RecurrencePattern;

/** Renders recurrence patterns as canonical strings. */
public final class Display {
  private Display() {}

  /**
   * Renders a pattern as a canonical string that parses back to an equal pattern.
   *
   * <ul>
   *   <li>"oct 31"
   *   <li>"fourth thursday of nov"
   *   <li>"last monday of may"
   * </ul>
   *
   * @param pattern the pattern to render
   * @return the canonical string representation
   */
  public static String render(RecurrencePattern pattern) {
    if (pattern instanceof DayOfMonth dom) {
      return renderDayOfMonth(dom);
    }
    return renderNthWeekday((NthWeekdayOfMonth) pattern);
  }

  private static String renderDayOfMonth(DayOfMonth dom) {
    return String.format("%s %d", dom.month(), dom.day());
  }

  private static String renderNthWeekday(NthWeekdayOfMonth nth) {
    return String.format("%s %s of %s", nth.nth(), nth.weekday(), nth.month());
  }
}
