package io.holiday.date;

import java.time.DayOfWeek;
import java.util.Locale;

/**
 * A day of the week as written in pattern expressions. Declared in ISO order so each constant
 * lines up with the {@link DayOfWeek} of the same name.
 */
public enum Weekday {
  MONDAY,
  TUESDAY,
  WEDNESDAY,
  THURSDAY,
  FRIDAY,
  SATURDAY,
  SUNDAY;

  /**
   * Returns the number of days from Sunday (Sunday=0, Monday=1, ..., Saturday=6). Patterns in the
   * same month and rank sort by this index.
   *
   * @return the Sunday-based index
   */
  public int sundayIndex() {
    return toDayOfWeek().getValue() % 7;
  }

  /** The full lower-case name, e.g. "thursday". */
  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Weekday fromDayOfWeek(DayOfWeek dow) {
    return values()[dow.ordinal()];
  }

  public DayOfWeek toDayOfWeek() {
    return DayOfWeek.values()[ordinal()];
  }
}
