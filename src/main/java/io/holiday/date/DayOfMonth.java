package io.holiday.date;

import io.holiday.display.Display;
import io.holiday.eval.Evaluator;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * A fixed day of the month, e.g. "oct 31".
 *
 * @param month the month
 * @param day the day of the month
 */
public record DayOfMonth(MonthName month, int day) implements RecurrencePattern {

  /** Rejects days that the month has in no year, such as feb 30. */
  public DayOfMonth {
    Objects.requireNonNull(month, "month");
    if (day < 1 || day > month.maxLength()) {
      throw new IllegalArgumentException(
          "day " + day + " never occurs in " + month + " (1-" + month.maxLength() + ")");
    }
  }

  /**
   * Creates a fixed day from a month number.
   *
   * @param month the month number (1-12)
   * @param day the day of the month
   * @return the pattern
   */
  public static DayOfMonth of(int month, int day) {
    return new DayOfMonth(MonthName.of(month), day);
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
