package io.holiday.cli;

import io.holiday.Holiday;
import io.holiday.HolidayException;
import io.holiday.catalog.HolidayCatalog;
import io.holiday.parser.Parser;
import java.io.PrintStream;
import java.time.LocalDate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * What a command-line argument refers to: a holiday (named, or an ad hoc pattern) or a single
 * concrete date.
 *
 * @param label the text to print for this argument
 * @param holiday the holiday, or null for a concrete date
 * @param date the concrete date, or null for a holiday
 */
record Target(String label, Holiday holiday, LocalDate date) {
  private static final Logger log = LoggerFactory.getLogger(Target.class);

  /**
   * Resolves an argument by catalog name, then pattern expression, then date expression.
   *
   * @param arg the argument
   * @param today the date relative date expressions are read against
   * @return the target
   * @throws HolidayException of kind LOOKUP if the argument is none of the three, carrying the
   *     pattern parser's suggestion if it made one
   */
  static Target resolve(String arg, LocalDate today) throws HolidayException {
    Optional<Holiday> named = HolidayCatalog.lookup(arg);
    if (named.isPresent()) {
      return new Target(named.get().name(), named.get(), null);
    }

    String suggestion = null;
    try {
      return new Target(arg, new Holiday(arg, Parser.parsePattern(arg)), null);
    } catch (HolidayException e) {
      log.debug("not a pattern:\n{}", e.displayRich());
      suggestion = e.suggestion().orElse(null);
    }

    try {
      return new Target(arg, null, Parser.parseDate(arg, today));
    } catch (HolidayException e) {
      log.debug("not a date:\n{}", e.displayRich());
    }

    throw HolidayException.lookup(arg, suggestion);
  }

  /**
   * Reports an argument that could not be resolved, with a correction when one is known.
   *
   * @param err where the report goes
   * @param arg the argument
   * @param e the failure
   */
  static void printUnknown(PrintStream err, String arg, HolidayException e) {
    err.println("Unknown holiday: '" + arg + "'");
    e.suggestion().ifPresent(s -> err.println("  try: \"" + s + "\""));
  }

  /**
   * Reports an argument whose date falls outside the representable range.
   *
   * @param err where the report goes
   * @param arg the argument
   * @param today the date the argument was resolved against
   */
  static void printOutOfRange(PrintStream err, String arg, LocalDate today) {
    err.println("No date for '" + arg + "' from " + today);
  }

  /**
   * Returns the occurrence on or after today.
   *
   * @param today today's date
   * @return the next date this target falls on
   */
  LocalDate nextOn(LocalDate today) {
    return holiday != null ? holiday.after(today) : date;
  }
}
