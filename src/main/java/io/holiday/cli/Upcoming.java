package io.holiday.cli;

import io.holiday.HolidayException;
import io.holiday.eval.OccurrenceIterator;
import java.io.PrintStream;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the next few occurrences of each holiday or pattern given on the command line, with the
 * days until each.
 *
 * <pre>
 * $ upcoming --count 2 thanksgiving
 * Thanksgiving (fourth thursday of nov)
 *   2026-11-26  in 39 days
 *   2027-11-25  in 403 days
 * </pre>
 */
public final class Upcoming {
  private static final Logger log = LoggerFactory.getLogger(Upcoming.class);

  static final String USAGE = "usage: upcoming [--today YYYY-MM-DD] [--count N] NAME...";

  private Upcoming() {}

  public static void main(String[] args) {
    System.exit(run(args, Clock.systemDefaultZone(), System.out, System.err));
  }

  /**
   * Runs the command.
   *
   * @param args the command-line arguments
   * @param clock the clock supplying today
   * @param out where results go
   * @param err where errors go
   * @return 0 if every argument resolved, 1 if any did not, 2 for a usage error
   */
  static int run(String[] args, Clock clock, PrintStream out, PrintStream err) {
    Options options;
    try {
      options = Options.parse(args, clock);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return 2;
    }
    if (options.names().isEmpty()) {
      err.println(USAGE);
      return 2;
    }

    LocalDate today = options.today();
    int status = 0;
    for (String arg : options.names()) {
      try {
        print(out, Target.resolve(arg, today), today, options.count());
      } catch (HolidayException e) {
        log.warn("skipping '{}': {}", arg, e.getMessage());
        Target.printUnknown(err, arg, e);
        status = 1;
      } catch (DateTimeException e) {
        log.warn("skipping '{}': {}", arg, e.getMessage());
        Target.printOutOfRange(err, arg, today);
        status = 1;
      }
    }
    return status;
  }

  private static void print(PrintStream out, Target target, LocalDate today, int count) {
    if (target.holiday() == null) {
      out.println(target.label());
      printLine(out, today, target.date());
      return;
    }

    out.println(target.label() + " (" + target.holiday().pattern() + ")");
    OccurrenceIterator it = target.holiday().iter().at(today);
    for (int i = 0; i < count && it.hasNext(); i++) {
      printLine(out, today, it.next());
    }
  }

  private static void printLine(PrintStream out, LocalDate today, LocalDate date) {
    out.println("  " + date + "  in " + ChronoUnit.DAYS.between(today, date) + " days");
  }
}
