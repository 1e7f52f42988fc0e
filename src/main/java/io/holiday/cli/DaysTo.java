package io.holiday.cli;

import io.holiday.HolidayException;
import java.io.PrintStream;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the number of days until each holiday, pattern or date given on the command line.
 *
 * <pre>
 * $ daysto thanksgiving "last friday of june" 2027-01-01
 * Days until Thanksgiving: 39
 * Days until last friday of june: 250
 * Days until 2027-01-01: 75
 * </pre>
 */
public final class DaysTo {
  private static final Logger log = LoggerFactory.getLogger(DaysTo.class);

  static final String USAGE = "usage: daysto [--today YYYY-MM-DD] NAME...";

  private DaysTo() {}

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
        Target target = Target.resolve(arg, today);
        long days = ChronoUnit.DAYS.between(today, target.nextOn(today));
        out.println("Days until " + target.label() + ": " + days);
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
}
