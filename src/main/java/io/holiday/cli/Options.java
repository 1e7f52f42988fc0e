package io.holiday.cli;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line options shared by the front-ends.
 *
 * @param today the date counts are measured from
 * @param count how many occurrences to list per argument
 * @param names the holiday names, patterns or dates to resolve
 */
record Options(LocalDate today, int count, List<String> names) {
  static final int DEFAULT_COUNT = 3;

  /**
   * Parses {@code [--today YYYY-MM-DD] [--count N] NAME...}. Options may also be written as
   * {@code --today=YYYY-MM-DD}.
   *
   * @param args the raw arguments
   * @param clock the clock supplying today when {@code --today} is absent
   * @return the options
   * @throws IllegalArgumentException if an option is malformed
   */
  static Options parse(String[] args, Clock clock) {
    LocalDate today = LocalDate.now(clock);
    int count = DEFAULT_COUNT;
    List<String> names = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      String value = null;
      String option = arg;
      int eq = arg.indexOf('=');
      if (arg.startsWith("--") && eq > 0) {
        option = arg.substring(0, eq);
        value = arg.substring(eq + 1);
      }

      switch (option) {
        case "--today" -> {
          if (value == null) {
            value = requireValue(args, ++i, option);
          }
          try {
            today = LocalDate.parse(value);
          } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("--today expects YYYY-MM-DD, got '" + value + "'");
          }
        }
        case "--count", "-n" -> {
          if (value == null) {
            value = requireValue(args, ++i, option);
          }
          try {
            count = Integer.parseInt(value);
          } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " expects a number, got '" + value + "'");
          }
          if (count < 1) {
            throw new IllegalArgumentException(option + " must be at least 1");
          }
        }
        default -> names.add(arg);
      }
    }

    return new Options(today, count, List.copyOf(names));
  }

  private static String requireValue(String[] args, int i, String option) {
    if (i >= args.length) {
      throw new IllegalArgumentException(option + " requires a value");
    }
    return args[i];
  }
}
