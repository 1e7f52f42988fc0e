package io.holiday;

import java.util.Optional;

/** Exception thrown when a holiday name, pattern expression or date cannot be understood. */
public final class HolidayException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The source span where the error occurred. */
  private final Span span;

  /** The original input string. */
  private final String input;

  /** An optional suggestion for fixing the error. */
  private final String suggestion;

  private HolidayException(
      ErrorKind kind, String message, Span span, String input, String suggestion) {
    super(message);
    this.kind = kind;
    this.span = span;
    this.input = input;
    this.suggestion = suggestion;
  }

  /**
   * Creates a new lexer error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the original input string
   * @return a new HolidayException for a lexer error
   */
  public static HolidayException lex(String message, Span span, String input) {
    return new HolidayException(ErrorKind.LEX, message, span, input, null);
  }

  /**
   * Creates a new parser error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the original input string
   * @param suggestion an optional suggestion for fixing the error
   * @return a new HolidayException for a parser error
   */
  public static HolidayException parse(
      String message, Span span, String input, String suggestion) {
    return new HolidayException(ErrorKind.PARSE, message, span, input, suggestion);
  }

  /**
   * Creates a new lookup error for a name that is not in the catalog.
   *
   * @param input the name that was looked up
   * @return a new HolidayException for a lookup error
   */
  public static HolidayException lookup(String input) {
    return lookup(input, null);
  }

  /**
   * Creates a new lookup error carrying a correction found while trying to read the name as an
   * expression.
   *
   * @param input the name that was looked up
   * @param suggestion a replacement the caller may try, or null
   * @return a new HolidayException for a lookup error
   */
  public static HolidayException lookup(String input, String suggestion) {
    return new HolidayException(
        ErrorKind.LOOKUP, "unknown holiday '" + input + "'", null, input, suggestion);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the original input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns a suggestion for fixing the error, if available.
   *
   * @return the suggestion, or empty if not available
   */
  public Optional<String> suggestion() {
    return Optional.ofNullable(suggestion);
  }

  /**
   * Formats the error for a terminal. Lex and parse errors underline the offending part of the
   * input:
   *
   * <pre>
   * error: expected DAY_NAME but got MONTH_NAME
   *   fourth nov of thursday
   *          ^^^
   * </pre>
   *
   * <p>A suggestion, when present, follows as {@code try: "last monday"}.
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder("error: ").append(getMessage());
    if (kind != ErrorKind.LOOKUP && span != null && input != null) {
      sb.append("\n  ").append(input).append("\n");
      sb.append(" ".repeat(span.start() + 2)).append("^".repeat(span.length()));
    }
    if (suggestion != null && !suggestion.isEmpty()) {
      sb.append(" try: \"").append(suggestion).append("\"");
    }
    return sb.toString();
  }
}
