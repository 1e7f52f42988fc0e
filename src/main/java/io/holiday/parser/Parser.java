package io.holiday.parser;

import io.holiday.HolidayException;
import io.holiday.Span;
import io.holiday.date.DayOfMonth;
import io.holiday.date.MonthName;
import io.holiday.date.NthWeekday;
import io.holiday.date.NthWeekdayOfMonth;
import io.holiday.date.RecurrencePattern;
import io.holiday.lexer.Lexer;
import io.holiday.lexer.Token;
import io.holiday.lexer.TokenKind;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.List;

/**
 * Recursive descent parser for recurrence patterns and dates.
 *
 * <p>Patterns:
 *
 * <ul>
 *   <li>"oct 31", "october 31st"
 *   <li>"31st of october", "the 4th of july"
 *   <li>"fourth thursday in november", "4th thu of nov", "last monday of may"
 * </ul>
 *
 * <p>Dates, relative to a given today:
 *
 * <ul>
 *   <li>"2026-03-15"
 *   <li>"today", "tomorrow", "yesterday"
 *   <li>"dec 25", "dec 25 2027", "25th of december"
 *   <li>"in 3 days", "in 2 weeks"
 *   <li>"next friday"
 * </ul>
 */
public final class Parser {
  private final String input;
  private final List<Token> tokens;
  private int pos;

  private Parser(String input, List<Token> tokens) {
    this.input = input;
    this.tokens = tokens;
    this.pos = 0;
  }

  /**
   * Parses a recurrence pattern expression.
   *
   * @param input the input string to parse
   * @return the parsed pattern
   * @throws HolidayException if the input is invalid
   */
  public static RecurrencePattern parsePattern(String input) throws HolidayException {
    Parser parser = start(input);
    RecurrencePattern pattern = parser.parsePatternExpr();
    parser.expectEnd();
    return pattern;
  }

  /**
   * Parses a date expression.
   *
   * @param input the input string to parse
   * @param today the date relative expressions are resolved against
   * @return the parsed date
   * @throws HolidayException if the input is invalid
   */
  public static LocalDate parseDate(String input, LocalDate today) throws HolidayException {
    Parser parser = start(input);
    LocalDate date;
    try {
      date = parser.parseDateExpr(today);
    } catch (DateTimeException e) {
      throw parser.parseError("date out of range", parser.fullSpan());
    }
    parser.expectEnd();
    return date;
  }

  private static Parser start(String input) throws HolidayException {
    if (input == null || input.trim().isEmpty()) {
      throw HolidayException.parse("empty input", new Span(0, 0), input, null);
    }

    List<Token> tokens = Lexer.tokenize(input);
    if (tokens.isEmpty()) {
      throw HolidayException.parse("empty input", new Span(0, 0), input, null);
    }

    return new Parser(input, tokens);
  }

  // Patterns

  private RecurrencePattern parsePatternExpr() throws HolidayException {
    skipThe();
    Token tok = peek();
    if (tok == null) {
      throw parseError("unexpected end of input", endSpan());
    }

    return switch (tok.kind()) {
      case MONTH_NAME -> parseMonthFirst();
      case ORDINAL -> {
        pos++;
        yield parseNthWeekday(tok.ordinalVal());
      }
      case ORDINAL_NUMBER, NUMBER -> parseNumberFirst();
      default -> throw parseError("expected month, ordinal or day", tok.span());
    };
  }

  /** "oct 31" or "october 31st". */
  private RecurrencePattern parseMonthFirst() throws HolidayException {
    Token monthTok = expect(TokenKind.MONTH_NAME);
    Token dayTok = expectDay();
    return dayOfMonth(monthTok.monthNameVal(), dayTok);
  }

  /** "31st of october", "31 oct" or "4th thursday in november". */
  private RecurrencePattern parseNumberFirst() throws HolidayException {
    Token numTok = tokens.get(pos++);
    if (check(TokenKind.DAY_NAME)) {
      if (numTok.kind() != TokenKind.ORDINAL_NUMBER
          || numTok.numberVal() < 1
          || numTok.numberVal() > 5) {
        throw parseError(
            "nth weekday must be 1st to 5th", numTok.span(), "last " + peek().dayNameVal());
      }
      return parseNthWeekday(NthWeekday.fromNumber(numTok.numberVal()));
    }
    skip(TokenKind.OF);
    Token monthTok = expect(TokenKind.MONTH_NAME);
    return dayOfMonth(monthTok.monthNameVal(), numTok);
  }

  /** "thursday in november" after the ordinal has been read. */
  private RecurrencePattern parseNthWeekday(NthWeekday nth) throws HolidayException {
    Token dayTok = expect(TokenKind.DAY_NAME);
    if (!check(TokenKind.IN)) {
      expect(TokenKind.OF);
    } else {
      pos++;
    }
    Token monthTok = expect(TokenKind.MONTH_NAME);
    return new NthWeekdayOfMonth(nth, dayTok.dayNameVal(), monthTok.monthNameVal());
  }

  private DayOfMonth dayOfMonth(MonthName month, Token dayTok) throws HolidayException {
    int day = dayTok.numberVal();
    if (day < 1 || day > month.maxLength()) {
      throw parseError(
          String.format("day %d never occurs in %s (1-%d)", day, month, month.maxLength()),
          dayTok.span());
    }
    return new DayOfMonth(month, day);
  }

  // Dates

  private LocalDate parseDateExpr(LocalDate today) throws HolidayException {
    skipThe();
    Token tok = peek();
    if (tok == null) {
      throw parseError("unexpected end of input", endSpan());
    }

    return switch (tok.kind()) {
      case ISO_DATE -> {
        pos++;
        yield parseIsoDate(tok);
      }
      case TODAY -> {
        pos++;
        yield today;
      }
      case TOMORROW -> {
        pos++;
        yield today.plusDays(1);
      }
      case YESTERDAY -> {
        pos++;
        yield today.minusDays(1);
      }
      case IN -> parseRelative(today);
      case NEXT -> {
        pos++;
        Token dayTok = expect(TokenKind.DAY_NAME);
        yield today.with(TemporalAdjusters.next(dayTok.dayNameVal().toDayOfWeek()));
      }
      case MONTH_NAME, ORDINAL_NUMBER, NUMBER -> parseCalendarDate(today);
      default -> throw parseError("expected a date", tok.span());
    };
  }

  /** "in 3 days", "in 2 weeks", "in 1 month", "in 10 years". */
  private LocalDate parseRelative(LocalDate today) throws HolidayException {
    expect(TokenKind.IN);
    Token numTok = expect(TokenKind.NUMBER);
    int n = numTok.numberVal();
    Token unit = peek();
    if (unit == null) {
      throw parseError("expected days, weeks, months or years", endSpan());
    }
    pos++;
    try {
      return switch (unit.kind()) {
        case DAY -> today.plusDays(n);
        case WEEKS -> today.plusWeeks(n);
        case MONTH -> today.plusMonths(n);
        case YEAR -> today.plusYears(n);
        default -> throw parseError("expected days, weeks, months or years", unit.span());
      };
    } catch (DateTimeException e) {
      throw parseError("date out of range", numTok.span().to(unit.span()));
    }
  }

  /** "dec 25", "dec 25, 2027", "25th of december 2027". */
  private LocalDate parseCalendarDate(LocalDate today) throws HolidayException {
    DayOfMonth dom;
    Token tok = peek();
    if (tok.kind() == TokenKind.MONTH_NAME) {
      dom = (DayOfMonth) parseMonthFirst();
    } else {
      pos++;
      skip(TokenKind.OF);
      Token monthTok = expect(TokenKind.MONTH_NAME);
      dom = dayOfMonth(monthTok.monthNameVal(), tok);
    }

    skip(TokenKind.COMMA);
    if (check(TokenKind.NUMBER)) {
      Token yearTok = tokens.get(pos++);
      try {
        return LocalDate.of(yearTok.numberVal(), dom.month().number(), dom.day());
      } catch (DateTimeException e) {
        throw parseError("invalid date: " + e.getMessage(), yearTok.span());
      }
    }

    return dom.nextFrom(today)
        .orElseThrow(() -> parseError("date out of range", tok.span().to(endSpan())));
  }

  private LocalDate parseIsoDate(Token tok) throws HolidayException {
    try {
      return LocalDate.parse(tok.isoDateVal());
    } catch (DateTimeParseException e) {
      throw parseError("invalid date: " + tok.isoDateVal(), tok.span());
    }
  }

  // Helper methods

  private Token expectDay() throws HolidayException {
    Token tok = peek();
    if (tok != null
        && (tok.kind() == TokenKind.NUMBER || tok.kind() == TokenKind.ORDINAL_NUMBER)) {
      pos++;
      return tok;
    }
    throw parseError("expected day of month", tok != null ? tok.span() : endSpan());
  }

  private void skipThe() {
    skip(TokenKind.THE);
  }

  private void skip(TokenKind kind) {
    if (check(kind)) {
      pos++;
    }
  }

  private void expectEnd() throws HolidayException {
    Token tok = peek();
    if (tok != null) {
      throw parseError("unexpected token", tok.span());
    }
  }

  private Token peek() {
    return pos < tokens.size() ? tokens.get(pos) : null;
  }

  private boolean check(TokenKind kind) {
    Token tok = peek();
    return tok != null && tok.kind() == kind;
  }

  private Token expect(TokenKind kind) throws HolidayException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("expected " + kind + " but reached end of input", endSpan());
    }
    if (tok.kind() != kind) {
      throw parseError("expected " + kind + " but got " + tok.kind(), tok.span());
    }
    pos++;
    return tok;
  }

  private Span endSpan() {
    if (tokens.isEmpty()) {
      return new Span(0, 0);
    }
    Span lastSpan = tokens.get(tokens.size() - 1).span();
    return new Span(lastSpan.end(), lastSpan.end());
  }

  private Span fullSpan() {
    return tokens.get(0).span().to(tokens.get(tokens.size() - 1).span());
  }

  private HolidayException parseError(String message, Span span) {
    return HolidayException.parse(message, span, input, null);
  }

  private HolidayException parseError(String message, Span span, String suggestion) {
    return HolidayException.parse(message, span, input, suggestion);
  }
}
