package io.holiday.lexer;

import io.holiday.Span;
import io.holiday.date.MonthName;
import io.holiday.date.NthWeekday;
import io.holiday.date.Weekday;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param span the location in the input
 * @param dayNameVal the weekday value (for DAY_NAME tokens)
 * @param monthNameVal the month value (for MONTH_NAME tokens)
 * @param ordinalVal the ordinal value (for ORDINAL tokens)
 * @param numberVal the number value (for NUMBER and ORDINAL_NUMBER tokens)
 * @param isoDateVal the ISO date string (for ISO_DATE tokens)
 */
public record Token(
    TokenKind kind,
    Span span,
    Weekday dayNameVal,
    MonthName monthNameVal,
    NthWeekday ordinalVal,
    int numberVal,
    String isoDateVal) {
  /** Creates a simple keyword token. */
  public static Token keyword(TokenKind kind, Span span) {
    return new Token(kind, span, null, null, null, 0, null);
  }

  /** Creates a day name token. */
  public static Token dayName(Weekday day, Span span) {
    return new Token(TokenKind.DAY_NAME, span, day, null, null, 0, null);
  }

  /** Creates a month name token. */
  public static Token monthName(MonthName month, Span span) {
    return new Token(TokenKind.MONTH_NAME, span, null, month, null, 0, null);
  }

  /** Creates an ordinal token. */
  public static Token ordinal(NthWeekday ord, Span span) {
    return new Token(TokenKind.ORDINAL, span, null, null, ord, 0, null);
  }

  /** Creates a number token. */
  public static Token number(int value, Span span) {
    return new Token(TokenKind.NUMBER, span, null, null, null, value, null);
  }

  /** Creates an ordinal number token (e.g., "1st", "15th"). */
  public static Token ordinalNumber(int value, Span span) {
    return new Token(TokenKind.ORDINAL_NUMBER, span, null, null, null, value, null);
  }

  /** Creates an ISO date token. */
  public static Token isoDate(String date, Span span) {
    return new Token(TokenKind.ISO_DATE, span, null, null, null, 0, date);
  }

  /** Creates a comma token. */
  public static Token comma(Span span) {
    return new Token(TokenKind.COMMA, span, null, null, null, 0, null);
  }

  /**
   * Returns a copy of this token located at another span.
   *
   * @param at the new span
   * @return the relocated token
   */
  public Token withSpan(Span at) {
    return new Token(kind, at, dayNameVal, monthNameVal, ordinalVal, numberVal, isoDateVal);
  }
}
