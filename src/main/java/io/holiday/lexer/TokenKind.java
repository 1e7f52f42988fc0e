package io.holiday.lexer;

/** The type of token. */
public enum TokenKind {
  // Keywords
  /** The "the" keyword. */
  THE,
  /** The "of" keyword. */
  OF,
  /** The "in" keyword. */
  IN,
  /** The "next" keyword. */
  NEXT,
  /** The "today" keyword. */
  TODAY,
  /** The "tomorrow" keyword. */
  TOMORROW,
  /** The "yesterday" keyword. */
  YESTERDAY,
  /** The "day" or "days" keyword. */
  DAY,
  /** The "week" or "weeks" keyword. */
  WEEKS,
  /** The "month" or "months" keyword. */
  MONTH,
  /** The "year" or "years" keyword. */
  YEAR,

  // Value-carrying tokens
  /** A day-of-week name (e.g., "monday"). */
  DAY_NAME,
  /** A month name (e.g., "jan"). */
  MONTH_NAME,
  /** An ordinal word (e.g., "first", "last"). */
  ORDINAL,
  /** A numeric literal. */
  NUMBER,
  /** An ordinal number (e.g., "1st", "15th"). */
  ORDINAL_NUMBER,
  /** An ISO date (e.g., "2024-01-15"). */
  ISO_DATE,
  /** A comma separator. */
  COMMA
}
