package io.holiday.lexer;

import io.holiday.HolidayException;
import io.holiday.Span;
import io.holiday.date.MonthName;
import io.holiday.date.NthWeekday;
import io.holiday.date.Weekday;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Tokenizes pattern and date expressions into a list of tokens. */
public final class Lexer {
  private final String input;
  private int pos;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes the input string into a list of tokens.
   *
   * @param input the input string to tokenize
   * @return a list of tokens
   * @throws HolidayException if the input contains invalid tokens
   */
  public static List<Token> tokenize(String input) throws HolidayException {
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() throws HolidayException {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespace();
      if (pos >= input.length()) {
        break;
      }

      int start = pos;
      char ch = input.charAt(pos);

      if (ch == ',') {
        pos++;
        tokens.add(Token.comma(new Span(start, pos)));
        continue;
      }

      if (isDigit(ch)) {
        tokens.add(lexNumberOrDate());
        continue;
      }

      if (isAlpha(ch)) {
        tokens.add(lexWord());
        continue;
      }

      throw HolidayException.lex(
          "unexpected character '" + ch + "'", new Span(start, start + 1), input);
    }

    return tokens;
  }

  private void skipWhitespace() {
    while (pos < input.length() && isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  private Token lexNumberOrDate() throws HolidayException {
    int start = pos;

    while (pos < input.length() && isDigit(input.charAt(pos))) {
      pos++;
    }
    String digits = input.substring(start, pos);

    // ISO date: YYYY-MM-DD
    if (digits.length() == 4 && pos < input.length() && input.charAt(pos) == '-') {
      String remaining = input.substring(start);
      if (remaining.length() >= 10
          && remaining.charAt(4) == '-'
          && isDigit(remaining.charAt(5))
          && isDigit(remaining.charAt(6))
          && remaining.charAt(7) == '-'
          && isDigit(remaining.charAt(8))
          && isDigit(remaining.charAt(9))) {
        pos = start + 10;
        return Token.isoDate(input.substring(start, pos), new Span(start, pos));
      }
      throw HolidayException.lex("malformed date", new Span(start, pos + 1), input);
    }

    if (digits.length() > 9) {
      throw HolidayException.lex("number too large", new Span(start, pos), input);
    }
    int num = Integer.parseInt(digits);

    // Ordinal suffix: st, nd, rd, th
    if (pos + 1 < input.length()) {
      String suffix = input.substring(pos, pos + 2).toLowerCase();
      if (suffix.equals("st")
          || suffix.equals("nd")
          || suffix.equals("rd")
          || suffix.equals("th")) {
        pos += 2;
        return Token.ordinalNumber(num, new Span(start, pos));
      }
    }

    return Token.number(num, new Span(start, pos));
  }

  private Token lexWord() throws HolidayException {
    int start = pos;
    while (pos < input.length() && (isAlphanumeric(input.charAt(pos)))) {
      pos++;
    }
    String word = input.substring(start, pos).toLowerCase();
    Span span = new Span(start, pos);

    Token tok = KEYWORD_MAP.get(word);
    if (tok == null) {
      throw HolidayException.lex("unknown word '" + word + "'", span, input);
    }
    return tok.withSpan(span);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAlpha(char c) {
    return Character.isLetter(c);
  }

  private static boolean isAlphanumeric(char c) {
    return isAlpha(c) || isDigit(c);
  }

  private static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r';
  }

  // Keyword map - values have dummy spans, actual spans are set when returning
  private static final Map<String, Token> KEYWORD_MAP = new HashMap<>();
  private static final Span DUMMY_SPAN = new Span(0, 0);

  static {
    KEYWORD_MAP.put("the", Token.keyword(TokenKind.THE, DUMMY_SPAN));
    KEYWORD_MAP.put("of", Token.keyword(TokenKind.OF, DUMMY_SPAN));
    KEYWORD_MAP.put("in", Token.keyword(TokenKind.IN, DUMMY_SPAN));
    KEYWORD_MAP.put("next", Token.keyword(TokenKind.NEXT, DUMMY_SPAN));
    KEYWORD_MAP.put("today", Token.keyword(TokenKind.TODAY, DUMMY_SPAN));
    KEYWORD_MAP.put("tomorrow", Token.keyword(TokenKind.TOMORROW, DUMMY_SPAN));
    KEYWORD_MAP.put("yesterday", Token.keyword(TokenKind.YESTERDAY, DUMMY_SPAN));
    KEYWORD_MAP.put("day", Token.keyword(TokenKind.DAY, DUMMY_SPAN));
    KEYWORD_MAP.put("days", Token.keyword(TokenKind.DAY, DUMMY_SPAN));
    KEYWORD_MAP.put("week", Token.keyword(TokenKind.WEEKS, DUMMY_SPAN));
    KEYWORD_MAP.put("weeks", Token.keyword(TokenKind.WEEKS, DUMMY_SPAN));
    KEYWORD_MAP.put("month", Token.keyword(TokenKind.MONTH, DUMMY_SPAN));
    KEYWORD_MAP.put("months", Token.keyword(TokenKind.MONTH, DUMMY_SPAN));
    KEYWORD_MAP.put("year", Token.keyword(TokenKind.YEAR, DUMMY_SPAN));
    KEYWORD_MAP.put("years", Token.keyword(TokenKind.YEAR, DUMMY_SPAN));

    for (Weekday day : Weekday.values()) {
      Token tok = Token.dayName(day, DUMMY_SPAN);
      KEYWORD_MAP.put(day.toString(), tok);
      KEYWORD_MAP.put(day.toString().substring(0, 3), tok);
    }
    KEYWORD_MAP.put("tues", Token.dayName(Weekday.TUESDAY, DUMMY_SPAN));
    KEYWORD_MAP.put("thur", Token.dayName(Weekday.THURSDAY, DUMMY_SPAN));
    KEYWORD_MAP.put("thurs", Token.dayName(Weekday.THURSDAY, DUMMY_SPAN));

    for (String name :
        new String[] {
          "january", "jan", "february", "feb", "march", "mar", "april", "apr", "may", "june",
          "jun", "july", "jul", "august", "aug", "september", "sept", "sep", "october", "oct",
          "november", "nov", "december", "dec"
        }) {
      KEYWORD_MAP.put(name, Token.monthName(MonthName.parse(name).orElseThrow(), DUMMY_SPAN));
    }

    for (NthWeekday ord : NthWeekday.values()) {
      KEYWORD_MAP.put(ord.toString(), Token.ordinal(ord, DUMMY_SPAN));
    }
  }
}
