package io.holiday;

/** The type of error that occurred while reading holiday names, patterns or dates. */
public enum ErrorKind {
  /** Lexer error - invalid characters or words in input. */
  LEX("lex"),
  /** Parser error - words in an order that is not a pattern or date. */
  PARSE("parse"),
  /** Lookup error - no named holiday matches the input. */
  LOOKUP("lookup");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
