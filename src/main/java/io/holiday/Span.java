package io.holiday;

/**
 * A range of character positions in a pattern or date expression.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns the length of this span, never less than one so it can be underlined.
   *
   * @return the number of characters covered
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Joins this span with a later one, covering both and everything between.
   *
   * @param later a span that ends at or after this one
   * @return the joined span
   */
  public Span to(Span later) {
    return new Span(start, Math.max(end, later.end()));
  }
}
