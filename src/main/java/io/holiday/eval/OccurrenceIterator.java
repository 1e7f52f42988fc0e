package io.holiday.eval;

import io.holiday.AnnualDate;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks the occurrences of an {@link AnnualDate} forward and backward inside a window.
 *
 * <p>The window defaults to the first and last representable occurrences. {@link #next()} and
 * {@link #previous()} share one cursor, so a caller can advance and then walk back:
 *
 * <pre>{@code
 * OccurrenceIterator it = THANKSGIVING.iter().at(LocalDate.of(2020, 11, 1));
 * it.next();     // 2020-11-26
 * it.next();     // 2021-11-25
 * it.previous(); // 2020-11-26
 * }</pre>
 *
 * <p>Not safe for use by more than one thread.
 */
public final class OccurrenceIterator implements Iterator<LocalDate> {
  private final AnnualDate annual;
  private LocalDate first;
  private LocalDate last;
  private LocalDate current;

  /**
   * Creates an iterator spanning every representable occurrence, positioned at the first one.
   *
   * @param annual the date to enumerate
   */
  public OccurrenceIterator(AnnualDate annual) {
    this.annual = annual;
    this.first = annual.firstDate();
    this.last = annual.lastDate();
    this.current = first;
  }

  /**
   * Positions the cursor so the next forward step yields the occurrence on or after {@code date}.
   *
   * @param date the date to position at
   * @return this iterator
   * @throws DateTimeException if {@code date} is {@link LocalDate#MIN}, which has no day before it
   */
  public OccurrenceIterator at(LocalDate date) {
    current = date.minusDays(1);
    widen(date);
    return this;
  }

  /**
   * Sets the start of the window to the occurrence on or after {@code date}.
   *
   * @param date the start date
   * @return this iterator
   */
  public OccurrenceIterator startingAt(LocalDate date) {
    first = annual.after(date);
    widen(date);
    return this;
  }

  /**
   * Sets the end of the window to the occurrence strictly before {@code date}.
   *
   * @param date the end date
   * @return this iterator
   */
  public OccurrenceIterator endingAt(LocalDate date) {
    last = annual.before(date);
    widen(date);
    return this;
  }

  /**
   * Returns the start of the window.
   *
   * @return the first date
   */
  public LocalDate first() {
    return first;
  }

  /**
   * Returns the end of the window.
   *
   * @return the last date
   */
  public LocalDate last() {
    return last;
  }

  @Override
  public boolean hasNext() {
    return peekNext().isPresent();
  }

  @Override
  public LocalDate next() {
    LocalDate next = peekNext().orElseThrow(NoSuchElementException::new);
    current = next;
    return next;
  }

  /**
   * Returns true if a backward step would yield an occurrence.
   *
   * @return true if {@link #previous()} has an element
   */
  public boolean hasPrevious() {
    return !current.isBefore(first) && annual.previousFrom(current).isPresent();
  }

  /**
   * Steps the cursor back to the occurrence strictly before it.
   *
   * @return the previous occurrence
   * @throws NoSuchElementException if the cursor is already before the window
   */
  public LocalDate previous() {
    if (current.isBefore(first)) {
      throw new NoSuchElementException();
    }
    LocalDate prev = annual.previousFrom(current).orElseThrow(NoSuchElementException::new);
    current = prev;
    return prev;
  }

  /**
   * Returns the remaining forward occurrences as a lazy stream that advances this iterator.
   *
   * @return a stream of occurrences
   */
  public Stream<LocalDate> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  private Optional<LocalDate> peekNext() {
    LocalDate from;
    try {
      from = current.plusDays(1);
    } catch (DateTimeException e) {
      return Optional.empty();
    }
    return annual.nextFrom(from).filter(d -> !d.isAfter(last));
  }

  private void widen(LocalDate date) {
    if (date.isBefore(first)) {
      first = date;
    }
    if (date.isAfter(last)) {
      last = date;
    }
  }
}
