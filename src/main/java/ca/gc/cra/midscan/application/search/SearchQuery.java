package ca.gc.cra.midscan.application.search;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Logical search request before it is rendered for the wire.
 *
 * @since 0.1.0
 */
public sealed interface SearchQuery permits SearchQuery.HeaderQuery, SearchQuery.DateWindowQuery {

  /**
   * Header-contains-value search.
   *
   * @param field header field name, e.g. {@code Message-ID}
   * @param value substring the header must contain
   * @param encoding wire encoding
   */
  record HeaderQuery(String field, String value, SearchEncoding encoding) implements SearchQuery {
    public HeaderQuery {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(value, "value");
      Objects.requireNonNull(encoding, "encoding");
    }
  }

  /**
   * Delivery-date range search covering {@code since} through {@code until}, both days included.
   *
   * @param since first day (inclusive)
   * @param until last day (inclusive)
   */
  record DateWindowQuery(LocalDate since, LocalDate until) implements SearchQuery {
    public DateWindowQuery {
      Objects.requireNonNull(since, "since");
      Objects.requireNonNull(until, "until");
      if (until.isBefore(since)) {
        throw new IllegalArgumentException("until must not precede since");
      }
    }

    /**
     * Returns the exclusive bound sent in {@code BEFORE}, the day after {@link #until()}.
     *
     * @return day after the window
     */
    public LocalDate beforeExclusive() {
      return until.plusDays(1);
    }
  }
}
