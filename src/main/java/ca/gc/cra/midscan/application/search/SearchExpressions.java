package ca.gc.cra.midscan.application.search;

import ca.gc.cra.midscan.application.search.SearchQuery.DateWindowQuery;
import ca.gc.cra.midscan.application.search.SearchQuery.HeaderQuery;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders {@link SearchQuery} values into IMAP {@code SEARCH} requests.
 *
 * @since 0.1.0
 */
public final class SearchExpressions {
  private static final DateTimeFormatter IMAP_DATE = DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH);

  private SearchExpressions() {
    // Utility
  }

  /**
   * Renders a query.
   *
   * @param query query to render
   * @return wire-ready expression
   * @throws IllegalArgumentException if a value cannot be carried by the requested encoding
   */
  public static SearchExpression render(SearchQuery query) {
    if (query instanceof HeaderQuery header) {
      return renderHeader(header);
    }
    DateWindowQuery window = (DateWindowQuery) query;
    return new SearchExpression(
        "SEARCH SINCE " + imapDate(window.since()) + " BEFORE " + imapDate(window.beforeExclusive()),
        List.of());
  }

  /**
   * Formats a date the way IMAP search keys expect ({@code 12-Feb-2024}).
   *
   * @param date calendar date
   * @return IMAP date text
   */
  public static String imapDate(LocalDate date) {
    return IMAP_DATE.format(date);
  }

  /**
   * Writes a value as an IMAP quoted string, escaping backslash and double quote.
   *
   * @param value raw value
   * @return quoted string including the surrounding quotes
   * @throws IllegalArgumentException if the value contains CR or LF, which quoted strings cannot carry
   */
  public static String quote(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '\r' || c == '\n') {
        throw new IllegalArgumentException("quoted search value must not contain line breaks");
      }
      if (c == '"' || c == '\\') {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.append('"').toString();
  }

  private static SearchExpression renderHeader(HeaderQuery header) {
    return switch (header.encoding()) {
      case STRUCTURED -> new SearchExpression("SEARCH HEADER", List.of(header.field(), header.value()));
      case QUOTED_LITERAL -> new SearchExpression(
          "SEARCH (HEADER " + quote(header.field()) + " " + quote(header.value()) + ")", List.of());
    };
  }
}
